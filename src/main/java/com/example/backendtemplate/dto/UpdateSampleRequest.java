package com.example.backendtemplate.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

/**
 * Request DTO for updating a sample entity. Only non-null fields are applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSampleRequest {

    private UUID requiredUuid;

    private UUID optionalUuid;

    @Size(min = 1, max = 255, message = "String field must be between 1 and 255 characters")
    private String stringField;

    private String optionalText;

    private Map<String, Object> requiredJsonb;

    private Map<String, Object> optionalJsonb;

    @Min(value = 0, message = "Big int must not be negative")
    private Long bigInt;

    private Boolean active;

    @JsonIgnore
    public boolean isEmpty() {
        return requiredUuid == null && optionalUuid == null && stringField == null && optionalText == null
                && requiredJsonb == null && optionalJsonb == null && bigInt == null && active == null;
    }
}
