package com.example.backendtemplate.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

/**
 * Request DTO for creating a sample entity
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSampleRequest {

    @NotNull(message = "Required UUID is required")
    private UUID requiredUuid;

    @NotBlank(message = "String field is required")
    @Size(max = 255, message = "String field must be at most 255 characters")
    private String stringField;

    @NotNull(message = "Required JSONB is required")
    private Map<String, Object> requiredJsonb;

    private UUID optionalUuid;

    private String optionalText;

    private Map<String, Object> optionalJsonb;

    @Min(value = 0, message = "Big int must not be negative")
    @Builder.Default
    private Long bigInt = 1L;
}
