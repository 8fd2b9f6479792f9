package com.example.backendtemplate.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for sample entity data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SampleResponse {

    private UUID id;
    private UUID requiredUuid;
    private UUID optionalUuid;
    private String stringField;
    private String optionalText;
    private Map<String, Object> requiredJsonb;
    private Map<String, Object> optionalJsonb;
    private Long bigInt;
    private boolean active;
    private boolean deleted;
    private Instant createdOn;
    private Instant modifiedOn;
}
