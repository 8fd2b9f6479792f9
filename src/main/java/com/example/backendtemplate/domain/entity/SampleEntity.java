package com.example.backendtemplate.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Illustrative entity showing the supported column kinds: UUID references,
 * short and long text, JSONB documents and a big integer.
 */
@Entity
@Table(name = "sample_table", indexes = {
        @Index(name = "idx_sample_string_field", columnList = "string_field"),
        @Index(name = "idx_sample_active_deleted", columnList = "is_active, is_deleted")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SampleEntity extends BaseEntity {

    /**
     * Placeholder for a foreign key reference
     */
    @Column(name = "required_uuid", nullable = false)
    private UUID requiredUuid;

    @Column(name = "optional_uuid")
    private UUID optionalUuid;

    @Column(name = "string_field", nullable = false)
    private String stringField;

    @Column(name = "optional_text", columnDefinition = "text")
    private String optionalText;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "required_jsonb", columnDefinition = "jsonb", nullable = false)
    @Builder.Default
    private Map<String, Object> requiredJsonb = new HashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "optional_jsonb", columnDefinition = "jsonb")
    private Map<String, Object> optionalJsonb;

    @Column(name = "big_int", nullable = false)
    @Builder.Default
    private Long bigInt = 1L;
}
