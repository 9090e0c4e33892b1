package com.github.salilvnair.convstage.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(
        name = "cs_stage_rule",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_cs_stage_rule_device_stage", columnNames = {"device_id", "stage"})
        },
        indexes = {
                @Index(name = "idx_cs_stage_rule_device", columnList = "device_id")
        }
)
@Data
public class CsStageRule {

    public static final int MAX_KEY_LENGTH = 255;
    public static final int MAX_LITERAL_LENGTH = 4000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "device_id", nullable = false, length = MAX_KEY_LENGTH)
    private String deviceId;

    @Column(name = "stage", nullable = false, length = MAX_KEY_LENGTH)
    private String stage;

    @Column(name = "input_type", nullable = false)
    private String inputType;

    @Column(name = "source_column", length = MAX_KEY_LENGTH)
    private String sourceColumn;

    @Column(name = "literal_value", length = MAX_LITERAL_LENGTH)
    private String literalValue;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
