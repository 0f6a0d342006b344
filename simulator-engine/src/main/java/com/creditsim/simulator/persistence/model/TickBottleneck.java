package com.creditsim.simulator.persistence.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One entry of a top-offending-edges snapshot. Natural key:
 * {@code (runId, equivalent, computedAt, targetId)}.
 */
@Data
@NoArgsConstructor
@Table("tick_bottlenecks")
public class TickBottleneck {

    @Id
    private Long id;

    private String runId;

    private String equivalent;

    private LocalDateTime computedAt;

    private String targetType;

    private String targetId;

    private double score;

    private String reasonCode;

    private int attempts;

    private int committed;

    private int rejected;

    private int errors;

    private int timeouts;
}
