package com.creditsim.simulator.persistence.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * One metric value of one equivalent at one simulated time. Natural key:
 * {@code (runId, equivalent, metricKey, tMs)}.
 */
@Data
@NoArgsConstructor
@Table("tick_metrics")
public class TickMetric {

    @Id
    private Long id;

    private String runId;

    private String equivalent;

    private String metricKey;

    private long tMs;

    private double metricValue;
}
