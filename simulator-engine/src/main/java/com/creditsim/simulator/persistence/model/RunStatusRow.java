package com.creditsim.simulator.persistence.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/** Latest status of a run, one row per run. */
@Data
@NoArgsConstructor
@Table("run_status")
public class RunStatusRow {

    @Id
    private String runId;

    private String scenarioId;

    private String state;

    private long tickIndex;

    private long simTimeMs;

    private int intensityPercent;

    private long attempts;

    private long committed;

    private long rejected;

    private long errors;

    private long timeouts;

    private String lastErrorCode;

    private String lastErrorMessage;

    private LocalDateTime updatedAt;
}
