package com.creditsim.simulator.run;

import java.util.EnumSet;
import java.util.Set;

/**
 * Run lifecycle: RUNNING ⇄ PAUSED → STOPPING → STOPPED, or any live state → ERROR.
 */
public enum RunStatus {
    RUNNING, PAUSED, STOPPING, STOPPED, ERROR;

    public boolean isTerminal() {
        return this == STOPPED || this == ERROR;
    }

    public boolean canTransitionTo(RunStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<RunStatus> allowedTargets() {
        return switch (this) {
            case RUNNING  -> EnumSet.of(PAUSED, STOPPING, ERROR);
            case PAUSED   -> EnumSet.of(RUNNING, STOPPING, ERROR);
            case STOPPING -> EnumSet.of(STOPPED, ERROR);
            case STOPPED, ERROR -> EnumSet.noneOf(RunStatus.class);
        };
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
