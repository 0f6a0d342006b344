package com.creditsim.common.exception;

/** Thrown when an action is not allowed in the run's current lifecycle state. */
public class RunStateException extends SimulatorException {

    public RunStateException(String runId, String state, String action) {
        super("RUN_STATE_CONFLICT", "Cannot " + action + " run " + runId + " in state " + state);
    }
}
