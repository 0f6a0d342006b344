package com.creditsim.common.exception;

public class RunNotFoundException extends SimulatorException {

    public RunNotFoundException(String runId) {
        super("RUN_NOT_FOUND", "No run with id=" + runId);
    }
}
