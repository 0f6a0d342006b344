package com.creditsim.common.exception;

public class ScenarioValidationException extends SimulatorException {

    public ScenarioValidationException(String message) {
        super("SCENARIO_INVALID", message);
    }
}
