package com.creditsim.common.exception;

public class ScenarioNotFoundException extends SimulatorException {

    public ScenarioNotFoundException(String scenarioId) {
        super("SCENARIO_NOT_FOUND", "No scenario with id=" + scenarioId);
    }
}
