package com.creditsim.simulator.run;

import com.creditsim.simulator.ledger.LedgerSession;
import com.creditsim.simulator.scenario.ScenarioGraph;

/** What one tick works with: the run and the tick's own ledger session. */
public record TickContext(RunState run, LedgerSession session) {

    public ScenarioGraph graph() {
        return run.getGraph();
    }

    public String runId() {
        return run.getRunId();
    }

    public long tickIndex() {
        return run.getTickIndex();
    }
}
