package com.creditsim.simulator.run;

import com.creditsim.common.exception.RunNotFoundException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Live runs of this process by id. */
@Component
public class RunRegistry {

    private final Map<String, RunState> runs = new ConcurrentHashMap<>();

    public void register(RunState run) {
        runs.put(run.getRunId(), run);
    }

    /** @throws RunNotFoundException when no run has {@code runId} */
    public RunState get(String runId) {
        RunState run = runs.get(runId);
        if (run == null) {
            throw new RunNotFoundException(runId);
        }
        return run;
    }

    public Optional<RunState> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public List<RunState> all() {
        return new ArrayList<>(runs.values());
    }
}
