package com.creditsim.simulator;

import com.creditsim.common.model.BehaviorProfile;
import com.creditsim.common.model.Participant;
import com.creditsim.common.model.Scenario;
import com.creditsim.common.model.ScenarioEvent;
import com.creditsim.common.model.ScenarioSettings;
import com.creditsim.common.model.TrustLine;
import com.creditsim.simulator.cache.RoutingCache;
import com.creditsim.simulator.config.SimulatorSettings;
import com.creditsim.simulator.run.RunState;
import com.creditsim.simulator.scenario.ScenarioGraph;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/** Scenario and run builders shared by engine tests. */
public final class Fixtures {

    public static final String UAH = "UAH";

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private Fixtures() {}

    public static Participant person(String id) {
        return new Participant(id, id, "person", Participant.STATUS_ACTIVE, null, null);
    }

    public static Participant person(String id, String group, String profileId) {
        return new Participant(id, id, "person", Participant.STATUS_ACTIVE, group, profileId);
    }

    /** {@code creditor} trusts {@code debtor} up to {@code limit}: the debtor can pay the creditor. */
    public static TrustLine line(String creditor, String debtor, String limit) {
        return new TrustLine(creditor, debtor, UAH, new BigDecimal(limit), TrustLine.STATUS_ACTIVE);
    }

    public static Scenario scenario(String id, List<Participant> participants, List<TrustLine> lines) {
        return new Scenario(id, List.of(UAH), participants, lines, List.of(), List.of(), null);
    }

    public static Scenario scenario(String id, List<Participant> participants, List<TrustLine> lines,
                                    List<BehaviorProfile> profiles, List<ScenarioEvent> events,
                                    ScenarioSettings settings) {
        return new Scenario(id, List.of(UAH), participants, lines, profiles, events, settings);
    }

    /** A, B, C trusting each other around a ring, 1000 each way, plus a few chords. */
    public static Scenario ring() {
        return scenario("ring",
            List.of(person("A"), person("B"), person("C"), person("D")),
            List.of(line("B", "A", "1000"), line("C", "B", "1000"), line("A", "C", "1000"),
                    line("A", "B", "1000"), line("B", "C", "1000"), line("C", "A", "1000"),
                    line("D", "A", "1000"), line("A", "D", "1000")));
    }

    public static ScenarioSettings trustDrift(double growth, double decay, double maxGrowth,
                                              double minRatio, double threshold) {
        return new ScenarioSettings(null, null,
            new ScenarioSettings.TrustDrift(true, growth, decay, maxGrowth, minRatio, threshold));
    }

    public static RunState run(Scenario scenario) {
        return run(scenario, SimulatorSettings.defaults(), 42L, 100);
    }

    public static RunState run(Scenario scenario, SimulatorSettings settings, long seed, int intensity) {
        return run("run-1", scenario, settings, seed, intensity);
    }

    public static RunState run(String runId, Scenario scenario, SimulatorSettings settings, long seed, int intensity) {
        return new RunState(runId, scenario.scenarioId(), seed, intensity,
            ScenarioGraph.of(scenario, new RoutingCache()), settings, CLOCK);
    }
}
