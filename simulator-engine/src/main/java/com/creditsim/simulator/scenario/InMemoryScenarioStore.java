package com.creditsim.simulator.scenario;

import com.creditsim.common.exception.ScenarioValidationException;
import com.creditsim.common.model.Participant;
import com.creditsim.common.model.Scenario;
import com.creditsim.common.model.TrustLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ScenarioStore}. Patches replace the stored document; runs that
 * already hold a {@link ScenarioGraph} are not affected by them.
 */
public class InMemoryScenarioStore implements ScenarioStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryScenarioStore.class);

    private final Map<String, Scenario> scenarios = new ConcurrentHashMap<>();

    @Override
    public Mono<Scenario> get(String scenarioId) {
        return Mono.justOrEmpty(scenarios.get(scenarioId));
    }

    @Override
    public Mono<Scenario> save(Scenario scenario) {
        return Mono.fromCallable(() -> {
            validate(scenario);
            scenarios.put(scenario.scenarioId(), scenario);
            log.info("[Scenario] Stored. scenarioId={} participants={} trustlines={} events={}",
                     scenario.scenarioId(), scenario.participants().size(),
                     scenario.trustlines().size(), scenario.events().size());
            return scenario;
        });
    }

    @Override
    public Flux<Scenario> list() {
        return Flux.fromIterable(scenarios.values());
    }

    @Override
    public Mono<Void> patchTrustLine(String scenarioId, TrustLine trustLine) {
        return Mono.fromRunnable(() -> scenarios.computeIfPresent(scenarioId, (id, current) -> {
            List<TrustLine> lines = new ArrayList<>();
            boolean replaced = false;
            for (TrustLine tl : current.trustlines()) {
                if (tl.key().equals(trustLine.key())) {
                    lines.add(trustLine);
                    replaced = true;
                } else {
                    lines.add(tl);
                }
            }
            if (!replaced) lines.add(trustLine);
            return new Scenario(current.scenarioId(), current.equivalents(), current.participants(),
                lines, current.behaviorProfiles(), current.events(), current.settings());
        }));
    }

    @Override
    public Mono<Void> patchParticipant(String scenarioId, Participant participant) {
        return Mono.fromRunnable(() -> scenarios.computeIfPresent(scenarioId, (id, current) -> {
            List<Participant> participants = new ArrayList<>();
            boolean replaced = false;
            for (Participant p : current.participants()) {
                if (p.id().equals(participant.id())) {
                    participants.add(participant);
                    replaced = true;
                } else {
                    participants.add(p);
                }
            }
            if (!replaced) participants.add(participant);
            return new Scenario(current.scenarioId(), current.equivalents(), participants,
                current.trustlines(), current.behaviorProfiles(), current.events(), current.settings());
        }));
    }

    private static void validate(Scenario scenario) {
        if (scenario.scenarioId() == null || scenario.scenarioId().isBlank()) {
            throw new ScenarioValidationException("scenarioId is required");
        }
        for (TrustLine tl : scenario.trustlines()) {
            if (tl.from() == null || tl.to() == null || tl.equivalent() == null) {
                throw new ScenarioValidationException("trust line needs from/to/equivalent: " + tl);
            }
            if (tl.from().equals(tl.to())) {
                throw new ScenarioValidationException("self trust line: " + tl.from());
            }
        }
    }
}
