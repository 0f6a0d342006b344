package com.creditsim.simulator.scenario;

import com.creditsim.common.model.Participant;
import com.creditsim.common.model.Scenario;
import com.creditsim.common.model.TrustLine;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable home of scenario documents. Runs read a scenario once at creation and then
 * work on their own {@link ScenarioGraph} mirror.
 */
public interface ScenarioStore {

    /** Emits the scenario or completes empty when unknown. */
    Mono<Scenario> get(String scenarioId);

    Mono<Scenario> save(Scenario scenario);

    Flux<Scenario> list();

    // ── in-place patches from inject events and trust drift ──────────────────

    /** Inserts or replaces the trust line with the same creditor, debtor and equivalent. */
    Mono<Void> patchTrustLine(String scenarioId, TrustLine trustLine);

    /** Inserts or replaces the participant with the same id. */
    Mono<Void> patchParticipant(String scenarioId, Participant participant);
}
