package com.creditsim.simulator.controller;

import com.creditsim.simulator.EngineHarness;
import com.creditsim.simulator.Fixtures;
import com.creditsim.simulator.cache.RoutingCache;
import com.creditsim.simulator.config.SimulatorSettings;
import com.creditsim.simulator.job.TickScheduler;
import com.creditsim.simulator.ledger.InMemoryLedger;
import com.creditsim.simulator.run.RunService;
import com.creditsim.simulator.strategy.AdaptiveClearingPolicyConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.Map;

class RunControllerTest {

    private static final SimulatorSettings SLOW = new SimulatorSettings(
        60_000, 1_000, 20, 1, 25, SimulatorSettings.POLICY_STATIC, 6, 250, 8.0,
        50, 200, 3, 2_000, null, true, 1, 10, 5_000);

    private EngineHarness harness;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        harness = new EngineHarness(new InMemoryLedger(new RoutingCache(), Duration.ofSeconds(1)));
        RunService runService = new RunService(harness.store, new RoutingCache(), harness.registry,
            new TickScheduler(harness.orchestrator, harness.statusPublisher), harness.clearing,
            harness.statusPublisher, SLOW,
            new AdaptiveClearingPolicyConfig(3, 0.60, 0.30, 2, 8, 3, 6, 50, 250, 6, 250, 0), Fixtures.CLOCK);
        client = WebTestClient.bindToController(
                new RunController(runService, harness.bus),
                new ScenarioController(harness.store))
            .build();
    }

    @AfterEach
    void tearDown() {
        harness.registry.all().forEach(run -> {
            if (run.getTickLoop() != null) run.getTickLoop().dispose();
        });
        harness.close();
    }

    private String createRun() {
        return client.post().uri("/api/v1/runs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("scenarioId", "ring", "seed", 11))
            .exchange()
            .expectStatus().isCreated()
            .expectBody(RunView.class)
            .returnResult().getResponseBody()
            .runId();
    }

    @Test
    @DisplayName("scenarios can be stored, listed and fetched")
    void scenarios() {
        client.post().uri("/api/v1/scenarios")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Fixtures.ring())
            .exchange()
            .expectStatus().isCreated()
            .expectBody().jsonPath("$.scenarioId").isEqualTo("ring");

        client.get().uri("/api/v1/scenarios/ring")
            .exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.participants.length()").isEqualTo(4);

        client.get().uri("/api/v1/scenarios/nope")
            .exchange()
            .expectStatus().isNotFound()
            .expectBody().jsonPath("$.code").isEqualTo("SCENARIO_NOT_FOUND");
    }

    @Test
    @DisplayName("a run is created at full intensity and controlled through its endpoints")
    void runLifecycle() {
        harness.store.save(Fixtures.ring()).block();
        String runId = createRun();

        client.get().uri("/api/v1/runs/{id}", runId)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status.state").isEqualTo("running")
            .jsonPath("$.status.intensityPercent").isEqualTo(100)
            .jsonPath("$.mode").isEqualTo("real");

        client.post().uri("/api/v1/runs/{id}/pause", runId)
            .exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.status.state").isEqualTo("paused");

        client.put().uri("/api/v1/runs/{id}/intensity", runId)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("intensityPercent", 40))
            .exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.status.intensityPercent").isEqualTo(40);

        client.post().uri("/api/v1/runs/{id}/pause", runId)
            .exchange()
            .expectStatus().isEqualTo(409)
            .expectBody().jsonPath("$.code").isEqualTo("RUN_STATE_CONFLICT");

        client.post().uri("/api/v1/runs/{id}/stop", runId)
            .exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.status.state").isEqualTo("stopped");
    }

    @Test
    @DisplayName("unknown runs and scenarios map to not found")
    void notFound() {
        client.get().uri("/api/v1/runs/missing")
            .exchange()
            .expectStatus().isNotFound()
            .expectBody().jsonPath("$.code").isEqualTo("RUN_NOT_FOUND");

        client.post().uri("/api/v1/runs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("scenarioId", "missing", "seed", 1))
            .exchange()
            .expectStatus().isNotFound()
            .expectBody().jsonPath("$.code").isEqualTo("SCENARIO_NOT_FOUND");
    }
}
