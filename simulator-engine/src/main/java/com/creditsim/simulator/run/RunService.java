package com.creditsim.simulator.run;

import com.creditsim.common.exception.ScenarioNotFoundException;
import com.creditsim.simulator.cache.RoutingCache;
import com.creditsim.simulator.clearing.ClearingCoordinator;
import com.creditsim.simulator.config.SimulatorSettings;
import com.creditsim.simulator.job.TickScheduler;
import com.creditsim.simulator.scenario.ScenarioGraph;
import com.creditsim.simulator.scenario.ScenarioStore;
import com.creditsim.simulator.strategy.AdaptiveClearingPolicy;
import com.creditsim.simulator.strategy.AdaptiveClearingPolicyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Run lifecycle: create, pause, resume, stop and intensity changes.
 *
 * <p>Every transition emits {@code run_status}. {@code stop} ends the tick loop, which
 * cancels a tick in progress with its in-flight payments, and cancels any detached
 * clearing pass; the run is reported {@code stopped} only after both have wound down.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    static final Duration CLEARING_STOP_GRACE = Duration.ofSeconds(5);

    private final ScenarioStore                scenarioStore;
    private final RoutingCache                 routingCache;
    private final RunRegistry                  registry;
    private final TickScheduler                scheduler;
    private final ClearingCoordinator          clearing;
    private final RunStatusPublisher           statusPublisher;
    private final SimulatorSettings            settings;
    private final AdaptiveClearingPolicyConfig adaptiveConfig;
    private final Clock                        clock;

    public RunService(ScenarioStore scenarioStore,
                      RoutingCache routingCache,
                      RunRegistry registry,
                      TickScheduler scheduler,
                      ClearingCoordinator clearing,
                      RunStatusPublisher statusPublisher,
                      SimulatorSettings settings,
                      AdaptiveClearingPolicyConfig adaptiveConfig,
                      Clock clock) {
        this.scenarioStore   = scenarioStore;
        this.routingCache    = routingCache;
        this.registry        = registry;
        this.scheduler       = scheduler;
        this.clearing        = clearing;
        this.statusPublisher = statusPublisher;
        this.settings        = settings;
        this.adaptiveConfig  = adaptiveConfig;
        this.clock           = clock;
    }

    /**
     * Creates a running run over {@code scenarioId} and starts its tick loop.
     * Fails with {@link ScenarioNotFoundException} for an unknown scenario.
     */
    public Mono<RunState> create(String scenarioId, long seed, int intensityPercent) {
        return scenarioStore.get(scenarioId)
            .switchIfEmpty(Mono.error(() -> new ScenarioNotFoundException(scenarioId)))
            .flatMap(scenario -> {
                RunState run = new RunState(UUID.randomUUID().toString(), scenarioId, seed, intensityPercent,
                    ScenarioGraph.of(scenario, routingCache), settings, clock);
                if (settings.isAdaptive()) {
                    run.setClearingPolicy(new AdaptiveClearingPolicy(adaptiveConfig));
                }
                registry.register(run);
                log.info("RUN_CREATED runId={} scenarioId={} seed={} intensity={} clearingPolicy={}",
                         run.getRunId(), scenarioId, seed, run.getIntensityPercent(), settings.clearingPolicy());
                return statusPublisher.publish(run)
                    .then(Mono.fromRunnable(() -> scheduler.start(run)))
                    .thenReturn(run);
            });
    }

    public RunState get(String runId) {
        return registry.get(runId);
    }

    public Mono<RunState> pause(String runId) {
        return transition(runId, RunStatus.PAUSED, "pause");
    }

    public Mono<RunState> resume(String runId) {
        return transition(runId, RunStatus.RUNNING, "resume");
    }

    public Mono<RunState> stop(String runId) {
        return Mono.defer(() -> {
            RunState run = registry.get(runId);
            run.transitionTo(RunStatus.STOPPING, "stop");
            return scheduler.stop(run)
                .then(clearing.cancelAndAwait(run, CLEARING_STOP_GRACE))
                .then(Mono.defer(() -> {
                    run.transitionTo(RunStatus.STOPPED, "stop");
                    log.info("RUN_STOPPED runId={} tick={} committed={} rejected={} errors={}",
                             runId, run.getTickIndex(), run.getCommitted(), run.getRejected(), run.getErrors());
                    return statusPublisher.publish(run).thenReturn(run);
                }));
        });
    }

    public Mono<RunState> setIntensity(String runId, int intensityPercent) {
        return Mono.defer(() -> {
            RunState run = registry.get(runId);
            run.setIntensityPercent(intensityPercent);
            log.info("RUN_INTENSITY_CHANGED runId={} intensity={}", runId, run.getIntensityPercent());
            return statusPublisher.publish(run).thenReturn(run);
        });
    }

    private Mono<RunState> transition(String runId, RunStatus target, String action) {
        return Mono.defer(() -> {
            RunState run = registry.get(runId);
            run.transitionTo(target, action);
            log.info("RUN_STATE_CHANGED runId={} action={} state={}", runId, action, target.wireName());
            return statusPublisher.publish(run).thenReturn(run);
        });
    }
}
