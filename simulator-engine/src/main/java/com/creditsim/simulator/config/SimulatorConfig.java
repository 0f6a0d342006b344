package com.creditsim.simulator.config;

import com.creditsim.common.model.Scenario;
import com.creditsim.simulator.cache.RoutingCache;
import com.creditsim.simulator.ledger.InMemoryLedger;
import com.creditsim.simulator.ledger.LedgerService;
import com.creditsim.simulator.scenario.InMemoryScenarioStore;
import com.creditsim.simulator.scenario.ScenarioStore;
import com.creditsim.simulator.strategy.AdaptiveClearingPolicyConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class SimulatorConfig {

    private static final Logger log = LoggerFactory.getLogger(SimulatorConfig.class);

    @Value("${simulator.tick-interval-ms:1000}")            private long    tickIntervalMs;
    @Value("${simulator.sim-step-ms:1000}")                 private long    simStepMs;
    @Value("${simulator.actions-per-tick-max:20}")          private int     actionsPerTickMax;
    @Value("${simulator.max-in-flight:1}")                  private int     maxInFlight;
    @Value("${simulator.clearing-every-n-ticks:25}")        private int     clearingEveryNTicks;
    @Value("${simulator.clearing-policy:static}")           private String  clearingPolicy;
    @Value("${simulator.clearing-max-depth:6}")             private int     clearingMaxDepth;
    @Value("${simulator.clearing-time-budget-ms:250}")      private int     clearingTimeBudgetMs;
    @Value("${simulator.clearing-hard-timeout-cap-sec:8.0}") private double clearingHardTimeoutCapSec;
    @Value("${simulator.max-timeouts-per-tick:50}")         private int     maxTimeoutsPerTick;
    @Value("${simulator.max-errors-total:200}")             private int     maxErrorsTotal;
    @Value("${simulator.max-consec-tick-failures:3}")       private int     maxConsecTickFailures;
    @Value("${simulator.payment-timeout-ms:2000}")          private long    paymentTimeoutMs;
    @Value("${simulator.amount-cap:}")                      private String  amountCap;
    @Value("${simulator.inject-enabled:true}")              private boolean injectEnabled;
    @Value("${simulator.metrics-every-n-ticks:1}")          private int     metricsEveryNTicks;
    @Value("${simulator.bottlenecks-every-n-ticks:10}")     private int     bottlenecksEveryNTicks;
    @Value("${simulator.artifacts-every-ms:5000}")          private long    artifactsEveryMs;
    @Value("${simulator.ledger.lock-timeout-ms:5000}")      private long    ledgerLockTimeoutMs;
    @Value("${simulator.scenarios-location:classpath*:scenarios/*.json}") private String scenariosLocation;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SimulatorSettings simulatorSettings() {
        SimulatorSettings settings = new SimulatorSettings(
            tickIntervalMs, simStepMs, actionsPerTickMax, maxInFlight,
            clearingEveryNTicks, clearingPolicy, clearingMaxDepth, clearingTimeBudgetMs, clearingHardTimeoutCapSec,
            maxTimeoutsPerTick, maxErrorsTotal, maxConsecTickFailures, paymentTimeoutMs,
            amountCap == null || amountCap.isBlank() ? null : new BigDecimal(amountCap.trim()),
            injectEnabled, metricsEveryNTicks, bottlenecksEveryNTicks, artifactsEveryMs);
        log.info("[Config] Simulator settings. tickIntervalMs={} simStepMs={} actionsPerTickMax={} maxInFlight={} "
                 + "clearingPolicy={} clearingEveryNTicks={}",
                 tickIntervalMs, simStepMs, actionsPerTickMax, maxInFlight, clearingPolicy, clearingEveryNTicks);
        return settings;
    }

    /** Adaptive policy bounds, capped by the static clearing depth and budget. */
    @Bean
    public AdaptiveClearingPolicyConfig adaptiveClearingPolicyConfig(
            @Value("${simulator.adaptive.window-ticks:30}")                  int windowTicks,
            @Value("${simulator.adaptive.high-rejection-rate:0.60}")         double highRate,
            @Value("${simulator.adaptive.low-rejection-rate:0.30}")          double lowRate,
            @Value("${simulator.adaptive.min-interval-ticks:5}")             int minInterval,
            @Value("${simulator.adaptive.backoff-max-interval-ticks:60}")    int backoffMax,
            @Value("${simulator.adaptive.max-depth-min:3}")                  int depthMin,
            @Value("${simulator.adaptive.max-depth-max:6}")                  int depthMax,
            @Value("${simulator.adaptive.time-budget-ms-min:50}")            int budgetMin,
            @Value("${simulator.adaptive.time-budget-ms-max:250}")           int budgetMax,
            @Value("${simulator.adaptive.warmup-fallback-cadence:0}")        int warmupCadence) {
        return new AdaptiveClearingPolicyConfig(windowTicks, highRate, lowRate, minInterval, backoffMax,
                depthMin, depthMax, budgetMin, budgetMax, depthMax, budgetMax, warmupCadence)
            .withCeilings(clearingMaxDepth, clearingTimeBudgetMs);
    }

    @Bean
    public LedgerService ledgerService(RoutingCache routingCache) {
        return new InMemoryLedger(routingCache, Duration.ofMillis(ledgerLockTimeoutMs));
    }

    /** Scenario store preloaded with every scenario document under {@code scenarios-location}. */
    @Bean
    public ScenarioStore scenarioStore(ObjectMapper objectMapper) throws IOException {
        InMemoryScenarioStore store = new InMemoryScenarioStore();
        Resource[] resources = new PathMatchingResourcePatternResolver().getResources(scenariosLocation);
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                Scenario scenario = objectMapper.readValue(in, Scenario.class);
                store.save(scenario).block();
            } catch (IOException | RuntimeException e) {
                log.error("[Config] Scenario not loaded. resource={} error={}", resource.getFilename(), e.getMessage());
            }
        }
        log.info("[Config] Scenario store ready. location={} resources={}", scenariosLocation, resources.length);
        return store;
    }
}
