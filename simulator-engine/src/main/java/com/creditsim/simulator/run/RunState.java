package com.creditsim.simulator.run;

import com.creditsim.common.event.RunStatusPayload;
import com.creditsim.common.exception.RunStateException;
import com.creditsim.simulator.clearing.ClearingTask;
import com.creditsim.simulator.config.SimulatorSettings;
import com.creditsim.simulator.drift.EdgeClearingHistory;
import com.creditsim.simulator.drift.TrustDriftConfig;
import com.creditsim.simulator.scenario.ScenarioGraph;
import com.creditsim.simulator.strategy.AdaptiveClearingPolicy;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutable state of one live run, shared between the tick loop (writer), in-flight
 * payment tasks (counters) and the REST layer (reader).
 *
 * <p>Lifecycle fields are written under the instance monitor, which is also the single
 * run-scoped lock protecting counters touched from concurrent payment tasks.
 * Plain reads go through volatile fields.
 */
public class RunState {

    public static final String MODE_REAL = "real";

    private static final Duration ERROR_WINDOW = Duration.ofSeconds(60);

    private final String            runId;
    private final String            scenarioId;
    private final String            mode;
    private final long              seed;
    private final ScenarioGraph     graph;
    private final SimulatorSettings settings;
    private final Clock             clock;
    private final Instant           startedAt;

    private volatile RunStatus status = RunStatus.RUNNING;
    private volatile long      tickIndex;
    private volatile long      simTimeMs;
    private volatile int       intensityPercent;
    private volatile Instant   stoppedAt;

    // ── counters (guarded by this) ─────────────────────────────────────────────
    private long attempts;
    private long committed;
    private long rejected;
    private long errors;
    private long timeouts;
    private int  consecTickFailures;
    private int  consecAllRejectedTicks;
    private RunError lastError;
    private final Deque<Instant> errorTimestamps = new ArrayDeque<>();

    // ── tick bookkeeping ───────────────────────────────────────────────────────
    private volatile boolean          seeded;
    private final Set<Integer>        firedEventIndexes   = ConcurrentHashMap.newKeySet();
    private final Map<String, EdgeClearingHistory> edgeClearingHistory = new ConcurrentHashMap<>();
    private volatile TrustDriftConfig trustDriftConfig;
    private volatile ClearingTask     clearingTask;
    private volatile Disposable       tickLoop;
    private volatile Mono<Void>       pendingCycle        = Mono.empty();
    private volatile long             lastArtifactAtMs;
    private volatile AdaptiveClearingPolicy clearingPolicy;
    private final Map<String, BigDecimal> totalDebtByEquivalent = new ConcurrentHashMap<>();
    private volatile TickSummary      lastTick;
    private final Set<String>         tickWarnings        = new HashSet<>();
    private long                      tickWarningsTick    = -1;

    public RunState(String runId, String scenarioId, long seed, int intensityPercent,
                    ScenarioGraph graph, SimulatorSettings settings, Clock clock) {
        this.runId            = runId;
        this.scenarioId       = scenarioId;
        this.mode             = MODE_REAL;
        this.seed             = seed;
        this.intensityPercent = clampIntensity(intensityPercent);
        this.graph            = graph;
        this.settings         = settings;
        this.clock            = clock;
        this.startedAt        = clock.instant();
    }

    // ── lifecycle ──────────────────────────────────────────────────────────────

    /**
     * Moves to {@code target}.
     *
     * @throws RunStateException when the transition is not allowed from the current status
     */
    public synchronized void transitionTo(RunStatus target, String action) {
        if (!status.canTransitionTo(target)) {
            throw new RunStateException(runId, status.wireName(), action);
        }
        this.status = target;
        if (target.isTerminal()) {
            this.stoppedAt = clock.instant();
        }
    }

    /**
     * Moves to {@link RunStatus#ERROR} and records {@code code}; a run that is already
     * stopping or terminal is left alone.
     *
     * @return {@code true} when this call failed the run
     */
    public synchronized boolean fail(String code, String message) {
        if (status == RunStatus.STOPPING || status.isTerminal()) {
            return false;
        }
        recordError(code, message);
        this.status    = RunStatus.ERROR;
        this.stoppedAt = clock.instant();
        return true;
    }

    public boolean isRunning() {
        return status == RunStatus.RUNNING;
    }

    /** Advances the simulated clock by one tick of {@code stepMs}. */
    public synchronized void advanceClock(long stepMs) {
        this.tickIndex += 1;
        this.simTimeMs  = tickIndex * stepMs;
    }

    /**
     * Sets the intensity, clamped to 0..100.
     *
     * @throws RunStateException when the run is stopping or terminal
     */
    public synchronized void setIntensityPercent(int intensityPercent) {
        if (status == RunStatus.STOPPING || status.isTerminal()) {
            throw new RunStateException(runId, status.wireName(), "set intensity of");
        }
        this.intensityPercent = clampIntensity(intensityPercent);
    }

    // ── counters ───────────────────────────────────────────────────────────────

    public synchronized void incrementAttempts()  { this.attempts++; }
    public synchronized void incrementCommitted() { this.committed++; }
    public synchronized void incrementRejected()  { this.rejected++; }
    public synchronized void incrementTimeouts()  { this.timeouts++; }

    /** Counts one error, stamps the 60 s window and makes it the last error. */
    public synchronized void recordError(String code, String message) {
        Instant now = clock.instant();
        this.errors++;
        this.errorTimestamps.addLast(now);
        pruneErrorWindow(now);
        this.lastError = new RunError(code, message, now);
    }

    public synchronized int recordTickFailure() {
        return ++this.consecTickFailures;
    }

    public synchronized void resetTickFailures() {
        this.consecTickFailures = 0;
    }

    /**
     * Folds one tick's outcome into the stall counter.
     *
     * @return the counter after the update
     */
    public synchronized int recordTickOutcome(long tickAttempts, long tickCommitted, long tickErrors) {
        if (tickAttempts > 0 && tickCommitted == 0 && tickErrors == 0) {
            this.consecAllRejectedTicks++;
        } else if (tickCommitted > 0 || tickErrors > 0) {
            this.consecAllRejectedTicks = 0;
        }
        return consecAllRejectedTicks;
    }

    public synchronized int errorsLastMinute() {
        pruneErrorWindow(clock.instant());
        return errorTimestamps.size();
    }

    private void pruneErrorWindow(Instant now) {
        Instant cutoff = now.minus(ERROR_WINDOW);
        while (!errorTimestamps.isEmpty() && errorTimestamps.peekFirst().isBefore(cutoff)) {
            errorTimestamps.pollFirst();
        }
    }

    // ── per-tick warning dedup ─────────────────────────────────────────────────

    /** @return {@code true} the first time {@code key} is seen during the current tick */
    public synchronized boolean shouldWarnThisTick(String key) {
        if (tickWarningsTick != tickIndex) {
            tickWarnings.clear();
            tickWarningsTick = tickIndex;
        }
        return tickWarnings.add(key);
    }

    // ── tick bookkeeping ───────────────────────────────────────────────────────

    public boolean isSeeded()                 { return seeded; }
    public void    markSeeded()               { this.seeded = true; }

    /** @return {@code true} when the event at {@code index} had not fired yet */
    public boolean markEventFired(int index)  { return firedEventIndexes.add(index); }
    public boolean isEventFired(int index)    { return firedEventIndexes.contains(index); }

    public Map<String, EdgeClearingHistory> edgeClearingHistory() { return edgeClearingHistory; }

    public TrustDriftConfig getTrustDriftConfig()                 { return trustDriftConfig; }
    public void setTrustDriftConfig(TrustDriftConfig config)      { this.trustDriftConfig = config; }

    public ClearingTask getClearingTask()                         { return clearingTask; }
    public void setClearingTask(ClearingTask task)                { this.clearingTask = task; }

    /** Clears the stored task only if it is still {@code expected}. */
    public synchronized void clearClearingTask(ClearingTask expected) {
        if (clearingTask == expected) {
            clearingTask = null;
        }
    }

    public Disposable getTickLoop()                               { return tickLoop; }
    public void setTickLoop(Disposable tickLoop)                  { this.tickLoop = tickLoop; }

    /** Completes when the current loop cycle, including a tick in progress, has finished or been cancelled. */
    public Mono<Void> getPendingCycle()                           { return pendingCycle; }
    public void setPendingCycle(Mono<Void> pendingCycle)          { this.pendingCycle = pendingCycle; }

    public long getLastArtifactAtMs()                             { return lastArtifactAtMs; }
    public void setLastArtifactAtMs(long ms)                      { this.lastArtifactAtMs = ms; }

    public AdaptiveClearingPolicy getClearingPolicy()             { return clearingPolicy; }
    public void setClearingPolicy(AdaptiveClearingPolicy policy)  { this.clearingPolicy = policy; }

    /** Last refreshed total debt per equivalent; reused between throttled refreshes. */
    public Map<String, BigDecimal> totalDebtByEquivalent()        { return totalDebtByEquivalent; }

    public TickSummary getLastTick()                              { return lastTick; }
    public void setLastTick(TickSummary lastTick)                 { this.lastTick = lastTick; }

    // ── accessors ──────────────────────────────────────────────────────────────

    public String            getRunId()            { return runId; }
    public String            getScenarioId()       { return scenarioId; }
    public String            getMode()             { return mode; }
    public long              getSeed()             { return seed; }
    public ScenarioGraph     getGraph()            { return graph; }
    public SimulatorSettings getSettings()         { return settings; }
    public Clock             getClock()            { return clock; }
    public RunStatus         getStatus()           { return status; }
    public long              getTickIndex()        { return tickIndex; }
    public long              getSimTimeMs()        { return simTimeMs; }
    public int               getIntensityPercent() { return intensityPercent; }
    public Instant           getStartedAt()        { return startedAt; }
    public Instant           getStoppedAt()        { return stoppedAt; }

    public synchronized long     getAttempts()               { return attempts; }
    public synchronized long     getCommitted()              { return committed; }
    public synchronized long     getRejected()               { return rejected; }
    public synchronized long     getErrors()                 { return errors; }
    public synchronized long     getTimeouts()               { return timeouts; }
    public synchronized int      getConsecTickFailures()     { return consecTickFailures; }
    public synchronized int      getConsecAllRejectedTicks() { return consecAllRejectedTicks; }
    public synchronized RunError getLastError()              { return lastError; }

    public synchronized RunStatusPayload toStatusPayload() {
        return new RunStatusPayload(
            status.wireName(),
            tickIndex,
            simTimeMs,
            intensityPercent,
            attempts,
            committed,
            rejected,
            errors,
            timeouts,
            consecAllRejectedTicks,
            errorsLastMinute(),
            lastError != null ? lastError.code() : null,
            lastError != null ? lastError.message() : null,
            lastError != null ? lastError.at() : null
        );
    }

    private static int clampIntensity(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
