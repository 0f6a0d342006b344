package com.creditsim.simulator.ledger;

import com.creditsim.common.exception.SimulatorException;
import com.creditsim.simulator.cache.RoutingCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Process-local ledger used by the runnable application and by tests.
 *
 * <p>Models a single-writer store: the first write of a session takes the write lock
 * and works on a private copy of the committed state; {@code commit} publishes the copy,
 * {@code rollback} discards it. A second writing session blocks until the lock is free
 * or {@code lockTimeout} elapses.
 *
 * <p>Committed payment receipts live in an append-only store keyed by idempotency key,
 * bounded to the most recent {@value #RECEIPT_CAPACITY} entries.
 */
public class InMemoryLedger implements LedgerService {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLedger.class);

    static final int RECEIPT_CAPACITY = 10_000;

    private final RoutingCache  routingCache;
    private final PaymentRouter router;
    private final Duration      lockTimeout;
    private final Semaphore     writeLock = new Semaphore(1);

    private volatile LedgerState committed = new LedgerState();

    private final Map<String, PaymentReceipt> receipts = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, PaymentReceipt> eldest) {
            return size() > RECEIPT_CAPACITY;
        }
    };

    public InMemoryLedger(RoutingCache routingCache, Duration lockTimeout) {
        this.routingCache = routingCache;
        this.router       = new PaymentRouter(routingCache);
        this.lockTimeout  = lockTimeout;
    }

    @Override
    public LedgerSession openSession() {
        return new InMemoryLedgerSession(this);
    }

    // ── package-private plumbing for sessions ───────────────────────────────

    LedgerState committed() {
        return committed;
    }

    void publish(LedgerState state) {
        committed = state;
    }

    synchronized PaymentReceipt receipt(String idempotencyKey) {
        return receipts.get(idempotencyKey);
    }

    synchronized void recordReceipts(Map<String, PaymentReceipt> committedReceipts) {
        receipts.putAll(committedReceipts);
    }

    synchronized int receiptCount() {
        return receipts.size();
    }

    void acquireWriteLock() {
        try {
            if (!writeLock.tryAcquire(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Ledger] Write lock not acquired within {}ms", lockTimeout.toMillis());
                throw new SimulatorException("LEDGER_LOCK_TIMEOUT",
                    "Write lock not acquired within " + lockTimeout.toMillis() + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SimulatorException("LEDGER_LOCK_INTERRUPTED", "Interrupted waiting for write lock", e);
        }
    }

    void releaseWriteLock() {
        writeLock.release();
    }

    PaymentRouter router() {
        return router;
    }

    RoutingCache routingCache() {
        return routingCache;
    }
}
