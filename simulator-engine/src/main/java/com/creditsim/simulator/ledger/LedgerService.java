package com.creditsim.simulator.ledger;

/**
 * The debt ledger the simulator drives. Validates, routes and commits single
 * payments and settles debt cycles.
 *
 * <p>Work happens inside a {@link LedgerSession}. The backing store is treated as
 * single-writer: a session holds the write lock from its first write until
 * {@link LedgerSession#commit()} or {@link LedgerSession#rollback()}, so two sessions
 * that both write must not be interleaved by the same caller.
 */
public interface LedgerService {

    LedgerSession openSession();
}
