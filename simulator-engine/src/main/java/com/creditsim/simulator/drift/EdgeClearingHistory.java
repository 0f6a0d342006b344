package com.creditsim.simulator.drift;

import java.math.BigDecimal;

/**
 * Clearing record of one trust line, keyed {@code creditor:debtor:EQ} on the run.
 * {@code originalLimit} is fixed at creation and anchors both drift bounds.
 */
public class EdgeClearingHistory {

    private final    BigDecimal originalLimit;
    private volatile int        clearingCount;
    private volatile long       lastClearingTick = -1;
    private volatile BigDecimal clearedVolume    = BigDecimal.ZERO;

    public EdgeClearingHistory(BigDecimal originalLimit) {
        this.originalLimit = originalLimit;
    }

    public synchronized void recordClearing(long tick, BigDecimal volume) {
        this.clearingCount++;
        this.lastClearingTick = tick;
        this.clearedVolume    = clearedVolume.add(volume);
    }

    public BigDecimal getOriginalLimit()   { return originalLimit; }
    public int        getClearingCount()   { return clearingCount; }
    public long       getLastClearingTick(){ return lastClearingTick; }
    public BigDecimal getClearedVolume()   { return clearedVolume; }
}
