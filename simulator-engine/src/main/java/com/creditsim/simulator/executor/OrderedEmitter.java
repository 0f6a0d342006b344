package com.creditsim.simulator.executor;

import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Reorder buffer: accepts results in any order, hands them to the sink strictly by
 * ascending sequence number starting at 0.
 */
public final class OrderedEmitter<T> {

    private final Consumer<T>      sink;
    private final TreeMap<Integer, T> pending = new TreeMap<>();
    private int next;

    public OrderedEmitter(Consumer<T> sink) {
        this.sink = sink;
    }

    /** Buffers {@code value} and emits every value that has become contiguous. */
    public synchronized void offer(int seq, T value) {
        if (seq < next || pending.containsKey(seq)) {
            throw new IllegalStateException("Sequence " + seq + " offered twice");
        }
        pending.put(seq, value);
        while (!pending.isEmpty() && pending.firstKey() == next) {
            sink.accept(pending.pollFirstEntry().getValue());
            next++;
        }
    }

    /** Emits whatever is still buffered, in order, skipping the gaps. */
    public synchronized int flush() {
        int flushed = 0;
        while (!pending.isEmpty()) {
            Map.Entry<Integer, T> entry = pending.pollFirstEntry();
            sink.accept(entry.getValue());
            next = entry.getKey() + 1;
            flushed++;
        }
        return flushed;
    }

    public synchronized int emittedUpTo() {
        return next;
    }
}
