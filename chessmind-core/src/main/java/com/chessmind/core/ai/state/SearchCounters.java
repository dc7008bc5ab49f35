package com.chessmind.core.ai.state;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Instrumentation counters for one search iteration. Safe to update from several worker threads.
 */
public final class SearchCounters {

    private final LongAdder visitedNodes = new LongAdder();
    private final LongAdder cutoffs = new LongAdder();
    private final LongAdder evaluations = new LongAdder();
    private final AtomicInteger activeTasks = new AtomicInteger();
    private final AtomicLong maxActiveTasks = new AtomicLong();

    public void recordNode() {
        visitedNodes.increment();
    }

    public void recordCutoff() {
        cutoffs.increment();
    }

    public void recordEvaluation() {
        evaluations.increment();
    }

    public void taskStarted() {
        int current = activeTasks.incrementAndGet();
        maxActiveTasks.accumulateAndGet(current, Math::max);
    }

    public void taskFinished() {
        activeTasks.decrementAndGet();
    }

    public long visitedNodes() {
        return visitedNodes.sum();
    }

    public long cutoffs() {
        return cutoffs.sum();
    }

    public long evaluations() {
        return evaluations.sum();
    }

    public long maxActiveTasks() {
        return maxActiveTasks.get();
    }
}
