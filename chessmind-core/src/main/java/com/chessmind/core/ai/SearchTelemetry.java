package com.chessmind.core.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregated instrumentation data captured during a single {@link MoveSelector#chooseBestMove}
 * call, one {@link Iteration} per completed depth.
 */
public final class SearchTelemetry {

    private static final SearchTelemetry EMPTY = new SearchTelemetry(List.of());

    private final List<Iteration> iterations;

    public SearchTelemetry(List<Iteration> iterations) {
        if (iterations == null || iterations.isEmpty()) {
            this.iterations = List.of();
        } else {
            this.iterations = Collections.unmodifiableList(new ArrayList<>(iterations));
        }
    }

    public static SearchTelemetry empty() {
        return EMPTY;
    }

    public static SearchTelemetry single(Iteration iteration) {
        return new SearchTelemetry(List.of(iteration));
    }

    public List<Iteration> iterations() {
        return iterations;
    }

    public Iteration latest() {
        return iterations.isEmpty() ? null : iterations.get(iterations.size() - 1);
    }

    public long totalNodes() {
        return iterations.stream().mapToLong(Iteration::nodes).sum();
    }

    public long totalCutoffs() {
        return iterations.stream().mapToLong(Iteration::cutoffs).sum();
    }

    public long totalEvaluations() {
        return iterations.stream().mapToLong(Iteration::evaluations).sum();
    }

    public long totalElapsedNanos() {
        return iterations.stream().mapToLong(Iteration::elapsedNanos).sum();
    }

    public long maxActiveTasks() {
        return iterations.stream().mapToLong(Iteration::maxActiveTasks).max().orElse(0L);
    }

    public SearchTelemetry append(Iteration iteration) {
        List<Iteration> combined = new ArrayList<>(iterations);
        combined.add(iteration);
        return new SearchTelemetry(combined);
    }

    public record Iteration(
            int depth,
            int score,
            long nodes,
            long cutoffs,
            long evaluations,
            long maxActiveTasks,
            long elapsedNanos) {
    }
}
