package com.chessmind.core.ai;

/**
 * Result payload returned by {@link Searcher} implementations and by {@link MoveSelector}.
 *
 * @param move best root move, or {@code null} when no move was searched (depth zero)
 * @param score score of {@code move} from the maximizer's perspective
 * @param depthEvaluated depth of the deepest completed iteration
 * @param visitedNodes nodes entered across all iterations
 * @param cutoffs alpha-beta cutoffs across all iterations
 * @param stoppedEarly {@code true} if a time or node budget ended iterative deepening before the
 *                     requested depth
 * @param telemetry per-iteration instrumentation
 */
public record SearchResult<M>(M move, int score, int depthEvaluated, long visitedNodes, long cutoffs,
        boolean stoppedEarly, SearchTelemetry telemetry) {

    public SearchResult {
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
    }

    public boolean hasMove() {
        return move != null;
    }
}
