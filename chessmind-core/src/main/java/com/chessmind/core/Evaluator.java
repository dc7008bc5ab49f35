package com.chessmind.core;

/**
 * Heuristic scoring of non-terminal positions.
 *
 * <p>The score is always from the {@link Side#MAXIMIZER}'s perspective, whichever side is to move.
 * Implementations must be deterministic and free of side effects: the search may evaluate the same
 * position many times and from several threads. Values outside
 * {@code [-Scores.MAX_HEURISTIC, Scores.MAX_HEURISTIC]} are clamped by the search.
 *
 * @param <P> position type
 */
@FunctionalInterface
public interface Evaluator<P> {

    int evaluate(P position);
}
