package com.chessmind.core.ai;

/**
 * Generic interface for game tree search implementations.
 *
 * @param <P> position type
 * @param <M> move type
 */
public interface Searcher<P, M> {

    /**
     * Executes a search for the best move in {@code root} under the supplied
     * {@link SearchConstraints}.
     *
     * @param root the starting position to analyse, which must not be terminal
     * @param constraints the limits guiding the search execution
     * @param preferredMove a root move to try first, typically the best move of a shallower
     *                      iteration, or {@code null}
     * @return the result of the search
     * @throws IllegalStateException if {@code root} is terminal
     */
    SearchResult<M> search(P root, SearchConstraints constraints, M preferredMove);

    default SearchResult<M> search(P root, SearchConstraints constraints) {
        return search(root, constraints, null);
    }
}
