package com.chessmind.core.ai;

import java.util.Objects;

/**
 * Immutable per-iteration search parameters passed to {@link Searcher} implementations.
 *
 * @param depth plies to search below the root, at least one
 * @param pruning whether alpha-beta cutoffs are taken; without them the search is plain minimax
 * @param tieBreak how equally scored root moves are separated
 * @param seed seed of the generator used by {@link TieBreak#RANDOM}
 */
public record SearchConstraints(int depth, boolean pruning, TieBreak tieBreak, long seed) {

    public static final int MAX_DEPTH = 64;

    public SearchConstraints {
        Objects.requireNonNull(tieBreak, "tieBreak");
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be at least 1");
        }
        if (depth > MAX_DEPTH) {
            throw new IllegalArgumentException("depth must not exceed " + MAX_DEPTH);
        }
    }

    public static SearchConstraints ofDepth(int depth) {
        return new SearchConstraints(depth, true, TieBreak.FIRST, 0L);
    }

    public SearchConstraints withPruning(boolean enabled) {
        return new SearchConstraints(depth, enabled, tieBreak, seed);
    }
}
