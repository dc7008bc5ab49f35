package com.chessmind.core.ai;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration of one {@link MoveSelector#chooseBestMove} call.
 *
 * @param maxDepth plies to search; zero evaluates the root without searching
 * @param timeLimit budget checked between iterative-deepening depths, {@link Duration#ZERO} for none
 * @param nodeBudget visited-node budget checked between depths, zero for none
 * @param iterativeDeepening search depths 1..maxDepth instead of maxDepth alone
 * @param tieBreak policy for equally scored root moves
 * @param seed seed for {@link TieBreak#RANDOM}
 * @param pruning alpha-beta cutoffs on or off
 * @param mode sequential or parallel root search
 */
public record SearchConfig(int maxDepth, Duration timeLimit, long nodeBudget, boolean iterativeDeepening,
        TieBreak tieBreak, long seed, boolean pruning, SearchMode mode) {

    public static final int MIN_PLAYABLE_DEPTH = 1;
    public static final int MAX_PLAYABLE_DEPTH = 10;

    public SearchConfig {
        Objects.requireNonNull(timeLimit, "timeLimit");
        Objects.requireNonNull(tieBreak, "tieBreak");
        Objects.requireNonNull(mode, "mode");
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative");
        }
        if (maxDepth > SearchConstraints.MAX_DEPTH) {
            throw new IllegalArgumentException("maxDepth must not exceed " + SearchConstraints.MAX_DEPTH);
        }
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must not be negative");
        }
        if (nodeBudget < 0L) {
            throw new IllegalArgumentException("nodeBudget must not be negative");
        }
    }

    /**
     * Single search at {@code depth} plies, first-move tie-break, sequential.
     */
    public static SearchConfig fixedDepth(int depth) {
        return new SearchConfig(depth, Duration.ZERO, 0L, false, TieBreak.FIRST, 0L, true, SearchMode.SEQ);
    }

    /**
     * Iterative deepening up to {@code maxDepth}, stopping early once {@code timeLimit} is spent.
     */
    public static SearchConfig iterative(int maxDepth, Duration timeLimit) {
        return new SearchConfig(maxDepth, timeLimit, 0L, true, TieBreak.FIRST, 0L, true, SearchMode.SEQ);
    }

    public SearchConfig withMaxDepth(int depth) {
        return new SearchConfig(depth, timeLimit, nodeBudget, iterativeDeepening, tieBreak, seed, pruning, mode);
    }

    public SearchConfig withTimeLimit(Duration limit) {
        return new SearchConfig(maxDepth, limit, nodeBudget, iterativeDeepening, tieBreak, seed, pruning, mode);
    }

    public SearchConfig withNodeBudget(long budget) {
        return new SearchConfig(maxDepth, timeLimit, budget, iterativeDeepening, tieBreak, seed, pruning, mode);
    }

    public SearchConfig withIterativeDeepening(boolean enabled) {
        return new SearchConfig(maxDepth, timeLimit, nodeBudget, enabled, tieBreak, seed, pruning, mode);
    }

    public SearchConfig withTieBreak(TieBreak policy, long newSeed) {
        return new SearchConfig(maxDepth, timeLimit, nodeBudget, iterativeDeepening, policy, newSeed, pruning, mode);
    }

    public SearchConfig withPruning(boolean enabled) {
        return new SearchConfig(maxDepth, timeLimit, nodeBudget, iterativeDeepening, tieBreak, seed, enabled, mode);
    }

    public SearchConfig withMode(SearchMode newMode) {
        return new SearchConfig(maxDepth, timeLimit, nodeBudget, iterativeDeepening, tieBreak, seed, pruning, newMode);
    }

    /**
     * Clamps a user supplied depth to the range offered by the front-ends.
     */
    public static int clampDepth(int depth) {
        return Math.max(MIN_PLAYABLE_DEPTH, Math.min(MAX_PLAYABLE_DEPTH, depth));
    }

    SearchConstraints constraintsForDepth(int depth) {
        return new SearchConstraints(depth, pruning, tieBreak, seed);
    }

    /**
     * Execution strategy for the root search.
     */
    public enum SearchMode {
        SEQ,
        PAR
    }
}
