package com.chessmind.core;

/**
 * Score scale shared by the search and the evaluators.
 *
 * <p>A forced win discovered {@code n} plies below the root scores {@code WIN - n}, a forced loss
 * {@code -(WIN - n)}. Heuristic values are clamped to {@link #MAX_HEURISTIC}, which keeps every
 * proven result above every heuristic one.
 */
public final class Scores {

    public static final int INFINITY = 1_000_000_000;
    public static final int WIN = 100_000_000;
    public static final int DRAW = 0;
    public static final int MAX_HEURISTIC = 10_000_000;

    /**
     * Plies below which a win or loss score is still recognised as proven.
     */
    public static final int MAX_PLY = 1_000;

    private Scores() {
    }

    /**
     * Exact score of a terminal outcome reached {@code ply} half-moves below the root.
     */
    public static int terminal(Outcome outcome, int ply) {
        switch (outcome) {
            case MAXIMIZER_WINS:
                return WIN - ply;
            case MINIMIZER_WINS:
                return -(WIN - ply);
            case DRAW:
                return DRAW;
            default:
                throw new IllegalArgumentException("Outcome is not terminal: " + outcome);
        }
    }

    public static int clampHeuristic(int score) {
        return Math.max(-MAX_HEURISTIC, Math.min(MAX_HEURISTIC, score));
    }

    public static boolean isMaximizerWin(int score) {
        return score >= WIN - MAX_PLY;
    }

    public static boolean isMinimizerWin(int score) {
        return score <= -(WIN - MAX_PLY);
    }

    /**
     * Returns {@code true} if the score proves a win for either side.
     */
    public static boolean isDecisive(int score) {
        return isMaximizerWin(score) || isMinimizerWin(score);
    }

    /**
     * Number of plies to the forced end announced by a decisive score.
     */
    public static int pliesToEnd(int score) {
        if (!isDecisive(score)) {
            throw new IllegalArgumentException("Score is not decisive: " + score);
        }
        return WIN - Math.abs(score);
    }
}
