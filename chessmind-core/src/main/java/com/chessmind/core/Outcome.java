package com.chessmind.core;

/**
 * Terminal classification of a position.
 */
public enum Outcome {
    ONGOING,
    MAXIMIZER_WINS,
    MINIMIZER_WINS,
    DRAW;

    public boolean isTerminal() {
        return this != ONGOING;
    }

    /**
     * Returns the outcome in which {@code side} loses.
     */
    public static Outcome lossFor(Side side) {
        return side == Side.MAXIMIZER ? MINIMIZER_WINS : MAXIMIZER_WINS;
    }
}
