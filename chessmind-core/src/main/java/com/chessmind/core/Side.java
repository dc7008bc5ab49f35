package com.chessmind.core;

/**
 * The two roles of a two-player zero-sum game as seen by the search. Scores are always expressed
 * from the {@link #MAXIMIZER}'s point of view.
 */
public enum Side {
    MAXIMIZER,
    MINIMIZER;

    public Side opponent() {
        return this == MAXIMIZER ? MINIMIZER : MAXIMIZER;
    }
}
