package com.chessmind.chess.cli;

import com.chessmind.core.ai.SearchConfig;

/**
 * Named playing strengths offered by the console, each a fixed search depth.
 */
public enum Difficulty {
    BEGINNER(1, "Beginner"),
    EASY(2, "Easy"),
    MEDIUM(3, "Medium"),
    HARD(4, "Hard"),
    EXPERT(5, "Expert"),
    MASTER(6, "Master");

    private final int depth;
    private final String label;

    Difficulty(int depth, String label) {
        this.depth = depth;
        this.label = label;
    }

    public int depth() {
        return depth;
    }

    public int level() {
        return ordinal() + 1;
    }

    public String label() {
        return label;
    }

    public SearchConfig searchConfig() {
        return SearchConfig.fixedDepth(depth);
    }

    /**
     * Level {@code 1..6} as shown in the difficulty menu.
     */
    public static Difficulty fromLevel(int level) {
        if (level < 1 || level > values().length) {
            throw new IllegalArgumentException("Difficulty level must be between 1 and " + values().length
                    + ": " + level);
        }
        return values()[level - 1];
    }
}
