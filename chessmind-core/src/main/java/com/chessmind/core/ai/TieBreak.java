package com.chessmind.core.ai;

/**
 * Policy applied when several root moves share the best score.
 */
public enum TieBreak {
    /** Keep the first best move in search order. */
    FIRST,
    /** Pick uniformly among all best moves using the configured seed. */
    RANDOM
}
