package com.chessmind.core.ai;

import com.chessmind.core.Side;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Collects scored root moves, offered in search order, and applies the {@link TieBreak} policy.
 * A score that improves on the current best must be exact, and so must a score equal to it under
 * {@link TieBreak#RANDOM}; with {@link TieBreak#FIRST} a later move needs a strictly better score to
 * replace the current choice.
 *
 * @param <M> move type
 */
public final class RootSelection<M> {

    private final Side rootSide;
    private final TieBreak tieBreak;
    private final List<M> bestMoves = new ArrayList<>();
    private int bestScore;

    public RootSelection(Side rootSide, TieBreak tieBreak) {
        this.rootSide = Objects.requireNonNull(rootSide, "rootSide");
        this.tieBreak = Objects.requireNonNull(tieBreak, "tieBreak");
    }

    public void offer(M move, int score) {
        Objects.requireNonNull(move, "move");
        if (bestMoves.isEmpty() || improves(score)) {
            bestMoves.clear();
            bestMoves.add(move);
            bestScore = score;
        } else if (score == bestScore && tieBreak == TieBreak.RANDOM) {
            bestMoves.add(move);
        }
    }

    public boolean hasBest() {
        return !bestMoves.isEmpty();
    }

    public int bestScore() {
        if (bestMoves.isEmpty()) {
            throw new IllegalStateException("No root move has been scored");
        }
        return bestScore;
    }

    /**
     * Root moves sharing the best score, in search order. Holds a single move under
     * {@link TieBreak#FIRST}.
     */
    public List<M> bestMoves() {
        return Collections.unmodifiableList(bestMoves);
    }

    public M choose(long seed) {
        if (bestMoves.isEmpty()) {
            throw new IllegalStateException("No root move has been scored");
        }
        if (tieBreak == TieBreak.FIRST || bestMoves.size() == 1) {
            return bestMoves.get(0);
        }
        return bestMoves.get(new Random(seed).nextInt(bestMoves.size()));
    }

    private boolean improves(int score) {
        return rootSide == Side.MAXIMIZER ? score > bestScore : score < bestScore;
    }
}
