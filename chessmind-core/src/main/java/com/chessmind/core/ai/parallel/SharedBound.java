package com.chessmind.core.ai.parallel;

import com.chessmind.core.Scores;
import com.chessmind.core.Side;
import com.chessmind.core.ai.MinimaxKernel;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Best root score found so far, shared by the workers of a parallel search. The value only ever
 * moves towards the root side's preference: up for a maximizing root, down for a minimizing one.
 */
public final class SharedBound {

    private final Side rootSide;
    private final AtomicInteger best;

    public SharedBound(Side rootSide) {
        this.rootSide = Objects.requireNonNull(rootSide, "rootSide");
        this.best = new AtomicInteger(rootSide == Side.MAXIMIZER ? -Scores.INFINITY : Scores.INFINITY);
    }

    public int get() {
        return best.get();
    }

    public boolean isSet() {
        return Math.abs(best.get()) != Scores.INFINITY;
    }

    /**
     * Folds an exact root score into the bound and returns the resulting bound.
     */
    public int tighten(int score) {
        if (rootSide == Side.MAXIMIZER) {
            return best.accumulateAndGet(score, Math::max);
        }
        return best.accumulateAndGet(score, Math::min);
    }

    /**
     * Creates the window view used by one root child. The window stays one unit looser than the
     * bound so that a child matching the best score still gets an exact value.
     */
    public TaskWindow newWindow() {
        return new TaskWindow();
    }

    /**
     * Per-task view of the bound that remembers the tightest value it handed out.
     */
    public final class TaskWindow implements MinimaxKernel.Window {

        private int tightestFloor = -Scores.INFINITY;
        private int tightestCeiling = Scores.INFINITY;

        @Override
        public int floor(int alpha) {
            if (rootSide != Side.MAXIMIZER) {
                return alpha;
            }
            int floor = best.get() - 1;
            if (floor > tightestFloor) {
                tightestFloor = floor;
            }
            return Math.max(alpha, floor);
        }

        @Override
        public int ceiling(int beta) {
            if (rootSide != Side.MINIMIZER) {
                return beta;
            }
            int ceiling = best.get() + 1;
            if (ceiling < tightestCeiling) {
                tightestCeiling = ceiling;
            }
            return Math.min(beta, ceiling);
        }

        /**
         * Returns {@code true} if a child score computed under this window is exact rather than a
         * bound proven irrelevant to the root.
         */
        public boolean isExact(int score) {
            return rootSide == Side.MAXIMIZER ? score > tightestFloor : score < tightestCeiling;
        }
    }
}
