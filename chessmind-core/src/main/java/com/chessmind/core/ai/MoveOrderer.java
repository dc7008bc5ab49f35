package com.chessmind.core.ai;

import java.util.List;

/**
 * Reorders legal moves so that likely good moves are searched first. Ordering affects only how much
 * of the tree alpha-beta can skip, never the score it returns.
 *
 * @param <P> position type
 * @param <M> move type
 */
@FunctionalInterface
public interface MoveOrderer<P, M> {

    /**
     * Returns the moves in search order. Implementations may return a new list or {@code moves}
     * itself but must keep every element.
     */
    List<M> order(P position, List<M> moves);

    static <P, M> MoveOrderer<P, M> identity() {
        return (position, moves) -> moves;
    }
}
