package com.chessmind.core;

import java.util.List;

/**
 * Rules oracle consumed by the search. Implementations must treat positions as immutable:
 * {@link #apply(Object, Object)} returns a new position and never alters its argument, so the same
 * position may be explored by several branches (or threads) at once.
 *
 * @param <P> position type
 * @param <M> move type, compared with {@code equals}
 */
public interface GameRules<P, M> {

    /**
     * Returns every move legal for the side to move. The order carries no meaning and may be
     * rearranged by a {@link com.chessmind.core.ai.MoveOrderer}.
     */
    List<M> legalMoves(P position);

    /**
     * Returns the position reached by playing {@code move}.
     *
     * @throws IllegalArgumentException if the move is not legal in {@code position}
     */
    P apply(P position, M move);

    /**
     * Classifies the position; anything other than {@link Outcome#ONGOING} ends the game.
     */
    Outcome outcome(P position);

    Side sideToMove(P position);

    default boolean isTerminal(P position) {
        return outcome(position).isTerminal();
    }

    /**
     * Classification used when a position reported as ongoing turns out to have no legal moves.
     * A correct {@link #outcome(Object)} never lets this happen.
     */
    default Outcome stalledOutcome(P position) {
        return Outcome.DRAW;
    }
}
