package com.chessmind.core.fixtures;

import com.chessmind.core.Evaluator;
import com.chessmind.core.GameRules;
import com.chessmind.core.Outcome;
import com.chessmind.core.Side;
import java.util.ArrayList;
import java.util.List;

/**
 * Players alternately take one to three counters from a pile; whoever takes the last counter wins.
 * Piles divisible by four are lost for the side to move.
 */
public final class SubtractionGame
        implements GameRules<SubtractionGame.Position, Integer>, Evaluator<SubtractionGame.Position> {

    public static final int MAX_TAKE = 3;

    @Override
    public List<Integer> legalMoves(Position position) {
        List<Integer> moves = new ArrayList<>(MAX_TAKE);
        for (int take = 1; take <= Math.min(MAX_TAKE, position.pile()); take++) {
            moves.add(take);
        }
        return moves;
    }

    @Override
    public Position apply(Position position, Integer take) {
        if (take < 1 || take > MAX_TAKE || take > position.pile()) {
            throw new IllegalArgumentException("Illegal move: " + take);
        }
        return new Position(position.pile() - take, position.toMove().opponent());
    }

    @Override
    public Outcome outcome(Position position) {
        return position.pile() == 0 ? Outcome.lossFor(position.toMove()) : Outcome.ONGOING;
    }

    @Override
    public Side sideToMove(Position position) {
        return position.toMove();
    }

    @Override
    public int evaluate(Position position) {
        boolean moverLoses = position.pile() % (MAX_TAKE + 1) == 0;
        boolean maximizerToMove = position.toMove() == Side.MAXIMIZER;
        return moverLoses == maximizerToMove ? -1 : 1;
    }

    public record Position(int pile, Side toMove) {

        public Position {
            if (pile < 0) {
                throw new IllegalArgumentException("pile must not be negative");
            }
        }
    }
}
