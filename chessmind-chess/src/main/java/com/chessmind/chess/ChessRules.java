package com.chessmind.chess;

import com.chessmind.core.GameRules;
import com.chessmind.core.Outcome;
import com.chessmind.core.Side;
import java.util.List;

/**
 * Standard chess rules for the search. Checkmate, stalemate, insufficient material, the
 * seventy-five-move rule and fivefold repetition end the game on their own; the fifty-move rule and
 * threefold repetition only entitle a player to claim a draw and are left to the front-ends.
 */
public final class ChessRules implements GameRules<ChessPosition, ChessMove> {

    @Override
    public List<ChessMove> legalMoves(ChessPosition position) {
        return position.legalMoves();
    }

    @Override
    public ChessPosition apply(ChessPosition position, ChessMove move) {
        return position.apply(move);
    }

    @Override
    public Outcome outcome(ChessPosition position) {
        if (position.legalMoves().isEmpty()) {
            return position.isInCheck() ? Outcome.lossFor(position.sideToMove().side()) : Outcome.DRAW;
        }
        if (position.isInsufficientMaterial() || position.isSeventyFiveMoves() || position.isFivefoldRepetition()) {
            return Outcome.DRAW;
        }
        return Outcome.ONGOING;
    }

    @Override
    public Side sideToMove(ChessPosition position) {
        return position.sideToMove().side();
    }

    /**
     * Human readable reason the game ended, in the wording of the console front-end. Claimable
     * draws are reported once they apply even though they do not end the game by themselves.
     */
    public static String describeResult(ChessPosition position) {
        if (position.isCheckmate()) {
            return "Checkmate! " + position.sideToMove().opponent().displayName() + " wins!";
        }
        if (position.isStalemate()) {
            return "Stalemate! The game is a draw.";
        }
        if (position.isInsufficientMaterial()) {
            return "Draw due to insufficient material.";
        }
        if (position.isFiftyMoves()) {
            return "Draw by fifty-move rule.";
        }
        if (position.isThreefoldRepetition()) {
            return "Draw by threefold repetition.";
        }
        return "Game ended.";
    }
}
