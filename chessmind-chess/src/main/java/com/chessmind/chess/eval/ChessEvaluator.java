package com.chessmind.chess.eval;

import com.chessmind.chess.Board;
import com.chessmind.chess.ChessPosition;
import com.chessmind.chess.MoveGenerator;
import com.chessmind.chess.Piece;
import com.chessmind.chess.PieceColor;
import com.chessmind.chess.PieceType;
import com.chessmind.chess.Square;
import com.chessmind.core.Evaluator;

/**
 * Static chess evaluation in millipawns from White's point of view: material, piece-square bonuses
 * and mobility. Swapping the colours of a position negates its score.
 */
public final class ChessEvaluator implements Evaluator<ChessPosition> {

    /** Millipawns per centipawn. */
    public static final int MATERIAL_WEIGHT = 10;
    public static final int POSITIONAL_WEIGHT = 1;
    public static final int MOBILITY_WEIGHT = 20;

    @Override
    public int evaluate(ChessPosition position) {
        Board board = position.board();
        return MATERIAL_WEIGHT * material(board)
                + POSITIONAL_WEIGHT * positional(board)
                + MOBILITY_WEIGHT * mobility(position);
    }

    /**
     * Centipawn material balance, White minus Black.
     */
    public static int material(Board board) {
        int score = 0;
        for (int square = 0; square < Square.COUNT; square++) {
            Piece piece = board.get(square);
            if (piece != null) {
                score += sign(piece) * pieceValue(piece.type());
            }
        }
        return score;
    }

    public static int pieceValue(PieceType type) {
        switch (type) {
            case PAWN:
                return 100;
            case KNIGHT:
                return 320;
            case BISHOP:
                return 330;
            case ROOK:
                return 500;
            case QUEEN:
                return 900;
            case KING:
                return 20_000;
            default:
                throw new IllegalArgumentException("Unknown piece type " + type);
        }
    }

    /**
     * No queens left, or exactly two queens with at most two minor pieces on the board.
     */
    public static boolean isEndGame(Board board) {
        int queens = board.count(PieceType.QUEEN);
        int minors = board.count(PieceType.KNIGHT) + board.count(PieceType.BISHOP);
        return queens == 0 || (queens == 2 && minors <= 2);
    }

    static int positional(Board board) {
        boolean endGame = isEndGame(board);
        int score = 0;
        for (int square = 0; square < Square.COUNT; square++) {
            Piece piece = board.get(square);
            if (piece != null) {
                score += sign(piece) * PieceSquareTables.value(piece, square, endGame);
            }
        }
        return score;
    }

    /**
     * Legal moves of White minus legal moves of Black. The side not on move is counted without an
     * en-passant square.
     */
    static int mobility(ChessPosition position) {
        PieceColor mover = position.sideToMove();
        int moverMoves = position.legalMoves().size();
        int otherMoves = MoveGenerator.countLegalMoves(position.board(), mover.opponent(),
                position.castlingRights(), Square.NONE);
        return mover == PieceColor.WHITE ? moverMoves - otherMoves : otherMoves - moverMoves;
    }

    private static int sign(Piece piece) {
        return piece.color() == PieceColor.WHITE ? 1 : -1;
    }
}
