package com.chessmind.chess.ai;

import com.chessmind.chess.Board;
import com.chessmind.chess.ChessMove;
import com.chessmind.chess.ChessPosition;
import com.chessmind.chess.Piece;
import com.chessmind.chess.PieceType;
import com.chessmind.chess.Square;
import com.chessmind.core.ai.MoveOrderer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders chess moves so that forcing moves are searched first: captures by most valuable victim and
 * least valuable attacker, then checks, promotions and moves into the centre.
 */
public final class ChessMoveOrderer implements MoveOrderer<ChessPosition, ChessMove> {

    static final int CHECK_BONUS = 900;
    static final int PROMOTION_BONUS = 800;
    static final int CENTER_BONUS = 50;

    @Override
    public List<ChessMove> order(ChessPosition position, List<ChessMove> moves) {
        List<ScoredMove> scored = new ArrayList<>(moves.size());
        for (ChessMove move : moves) {
            scored.add(new ScoredMove(move, priority(position, move)));
        }
        // List.sort is stable, so equal priorities keep generation order
        scored.sort(Comparator.comparingInt(ScoredMove::priority).reversed());
        List<ChessMove> ordered = new ArrayList<>(scored.size());
        for (ScoredMove entry : scored) {
            ordered.add(entry.move());
        }
        return ordered;
    }

    /**
     * Ordering priority of a legal move; higher is searched earlier.
     */
    public static int priority(ChessPosition position, ChessMove move) {
        Board board = position.board();
        Piece attacker = board.get(move.from());
        Piece victim = board.get(move.to());
        int priority = 0;
        if (victim != null) {
            priority += 10 * orderingValue(victim.type()) - orderingValue(attacker.type());
        }
        if (position.apply(move).isInCheck()) {
            priority += CHECK_BONUS;
        }
        if (move.isPromotion()) {
            priority += PROMOTION_BONUS;
        }
        int file = Square.file(move.to());
        int rank = Square.rank(move.to());
        if (file >= 2 && file <= 5 && rank >= 2 && rank <= 5) {
            priority += CENTER_BONUS;
        }
        return priority;
    }

    static int orderingValue(PieceType type) {
        switch (type) {
            case PAWN:
                return 1;
            case KNIGHT:
            case BISHOP:
                return 3;
            case ROOK:
                return 5;
            case QUEEN:
                return 9;
            case KING:
                return 100;
            default:
                throw new IllegalArgumentException("Unknown piece type " + type);
        }
    }

    private record ScoredMove(ChessMove move, int priority) {
    }
}
