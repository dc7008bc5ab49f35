package com.chessmind.chess;

import java.util.ArrayList;
import java.util.List;

/**
 * Legal move generation: pseudo-legal moves filtered by king safety.
 */
public final class MoveGenerator {

    private static final int[][] KNIGHT_STEPS = {
            {1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}
    };
    private static final int[][] KING_STEPS = {
            {1, 0}, {1, 1}, {0, 1}, {-1, 1}, {-1, 0}, {-1, -1}, {0, -1}, {1, -1}
    };
    private static final int[][] ROOK_DIRECTIONS = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
    private static final int[][] BISHOP_DIRECTIONS = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};
    private static final PieceType[] PROMOTIONS = {PieceType.QUEEN, PieceType.ROOK, PieceType.BISHOP,
            PieceType.KNIGHT};

    private MoveGenerator() {
    }

    /**
     * Every legal move of {@code color}, in board order.
     */
    public static List<ChessMove> legalMoves(Board board, PieceColor color, int castlingRights, int enPassantSquare) {
        List<ChessMove> pseudo = new ArrayList<>(48);
        generatePseudoLegal(board, color, castlingRights, enPassantSquare, pseudo);
        List<ChessMove> legal = new ArrayList<>(pseudo.size());
        for (ChessMove move : pseudo) {
            if (!leavesKingInCheck(board, color, move, enPassantSquare)) {
                legal.add(move);
            }
        }
        return legal;
    }

    public static int countLegalMoves(Board board, PieceColor color, int castlingRights, int enPassantSquare) {
        return legalMoves(board, color, castlingRights, enPassantSquare).size();
    }

    public static boolean isInCheck(Board board, PieceColor color) {
        int king = board.kingSquare(color);
        return king != Square.NONE && isAttacked(board, king, color.opponent());
    }

    /**
     * Returns {@code true} if any piece of {@code attacker} attacks {@code square}.
     */
    public static boolean isAttacked(Board board, int square, PieceColor attacker) {
        int file = Square.file(square);
        int rank = Square.rank(square);

        // a white pawn attacks upwards, so it sits one rank below the target
        int pawnRank = attacker == PieceColor.WHITE ? rank - 1 : rank + 1;
        Piece pawn = Piece.of(attacker, PieceType.PAWN);
        for (int df = -1; df <= 1; df += 2) {
            if (Square.isOnBoard(file + df, pawnRank) && board.get(Square.of(file + df, pawnRank)) == pawn) {
                return true;
            }
        }
        if (attackedByStep(board, file, rank, KNIGHT_STEPS, Piece.of(attacker, PieceType.KNIGHT))
                || attackedByStep(board, file, rank, KING_STEPS, Piece.of(attacker, PieceType.KING))) {
            return true;
        }
        return attackedBySlider(board, file, rank, ROOK_DIRECTIONS, attacker, PieceType.ROOK)
                || attackedBySlider(board, file, rank, BISHOP_DIRECTIONS, attacker, PieceType.BISHOP);
    }

    private static boolean attackedByStep(Board board, int file, int rank, int[][] steps, Piece piece) {
        for (int[] step : steps) {
            int f = file + step[0];
            int r = rank + step[1];
            if (Square.isOnBoard(f, r) && board.get(Square.of(f, r)) == piece) {
                return true;
            }
        }
        return false;
    }

    private static boolean attackedBySlider(Board board, int file, int rank, int[][] directions, PieceColor attacker,
            PieceType slider) {
        for (int[] direction : directions) {
            int f = file + direction[0];
            int r = rank + direction[1];
            while (Square.isOnBoard(f, r)) {
                Piece piece = board.get(Square.of(f, r));
                if (piece != null) {
                    if (piece.color() == attacker && (piece.type() == slider || piece.type() == PieceType.QUEEN)) {
                        return true;
                    }
                    break;
                }
                f += direction[0];
                r += direction[1];
            }
        }
        return false;
    }

    private static boolean leavesKingInCheck(Board board, PieceColor color, ChessMove move, int enPassantSquare) {
        return isInCheck(board.afterMove(move, enPassantSquare), color);
    }

    private static void generatePseudoLegal(Board board, PieceColor color, int castlingRights, int enPassantSquare,
            List<ChessMove> out) {
        for (int square = 0; square < Square.COUNT; square++) {
            Piece piece = board.get(square);
            if (piece == null || piece.color() != color) {
                continue;
            }
            switch (piece.type()) {
                case PAWN:
                    pawnMoves(board, square, color, enPassantSquare, out);
                    break;
                case KNIGHT:
                    stepMoves(board, square, color, KNIGHT_STEPS, out);
                    break;
                case BISHOP:
                    slideMoves(board, square, color, BISHOP_DIRECTIONS, out);
                    break;
                case ROOK:
                    slideMoves(board, square, color, ROOK_DIRECTIONS, out);
                    break;
                case QUEEN:
                    slideMoves(board, square, color, ROOK_DIRECTIONS, out);
                    slideMoves(board, square, color, BISHOP_DIRECTIONS, out);
                    break;
                case KING:
                    stepMoves(board, square, color, KING_STEPS, out);
                    castlingMoves(board, square, color, castlingRights, out);
                    break;
                default:
                    throw new IllegalStateException("Unknown piece type " + piece.type());
            }
        }
    }

    private static void pawnMoves(Board board, int square, PieceColor color, int enPassantSquare,
            List<ChessMove> out) {
        int direction = color == PieceColor.WHITE ? 1 : -1;
        int startRank = color == PieceColor.WHITE ? 1 : 6;
        int promotionRank = color == PieceColor.WHITE ? 7 : 0;
        int file = Square.file(square);
        int rank = Square.rank(square);
        int nextRank = rank + direction;
        if (nextRank < 0 || nextRank > 7) {
            return;
        }

        int oneStep = Square.of(file, nextRank);
        if (board.isEmpty(oneStep)) {
            addPawnMove(square, oneStep, nextRank == promotionRank, out);
            if (rank == startRank) {
                int twoSteps = Square.of(file, rank + 2 * direction);
                if (board.isEmpty(twoSteps)) {
                    out.add(ChessMove.of(square, twoSteps));
                }
            }
        }
        for (int df = -1; df <= 1; df += 2) {
            if (!Square.isOnBoard(file + df, nextRank)) {
                continue;
            }
            int target = Square.of(file + df, nextRank);
            Piece victim = board.get(target);
            if (victim != null && victim.color() != color) {
                addPawnMove(square, target, nextRank == promotionRank, out);
            } else if (victim == null && target == enPassantSquare) {
                out.add(ChessMove.of(square, target));
            }
        }
    }

    private static void addPawnMove(int from, int to, boolean promotes, List<ChessMove> out) {
        if (!promotes) {
            out.add(ChessMove.of(from, to));
            return;
        }
        for (PieceType promotion : PROMOTIONS) {
            out.add(new ChessMove(from, to, promotion));
        }
    }

    private static void stepMoves(Board board, int square, PieceColor color, int[][] steps, List<ChessMove> out) {
        int file = Square.file(square);
        int rank = Square.rank(square);
        for (int[] step : steps) {
            int f = file + step[0];
            int r = rank + step[1];
            if (!Square.isOnBoard(f, r)) {
                continue;
            }
            int target = Square.of(f, r);
            Piece occupant = board.get(target);
            if (occupant == null || occupant.color() != color) {
                out.add(ChessMove.of(square, target));
            }
        }
    }

    private static void slideMoves(Board board, int square, PieceColor color, int[][] directions,
            List<ChessMove> out) {
        int file = Square.file(square);
        int rank = Square.rank(square);
        for (int[] direction : directions) {
            int f = file + direction[0];
            int r = rank + direction[1];
            while (Square.isOnBoard(f, r)) {
                int target = Square.of(f, r);
                Piece occupant = board.get(target);
                if (occupant == null) {
                    out.add(ChessMove.of(square, target));
                } else {
                    if (occupant.color() != color) {
                        out.add(ChessMove.of(square, target));
                    }
                    break;
                }
                f += direction[0];
                r += direction[1];
            }
        }
    }

    private static void castlingMoves(Board board, int square, PieceColor color, int castlingRights,
            List<ChessMove> out) {
        int home = color == PieceColor.WHITE ? Square.E1 : Square.E8;
        if (square != home) {
            return;
        }
        PieceColor enemy = color.opponent();
        Piece rook = Piece.of(color, PieceType.ROOK);
        int kingSide = color == PieceColor.WHITE ? ChessPosition.WHITE_KINGSIDE : ChessPosition.BLACK_KINGSIDE;
        int queenSide = color == PieceColor.WHITE ? ChessPosition.WHITE_QUEENSIDE : ChessPosition.BLACK_QUEENSIDE;

        if ((castlingRights & kingSide) != 0
                && board.get(home + 3) == rook
                && board.isEmpty(home + 1) && board.isEmpty(home + 2)
                && !isAttacked(board, home, enemy)
                && !isAttacked(board, home + 1, enemy)
                && !isAttacked(board, home + 2, enemy)) {
            out.add(ChessMove.of(home, home + 2));
        }
        if ((castlingRights & queenSide) != 0
                && board.get(home - 4) == rook
                && board.isEmpty(home - 1) && board.isEmpty(home - 2) && board.isEmpty(home - 3)
                && !isAttacked(board, home, enemy)
                && !isAttacked(board, home - 1, enemy)
                && !isAttacked(board, home - 2, enemy)) {
            out.add(ChessMove.of(home, home - 2));
        }
    }
}
