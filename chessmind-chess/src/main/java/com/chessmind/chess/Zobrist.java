package com.chessmind.chess;

import java.util.SplittableRandom;

/**
 * Zobrist hashing of positions, used to detect repetitions.
 */
final class Zobrist {

    private static final long SEED = 0x5EED_C4E5_5L;

    private static final long[][] PIECES = new long[Piece.values().length][Square.COUNT];
    private static final long[] CASTLING = new long[16];
    private static final long[] EN_PASSANT_FILE = new long[8];
    private static final long BLACK_TO_MOVE;

    static {
        SplittableRandom random = new SplittableRandom(SEED);
        for (long[] squares : PIECES) {
            for (int square = 0; square < Square.COUNT; square++) {
                squares[square] = random.nextLong();
            }
        }
        for (int i = 0; i < CASTLING.length; i++) {
            CASTLING[i] = random.nextLong();
        }
        for (int i = 0; i < EN_PASSANT_FILE.length; i++) {
            EN_PASSANT_FILE[i] = random.nextLong();
        }
        BLACK_TO_MOVE = random.nextLong();
    }

    private Zobrist() {
    }

    static long key(Board board, PieceColor sideToMove, int castlingRights, int enPassantSquare) {
        long key = 0L;
        for (int square = 0; square < Square.COUNT; square++) {
            Piece piece = board.get(square);
            if (piece != null) {
                key ^= PIECES[piece.ordinal()][square];
            }
        }
        key ^= CASTLING[castlingRights];
        if (enPassantSquare != Square.NONE) {
            key ^= EN_PASSANT_FILE[Square.file(enPassantSquare)];
        }
        if (sideToMove == PieceColor.BLACK) {
            key ^= BLACK_TO_MOVE;
        }
        return key;
    }
}
