package com.chessmind.chess;

/**
 * A move from one square to another, with the piece type chosen on promotion.
 *
 * @param from origin square
 * @param to destination square
 * @param promotion promotion piece, or {@code null}
 */
public record ChessMove(int from, int to, PieceType promotion) {

    public ChessMove {
        if (from < 0 || from >= Square.COUNT || to < 0 || to >= Square.COUNT) {
            throw new IllegalArgumentException("Square out of range in move " + from + "->" + to);
        }
        if (from == to) {
            throw new IllegalArgumentException("Move must change square: " + Square.name(from));
        }
        if (promotion == PieceType.PAWN || promotion == PieceType.KING) {
            throw new IllegalArgumentException("Cannot promote to " + promotion);
        }
    }

    public static ChessMove of(int from, int to) {
        return new ChessMove(from, to, null);
    }

    /**
     * Parses long algebraic (UCI) notation such as {@code e2e4} or {@code e7e8q}.
     */
    public static ChessMove fromUci(String uci) {
        if (uci == null || (uci.length() != 4 && uci.length() != 5)) {
            throw new IllegalArgumentException("Invalid UCI move: " + uci);
        }
        int from = Square.parse(uci.substring(0, 2));
        int to = Square.parse(uci.substring(2, 4));
        PieceType promotion = uci.length() == 5 ? PieceType.fromSymbol(uci.charAt(4)) : null;
        return new ChessMove(from, to, promotion);
    }

    public boolean isPromotion() {
        return promotion != null;
    }

    public String uci() {
        String base = Square.name(from) + Square.name(to);
        return promotion == null ? base : base + promotion.symbol();
    }

    @Override
    public String toString() {
        return uci();
    }
}
