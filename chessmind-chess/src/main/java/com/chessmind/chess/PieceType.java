package com.chessmind.chess;

public enum PieceType {
    PAWN('p'),
    KNIGHT('n'),
    BISHOP('b'),
    ROOK('r'),
    QUEEN('q'),
    KING('k');

    private final char symbol;

    PieceType(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Lower-case letter used by FEN and UCI.
     */
    public char symbol() {
        return symbol;
    }

    public boolean isMinor() {
        return this == KNIGHT || this == BISHOP;
    }

    public static PieceType fromSymbol(char symbol) {
        char lower = Character.toLowerCase(symbol);
        for (PieceType type : values()) {
            if (type.symbol == lower) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown piece symbol: " + symbol);
    }
}
