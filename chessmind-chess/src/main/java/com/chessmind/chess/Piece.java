package com.chessmind.chess;

/**
 * A coloured chess piece.
 */
public enum Piece {
    WHITE_PAWN(PieceColor.WHITE, PieceType.PAWN),
    WHITE_KNIGHT(PieceColor.WHITE, PieceType.KNIGHT),
    WHITE_BISHOP(PieceColor.WHITE, PieceType.BISHOP),
    WHITE_ROOK(PieceColor.WHITE, PieceType.ROOK),
    WHITE_QUEEN(PieceColor.WHITE, PieceType.QUEEN),
    WHITE_KING(PieceColor.WHITE, PieceType.KING),
    BLACK_PAWN(PieceColor.BLACK, PieceType.PAWN),
    BLACK_KNIGHT(PieceColor.BLACK, PieceType.KNIGHT),
    BLACK_BISHOP(PieceColor.BLACK, PieceType.BISHOP),
    BLACK_ROOK(PieceColor.BLACK, PieceType.ROOK),
    BLACK_QUEEN(PieceColor.BLACK, PieceType.QUEEN),
    BLACK_KING(PieceColor.BLACK, PieceType.KING);

    private final PieceColor color;
    private final PieceType type;

    Piece(PieceColor color, PieceType type) {
        this.color = color;
        this.type = type;
    }

    public PieceColor color() {
        return color;
    }

    public PieceType type() {
        return type;
    }

    public boolean is(PieceColor expectedColor, PieceType expectedType) {
        return color == expectedColor && type == expectedType;
    }

    /**
     * FEN letter: upper case for White, lower case for Black.
     */
    public char symbol() {
        return color == PieceColor.WHITE ? Character.toUpperCase(type.symbol()) : type.symbol();
    }

    /**
     * The same piece type in the other colour.
     */
    public Piece flipped() {
        return of(color.opponent(), type);
    }

    public static Piece of(PieceColor color, PieceType type) {
        return values()[color.ordinal() * PieceType.values().length + type.ordinal()];
    }

    public static Piece fromSymbol(char symbol) {
        PieceColor color = Character.isUpperCase(symbol) ? PieceColor.WHITE : PieceColor.BLACK;
        return of(color, PieceType.fromSymbol(symbol));
    }
}
