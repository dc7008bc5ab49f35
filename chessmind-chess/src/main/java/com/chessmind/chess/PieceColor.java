package com.chessmind.chess;

import com.chessmind.core.Side;

/**
 * Colour of a chess piece or of the player to move. White maximizes.
 */
public enum PieceColor {
    WHITE,
    BLACK;

    public PieceColor opponent() {
        return this == WHITE ? BLACK : WHITE;
    }

    public Side side() {
        return this == WHITE ? Side.MAXIMIZER : Side.MINIMIZER;
    }

    /**
     * Square index offset of a single pawn step.
     */
    public int pawnStep() {
        return this == WHITE ? 8 : -8;
    }

    public String displayName() {
        return this == WHITE ? "White" : "Black";
    }
}
