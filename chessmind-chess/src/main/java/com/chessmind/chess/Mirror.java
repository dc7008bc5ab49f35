package com.chessmind.chess;

/**
 * Colour-swapped counterpart of a position: the board is reflected top to bottom, every piece
 * changes colour and the other side moves. An anti-symmetric evaluation scores the mirror as the
 * negation of the original.
 */
public final class Mirror {

    private Mirror() {
    }

    public static ChessPosition of(ChessPosition position) {
        int rights = position.castlingRights();
        int mirroredRights = ((rights & (ChessPosition.WHITE_KINGSIDE | ChessPosition.WHITE_QUEENSIDE)) << 2)
                | ((rights & (ChessPosition.BLACK_KINGSIDE | ChessPosition.BLACK_QUEENSIDE)) >> 2);
        int enPassant = position.enPassantSquare() == Square.NONE
                ? Square.NONE
                : Square.mirror(position.enPassantSquare());
        return new ChessPosition(position.board().mirrored(), position.sideToMove().opponent(), mirroredRights,
                enPassant, position.halfmoveClock(), position.fullmoveNumber());
    }
}
