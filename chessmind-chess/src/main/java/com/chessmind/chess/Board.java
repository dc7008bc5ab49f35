package com.chessmind.chess;

import java.util.Arrays;

/**
 * Immutable 8x8 mailbox of pieces. Empty squares hold {@code null}.
 */
public final class Board {

    private static final Board EMPTY = new Board(new Piece[Square.COUNT]);

    private final Piece[] squares;

    private Board(Piece[] squares) {
        this.squares = squares;
    }

    public static Board empty() {
        return EMPTY;
    }

    /**
     * Creates a board from 64 squares indexed a1 = 0. The array is copied.
     */
    public static Board of(Piece[] squares) {
        if (squares.length != Square.COUNT) {
            throw new IllegalArgumentException("Board needs 64 squares, got " + squares.length);
        }
        return new Board(squares.clone());
    }

    public Piece get(int square) {
        return squares[square];
    }

    public boolean isEmpty(int square) {
        return squares[square] == null;
    }

    /**
     * Returns a board with {@code piece} placed on {@code square}; {@code null} clears it.
     */
    public Board with(int square, Piece piece) {
        Piece[] copy = squares.clone();
        copy[square] = piece;
        return new Board(copy);
    }

    /**
     * Square of the king of {@code color}, or {@link Square#NONE} if there is none.
     */
    public int kingSquare(PieceColor color) {
        Piece king = Piece.of(color, PieceType.KING);
        for (int square = 0; square < Square.COUNT; square++) {
            if (squares[square] == king) {
                return square;
            }
        }
        return Square.NONE;
    }

    public int count(Piece piece) {
        int count = 0;
        for (Piece occupant : squares) {
            if (occupant == piece) {
                count++;
            }
        }
        return count;
    }

    public int count(PieceType type) {
        return count(Piece.of(PieceColor.WHITE, type)) + count(Piece.of(PieceColor.BLACK, type));
    }

    /**
     * Plays {@code move} on the squares without checking legality. Handles castling (the king moving
     * two files), en passant (a pawn moving diagonally onto the empty en-passant square) and
     * promotion.
     */
    public Board afterMove(ChessMove move, int enPassantSquare) {
        Piece moving = squares[move.from()];
        if (moving == null) {
            throw new IllegalArgumentException("No piece on " + Square.name(move.from()));
        }
        Piece[] copy = squares.clone();
        copy[move.from()] = null;

        if (moving.type() == PieceType.PAWN) {
            if (move.to() == enPassantSquare && squares[move.to()] == null
                    && Square.file(move.from()) != Square.file(move.to())) {
                copy[move.to() - moving.color().pawnStep()] = null;
            }
            copy[move.to()] = move.isPromotion() ? Piece.of(moving.color(), move.promotion()) : moving;
            return new Board(copy);
        }

        if (moving.type() == PieceType.KING && Math.abs(move.to() - move.from()) == 2) {
            boolean kingSide = move.to() > move.from();
            int rookFrom = kingSide ? move.from() + 3 : move.from() - 4;
            int rookTo = kingSide ? move.from() + 1 : move.from() - 1;
            copy[rookTo] = copy[rookFrom];
            copy[rookFrom] = null;
        }
        copy[move.to()] = moving;
        return new Board(copy);
    }

    /**
     * Board reflected top to bottom with every piece changing colour.
     */
    public Board mirrored() {
        Piece[] copy = new Piece[Square.COUNT];
        for (int square = 0; square < Square.COUNT; square++) {
            Piece piece = squares[square];
            copy[Square.mirror(square)] = piece == null ? null : piece.flipped();
        }
        return new Board(copy);
    }

    /**
     * Text diagram with rank 8 at the top, as printed by the console front-end.
     */
    public String render() {
        StringBuilder builder = new StringBuilder();
        builder.append("  a b c d e f g h\n");
        builder.append("  ---------------\n");
        for (int rank = 7; rank >= 0; rank--) {
            builder.append(rank + 1).append('|');
            for (int file = 0; file < 8; file++) {
                Piece piece = squares[Square.of(file, rank)];
                builder.append(piece == null ? '.' : piece.symbol()).append(' ');
            }
            builder.append('|').append(rank + 1).append('\n');
        }
        builder.append("  ---------------\n");
        builder.append("  a b c d e f g h\n");
        return builder.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Board)) {
            return false;
        }
        return Arrays.equals(squares, ((Board) other).squares);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(squares);
    }

    @Override
    public String toString() {
        return render();
    }
}
