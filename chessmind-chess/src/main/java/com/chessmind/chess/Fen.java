package com.chessmind.chess;

/**
 * Forsyth-Edwards Notation import and export.
 */
public final class Fen {

    public static final String STARTING_POSITION = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private Fen() {
    }

    /**
     * Parses a FEN record. The halfmove clock and fullmove number may be omitted and default to
     * {@code 0} and {@code 1}.
     *
     * @throws IllegalArgumentException if the record is malformed
     */
    public static ChessPosition parse(String fen) {
        if (fen == null || fen.isBlank()) {
            throw new IllegalArgumentException("Invalid FEN: empty");
        }
        String[] fields = fen.trim().split("\\s+");
        if (fields.length < 4 || fields.length > 6) {
            throw new IllegalArgumentException("Invalid FEN, expected 4 to 6 fields: " + fen);
        }
        try {
            Board board = parsePlacement(fields[0], fen);
            PieceColor side = parseSide(fields[1], fen);
            int castling = parseCastling(fields[2], fen);
            int enPassant = "-".equals(fields[3]) ? Square.NONE : Square.parse(fields[3]);
            int halfmove = fields.length > 4 ? Integer.parseInt(fields[4]) : 0;
            int fullmove = fields.length > 5 ? Integer.parseInt(fields[5]) : 1;
            if (board.kingSquare(PieceColor.WHITE) == Square.NONE || board.kingSquare(PieceColor.BLACK) == Square.NONE) {
                throw new IllegalArgumentException("Invalid FEN, both sides need a king: " + fen);
            }
            if (board.count(Piece.WHITE_KING) > 1 || board.count(Piece.BLACK_KING) > 1) {
                throw new IllegalArgumentException("Invalid FEN, more than one king per side: " + fen);
            }
            return new ChessPosition(board, side, castling, enPassant, halfmove, fullmove);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid FEN move counters: " + fen, ex);
        }
    }

    public static String format(ChessPosition position) {
        StringBuilder builder = new StringBuilder();
        Board board = position.board();
        for (int rank = 7; rank >= 0; rank--) {
            int empty = 0;
            for (int file = 0; file < 8; file++) {
                Piece piece = board.get(Square.of(file, rank));
                if (piece == null) {
                    empty++;
                    continue;
                }
                if (empty > 0) {
                    builder.append(empty);
                    empty = 0;
                }
                builder.append(piece.symbol());
            }
            if (empty > 0) {
                builder.append(empty);
            }
            if (rank > 0) {
                builder.append('/');
            }
        }
        builder.append(' ').append(position.sideToMove() == PieceColor.WHITE ? 'w' : 'b');
        builder.append(' ').append(formatCastling(position.castlingRights()));
        builder.append(' ').append(position.enPassantSquare() == Square.NONE
                ? "-" : Square.name(position.enPassantSquare()));
        builder.append(' ').append(position.halfmoveClock());
        builder.append(' ').append(position.fullmoveNumber());
        return builder.toString();
    }

    private static Board parsePlacement(String placement, String fen) {
        String[] ranks = placement.split("/", -1);
        if (ranks.length != 8) {
            throw new IllegalArgumentException("Invalid FEN, expected 8 ranks: " + fen);
        }
        Piece[] squares = new Piece[Square.COUNT];
        for (int i = 0; i < 8; i++) {
            int rank = 7 - i;
            int file = 0;
            for (char c : ranks[i].toCharArray()) {
                if (c >= '1' && c <= '8') {
                    file += c - '0';
                } else {
                    if (file > 7) {
                        throw new IllegalArgumentException("Invalid FEN, rank " + (rank + 1) + " is too long: " + fen);
                    }
                    squares[Square.of(file, rank)] = Piece.fromSymbol(c);
                    file++;
                }
            }
            if (file != 8) {
                throw new IllegalArgumentException("Invalid FEN, rank " + (rank + 1) + " has " + file + " files: "
                        + fen);
            }
        }
        return Board.of(squares);
    }

    private static PieceColor parseSide(String side, String fen) {
        if ("w".equals(side)) {
            return PieceColor.WHITE;
        }
        if ("b".equals(side)) {
            return PieceColor.BLACK;
        }
        throw new IllegalArgumentException("Invalid FEN side to move '" + side + "': " + fen);
    }

    private static int parseCastling(String castling, String fen) {
        if ("-".equals(castling)) {
            return 0;
        }
        int rights = 0;
        for (char c : castling.toCharArray()) {
            switch (c) {
                case 'K':
                    rights |= ChessPosition.WHITE_KINGSIDE;
                    break;
                case 'Q':
                    rights |= ChessPosition.WHITE_QUEENSIDE;
                    break;
                case 'k':
                    rights |= ChessPosition.BLACK_KINGSIDE;
                    break;
                case 'q':
                    rights |= ChessPosition.BLACK_QUEENSIDE;
                    break;
                default:
                    throw new IllegalArgumentException("Invalid FEN castling field '" + castling + "': " + fen);
            }
        }
        return rights;
    }

    private static String formatCastling(int rights) {
        StringBuilder builder = new StringBuilder();
        if ((rights & ChessPosition.WHITE_KINGSIDE) != 0) {
            builder.append('K');
        }
        if ((rights & ChessPosition.WHITE_QUEENSIDE) != 0) {
            builder.append('Q');
        }
        if ((rights & ChessPosition.BLACK_KINGSIDE) != 0) {
            builder.append('k');
        }
        if ((rights & ChessPosition.BLACK_QUEENSIDE) != 0) {
            builder.append('q');
        }
        return builder.length() == 0 ? "-" : builder.toString();
    }
}
