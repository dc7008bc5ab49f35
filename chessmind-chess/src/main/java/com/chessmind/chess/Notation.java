package com.chessmind.chess;

import java.util.List;

/**
 * Standard algebraic (SAN) and long algebraic (UCI) move notation.
 */
public final class Notation {

    private Notation() {
    }

    public static String uci(ChessMove move) {
        return move.uci();
    }

    /**
     * Formats a legal move in SAN, e.g. {@code Nf3}, {@code exd5}, {@code O-O} or {@code e8=Q#}.
     */
    public static String san(ChessPosition position, ChessMove move) {
        if (!position.isLegal(move)) {
            throw new IllegalArgumentException("Illegal move " + move.uci() + " in " + Fen.format(position));
        }
        ChessPosition after = position.apply(move);
        String suffix = after.isCheckmate() ? "#" : after.isInCheck() ? "+" : "";
        return sanWithoutSuffix(position, move) + suffix;
    }

    /**
     * Parses user input, trying UCI first and SAN second.
     *
     * @throws IllegalArgumentException with message {@code "Invalid move: <text>"} if the text names
     *                                  no legal move
     */
    public static ChessMove parse(ChessPosition position, String text) {
        String trimmed = text == null ? "" : text.trim();
        ChessMove uci = tryUci(position, trimmed);
        if (uci != null) {
            return uci;
        }
        ChessMove san = trySan(position, trimmed);
        if (san != null) {
            return san;
        }
        throw new IllegalArgumentException("Invalid move: " + text);
    }

    public static ChessMove parseSan(ChessPosition position, String text) {
        ChessMove move = trySan(position, text == null ? "" : text.trim());
        if (move == null) {
            throw new IllegalArgumentException("Invalid move: " + text);
        }
        return move;
    }

    private static ChessMove tryUci(ChessPosition position, String text) {
        ChessMove move;
        try {
            move = ChessMove.fromUci(text.toLowerCase());
        } catch (IllegalArgumentException ex) {
            return null;
        }
        return position.isLegal(move) ? move : null;
    }

    private static ChessMove trySan(ChessPosition position, String text) {
        String normalized = normalizeSan(text);
        if (normalized.isEmpty()) {
            return null;
        }
        for (ChessMove move : position.legalMoves()) {
            String candidate = sanWithoutSuffix(position, move);
            if (candidate.equals(normalized) || candidate.replace("=", "").equals(normalized)) {
                return move;
            }
        }
        return null;
    }

    private static String normalizeSan(String text) {
        String stripped = text.replaceAll("[+#!?]+$", "");
        return stripped.replace('0', 'O');
    }

    private static String sanWithoutSuffix(ChessPosition position, ChessMove move) {
        Board board = position.board();
        Piece piece = board.get(move.from());
        if (piece.type() == PieceType.KING && Math.abs(move.to() - move.from()) == 2) {
            return move.to() > move.from() ? "O-O" : "O-O-O";
        }

        boolean capture = !board.isEmpty(move.to())
                || (piece.type() == PieceType.PAWN && Square.file(move.from()) != Square.file(move.to()));
        StringBuilder builder = new StringBuilder();
        if (piece.type() == PieceType.PAWN) {
            if (capture) {
                builder.append((char) ('a' + Square.file(move.from())));
            }
        } else {
            builder.append(Character.toUpperCase(piece.type().symbol()));
            builder.append(disambiguation(position, move, piece));
        }
        if (capture) {
            builder.append('x');
        }
        builder.append(Square.name(move.to()));
        if (move.isPromotion()) {
            builder.append('=').append(Character.toUpperCase(move.promotion().symbol()));
        }
        return builder.toString();
    }

    private static String disambiguation(ChessPosition position, ChessMove move, Piece piece) {
        List<ChessMove> moves = position.legalMoves();
        boolean ambiguous = false;
        boolean sameFile = false;
        boolean sameRank = false;
        for (ChessMove other : moves) {
            if (other.from() == move.from() || other.to() != move.to()
                    || position.board().get(other.from()) != piece) {
                continue;
            }
            ambiguous = true;
            sameFile |= Square.file(other.from()) == Square.file(move.from());
            sameRank |= Square.rank(other.from()) == Square.rank(move.from());
        }
        if (!ambiguous) {
            return "";
        }
        if (!sameFile) {
            return String.valueOf((char) ('a' + Square.file(move.from())));
        }
        if (!sameRank) {
            return String.valueOf((char) ('1' + Square.rank(move.from())));
        }
        return Square.name(move.from());
    }
}
