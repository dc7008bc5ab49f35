package com.chessmind.chess;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable chess position. Besides the board it carries everything legality and the draw rules
 * depend on, and a link to the position it was reached from so repetitions can be counted.
 */
public final class ChessPosition {

    public static final int WHITE_KINGSIDE = 1;
    public static final int WHITE_QUEENSIDE = 2;
    public static final int BLACK_KINGSIDE = 4;
    public static final int BLACK_QUEENSIDE = 8;
    public static final int ALL_CASTLING = 15;

    private final Board board;
    private final PieceColor sideToMove;
    private final int castlingRights;
    private final int enPassantSquare;
    private final int halfmoveClock;
    private final int fullmoveNumber;
    private final ChessPosition previous;
    private final long key;

    private volatile List<ChessMove> legalMoves;

    /**
     * Creates a position without history.
     */
    public ChessPosition(Board board, PieceColor sideToMove, int castlingRights, int enPassantSquare,
            int halfmoveClock, int fullmoveNumber) {
        this(board, sideToMove, castlingRights, enPassantSquare, halfmoveClock, fullmoveNumber, null);
    }

    private ChessPosition(Board board, PieceColor sideToMove, int castlingRights, int enPassantSquare,
            int halfmoveClock, int fullmoveNumber, ChessPosition previous) {
        this.board = Objects.requireNonNull(board, "board");
        this.sideToMove = Objects.requireNonNull(sideToMove, "sideToMove");
        if (castlingRights < 0 || castlingRights > ALL_CASTLING) {
            throw new IllegalArgumentException("Invalid castling rights: " + castlingRights);
        }
        if (enPassantSquare != Square.NONE && (enPassantSquare < 0 || enPassantSquare >= Square.COUNT)) {
            throw new IllegalArgumentException("Invalid en passant square: " + enPassantSquare);
        }
        if (halfmoveClock < 0) {
            throw new IllegalArgumentException("Halfmove clock must not be negative");
        }
        if (fullmoveNumber < 1) {
            throw new IllegalArgumentException("Fullmove number must be at least 1");
        }
        this.castlingRights = castlingRights;
        this.enPassantSquare = enPassantSquare;
        this.halfmoveClock = halfmoveClock;
        this.fullmoveNumber = fullmoveNumber;
        this.previous = previous;
        this.key = Zobrist.key(board, sideToMove, castlingRights, enPassantSquare);
    }

    public static ChessPosition startingPosition() {
        return Fen.parse(Fen.STARTING_POSITION);
    }

    public Board board() {
        return board;
    }

    public PieceColor sideToMove() {
        return sideToMove;
    }

    public int castlingRights() {
        return castlingRights;
    }

    public boolean hasCastlingRight(int right) {
        return (castlingRights & right) != 0;
    }

    /**
     * Square a pawn may capture onto en passant, or {@link Square#NONE}.
     */
    public int enPassantSquare() {
        return enPassantSquare;
    }

    public int halfmoveClock() {
        return halfmoveClock;
    }

    public int fullmoveNumber() {
        return fullmoveNumber;
    }

    /**
     * Position before the last move, or {@code null} at the start of the recorded history.
     */
    public ChessPosition previous() {
        return previous;
    }

    public long key() {
        return key;
    }

    public List<ChessMove> legalMoves() {
        List<ChessMove> moves = legalMoves;
        if (moves == null) {
            moves = Collections.unmodifiableList(
                    MoveGenerator.legalMoves(board, sideToMove, castlingRights, enPassantSquare));
            legalMoves = moves;
        }
        return moves;
    }

    public boolean isLegal(ChessMove move) {
        return legalMoves().contains(move);
    }

    public boolean isInCheck() {
        return MoveGenerator.isInCheck(board, sideToMove);
    }

    public boolean isCheckmate() {
        return legalMoves().isEmpty() && isInCheck();
    }

    public boolean isStalemate() {
        return legalMoves().isEmpty() && !isInCheck();
    }

    /**
     * Neither side can ever mate: only kings and at most one minor piece remain, or only kings and
     * bishops that all stand on squares of one colour.
     */
    public boolean isInsufficientMaterial() {
        int minors = 0;
        int lightBishops = 0;
        int darkBishops = 0;
        boolean knights = false;
        for (int square = 0; square < Square.COUNT; square++) {
            Piece piece = board.get(square);
            if (piece == null || piece.type() == PieceType.KING) {
                continue;
            }
            if (!piece.type().isMinor()) {
                return false;
            }
            minors++;
            if (piece.type() == PieceType.KNIGHT) {
                knights = true;
            } else if (Square.isLight(square)) {
                lightBishops++;
            } else {
                darkBishops++;
            }
        }
        if (minors <= 1) {
            return true;
        }
        return !knights && (lightBishops == 0 || darkBishops == 0);
    }

    /**
     * Times this position has occurred in the recorded history, counting itself.
     */
    public int repetitionCount() {
        int count = 1;
        ChessPosition earlier = previous;
        for (int ply = 1; ply <= halfmoveClock && earlier != null; ply++) {
            if (earlier.key == key && earlier.board.equals(board)) {
                count++;
            }
            earlier = earlier.previous;
        }
        return count;
    }

    /**
     * The fifty-move rule may be claimed: a hundred half-moves without capture or pawn move.
     */
    public boolean isFiftyMoves() {
        return halfmoveClock >= 100;
    }

    public boolean isSeventyFiveMoves() {
        return halfmoveClock >= 150;
    }

    public boolean isThreefoldRepetition() {
        return repetitionCount() >= 3;
    }

    public boolean isFivefoldRepetition() {
        return repetitionCount() >= 5;
    }

    /**
     * Plays a legal move and returns the resulting position.
     *
     * @throws IllegalArgumentException if the move is not legal here
     */
    public ChessPosition apply(ChessMove move) {
        Objects.requireNonNull(move, "move");
        if (!isLegal(move)) {
            throw new IllegalArgumentException("Illegal move " + move.uci() + " in " + Fen.format(this));
        }
        Piece moving = board.get(move.from());
        boolean capture = !board.isEmpty(move.to())
                || (moving.type() == PieceType.PAWN && move.to() == enPassantSquare);
        Board next = board.afterMove(move, enPassantSquare);

        int rights = castlingRights & ~rightsLostBy(move.from()) & ~rightsLostBy(move.to());
        int nextEnPassant = Square.NONE;
        if (moving.type() == PieceType.PAWN && Math.abs(move.to() - move.from()) == 16) {
            int skipped = (move.from() + move.to()) / 2;
            if (enemyPawnBeside(next, move.to(), sideToMove.opponent())
                    && canCaptureEnPassant(next, sideToMove.opponent(), skipped)) {
                nextEnPassant = skipped;
            }
        }
        int nextHalfmove = capture || moving.type() == PieceType.PAWN ? 0 : halfmoveClock + 1;
        int nextFullmove = sideToMove == PieceColor.BLACK ? fullmoveNumber + 1 : fullmoveNumber;
        return new ChessPosition(next, sideToMove.opponent(), rights, nextEnPassant, nextHalfmove, nextFullmove,
                this);
    }

    private static int rightsLostBy(int square) {
        switch (square) {
            case Square.E1:
                return WHITE_KINGSIDE | WHITE_QUEENSIDE;
            case Square.H1:
                return WHITE_KINGSIDE;
            case Square.A1:
                return WHITE_QUEENSIDE;
            case Square.E8:
                return BLACK_KINGSIDE | BLACK_QUEENSIDE;
            case Square.H8:
                return BLACK_KINGSIDE;
            case Square.A8:
                return BLACK_QUEENSIDE;
            default:
                return 0;
        }
    }

    private static boolean enemyPawnBeside(Board board, int square, PieceColor enemy) {
        Piece pawn = Piece.of(enemy, PieceType.PAWN);
        int file = Square.file(square);
        return (file > 0 && board.get(square - 1) == pawn) || (file < 7 && board.get(square + 1) == pawn);
    }

    /**
     * A pawn beside the pushed pawn may still be pinned, so the capture has to pass the king-safety
     * filter before the square counts.
     */
    private static boolean canCaptureEnPassant(Board board, PieceColor capturer, int target) {
        for (ChessMove move : MoveGenerator.legalMoves(board, capturer, 0, target)) {
            if (move.to() == target && board.get(move.from()).type() == PieceType.PAWN) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return Fen.format(this);
    }
}
