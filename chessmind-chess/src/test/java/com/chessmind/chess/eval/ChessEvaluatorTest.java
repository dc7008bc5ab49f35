package com.chessmind.chess.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chessmind.chess.ChessMove;
import com.chessmind.chess.ChessPosition;
import com.chessmind.chess.Fen;
import com.chessmind.chess.Mirror;
import com.chessmind.chess.Piece;
import com.chessmind.chess.Square;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ChessEvaluatorTest {

    private final ChessEvaluator evaluator = new ChessEvaluator();

    @Test
    void startingPositionIsBalanced() {
        assertEquals(0, evaluator.evaluate(ChessPosition.startingPosition()));
    }

    @Test
    void mirroredPositionsScoreAsNegation() {
        Random random = new Random(2024L);
        for (int game = 0; game < 20; game++) {
            ChessPosition position = ChessPosition.startingPosition();
            for (int ply = 0; ply < 30; ply++) {
                List<ChessMove> moves = position.legalMoves();
                if (moves.isEmpty()) {
                    break;
                }
                int score = evaluator.evaluate(position);
                assertEquals(-score, evaluator.evaluate(Mirror.of(position)),
                        "Mirror must negate the score of " + Fen.format(position));
                position = position.apply(moves.get(random.nextInt(moves.size())));
            }
        }
    }

    @Test
    void extraMaterialFavoursItsOwner() {
        ChessPosition whiteUpAQueen = Fen.parse("4k3/8/8/8/8/8/8/3QK3 w - - 0 1");

        assertTrue(evaluator.evaluate(whiteUpAQueen) > 8_000, "A queen is worth about 9000 millipawns");
        assertEquals(900, ChessEvaluator.material(whiteUpAQueen.board()));
        assertTrue(evaluator.evaluate(Mirror.of(whiteUpAQueen)) < -8_000);
    }

    @Test
    void readsTablesFromEachSidesPointOfView() {
        assertEquals(20, PieceSquareTables.value(Piece.WHITE_PAWN, Square.parse("e4"), false));
        assertEquals(20, PieceSquareTables.value(Piece.BLACK_PAWN, Square.parse("e5"), false));
        assertEquals(-20, PieceSquareTables.value(Piece.WHITE_PAWN, Square.parse("e2"), false));
        assertEquals(-50, PieceSquareTables.value(Piece.WHITE_KNIGHT, Square.A1, false));
        assertEquals(30, PieceSquareTables.value(Piece.WHITE_KING, Square.G1, false));
        assertEquals(-30, PieceSquareTables.value(Piece.WHITE_KING, Square.G1, true));
    }

    @Test
    void detectsEndGame() {
        assertFalse(ChessEvaluator.isEndGame(ChessPosition.startingPosition().board()));
        assertTrue(ChessEvaluator.isEndGame(Fen.parse("4k3/pppp4/8/8/8/8/PPPP4/R3K3 w - - 0 1").board()));
        assertTrue(ChessEvaluator.isEndGame(Fen.parse("3qk3/8/8/8/8/8/8/3QK1N1 w - - 0 1").board()));
        assertFalse(ChessEvaluator.isEndGame(Fen.parse("2bqkb2/8/8/8/8/8/8/3QK1N1 w - - 0 1").board()));
    }

    @Test
    void mobilityCountsBothSides() {
        assertEquals(0, ChessEvaluator.mobility(ChessPosition.startingPosition()));

        ChessPosition afterE4 = ChessPosition.startingPosition().apply(ChessMove.fromUci("e2e4"));
        assertEquals(30 - 20, ChessEvaluator.mobility(afterE4), "1.e4 frees the bishop, queen and king");
    }
}
