package com.chessmind.chess.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chessmind.chess.ChessPosition;
import com.chessmind.chess.Fen;
import com.chessmind.core.Outcome;
import com.chessmind.core.ai.SearchConfig;
import org.junit.jupiter.api.Test;

class MatchRunnerTest {

    private static final String MATE_IN_ONE = "6k1/5ppp/8/8/8/8/8/R5K1 w - - 0 1";

    @Test
    void abandonsGamesAtThePlyLimit() {
        try (MatchRunner runner = new MatchRunner(SearchConfig.fixedDepth(1), SearchConfig.fixedDepth(1), 6)) {
            MatchRunner.GameRecord game = runner.playGame(ChessPosition.startingPosition());

            assertEquals(6, game.moves().size());
            assertEquals(Outcome.ONGOING, game.outcome());
            assertEquals("Game ended.", game.description());
            assertFalse(game.finalPosition().isCheckmate());
            assertEquals(new MatchRunner.MatchSummary(1, 0, 0, 0, 1), runner.summary());
        }
    }

    @Test
    void recordsAWhiteWin() {
        try (MatchRunner runner = new MatchRunner(SearchConfig.fixedDepth(2), SearchConfig.fixedDepth(1), 0)) {
            MatchRunner.GameRecord game = runner.playGame(Fen.parse(MATE_IN_ONE));

            assertEquals(Outcome.MAXIMIZER_WINS, game.outcome());
            assertEquals("Ra8#", game.moves().get(0));
            assertEquals("Checkmate! White wins!", game.description());
            assertTrue(game.finalPosition().isCheckmate());
        }
    }

    @Test
    void tallyAccumulatesAcrossGames() {
        try (MatchRunner runner = new MatchRunner(SearchConfig.fixedDepth(1), SearchConfig.fixedDepth(1), 0)) {
            MatchRunner.MatchSummary summary = runner.playGames(3, Fen.parse(MATE_IN_ONE));

            assertEquals(new MatchRunner.MatchSummary(3, 3, 0, 0, 0), summary);
        }
    }

    @Test
    void rejectsAFinishedStartingPosition() {
        ChessPosition mated = Fen.parse("R5k1/5ppp/8/8/8/8/8/6K1 b - - 1 1");

        try (MatchRunner runner = new MatchRunner(SearchConfig.fixedDepth(1), SearchConfig.fixedDepth(1), 0)) {
            assertThrows(IllegalArgumentException.class, () -> runner.playGame(mated));
            assertThrows(IllegalArgumentException.class, () -> runner.playGames(0, ChessPosition.startingPosition()));
        }
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> new MatchRunner(SearchConfig.fixedDepth(0), SearchConfig.fixedDepth(1), 0));
        assertThrows(IllegalArgumentException.class,
                () -> new MatchRunner(SearchConfig.fixedDepth(1), SearchConfig.fixedDepth(1), -1));
    }

    @Test
    void commandLineRunParsesOptions() {
        MatchRunner.MatchSummary summary = MatchRunnerMain.run(
                new String[] {"2", "1", "1", "--maxPlies=4", "--timeMillis=1000"});

        assertEquals(2, summary.games());
        assertEquals(2, summary.unfinished());

        MatchRunner.MatchSummary mate = MatchRunnerMain.run(new String[] {"1", "1", "1", "--fen=" + MATE_IN_ONE});
        assertEquals(1, mate.whiteWins());
    }

    @Test
    void commandLineRunRejectsBadOptions() {
        assertThrows(IllegalArgumentException.class,
                () -> MatchRunnerMain.run(new String[] {"1", "1", "1", "--colour=white"}));
        assertThrows(NumberFormatException.class, () -> MatchRunnerMain.run(new String[] {"one", "1", "1"}));
        assertThrows(IllegalArgumentException.class,
                () -> MatchRunnerMain.run(new String[] {"1", "1", "1", "--timeMillis=-5"}));
    }
}
