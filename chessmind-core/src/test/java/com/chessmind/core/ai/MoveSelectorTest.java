package com.chessmind.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chessmind.core.Evaluator;
import com.chessmind.core.Scores;
import com.chessmind.core.fixtures.TicTacToe;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class MoveSelectorTest {

    private final TicTacToe game = new TicTacToe();

    @Test
    void depthZeroEvaluatesRootDirectly() {
        AtomicInteger calls = new AtomicInteger();
        Evaluator<TicTacToe.Position> counting = position -> {
            calls.incrementAndGet();
            return game.evaluate(position);
        };
        TicTacToe.Position position = TicTacToe.of("X...O....");

        try (MoveSelector<TicTacToe.Position, Integer> selector = new MoveSelector<>(game, counting)) {
            SearchResult<Integer> result = selector.chooseBestMove(position, SearchConfig.fixedDepth(0));

            assertNull(result.move(), "No move is searched at depth zero");
            assertEquals(game.evaluate(position), result.score());
            assertEquals(1, calls.get(), "The root is evaluated exactly once");
            assertEquals(1L, result.visitedNodes());
            assertEquals(0, result.depthEvaluated());
        }
    }

    @Test
    void depthZeroScoresTerminalRootExactly() {
        TicTacToe.Position won = TicTacToe.of("XXXOO....");

        try (MoveSelector<TicTacToe.Position, Integer> selector = new MoveSelector<>(game, game)) {
            SearchResult<Integer> result = selector.chooseBestMove(won, SearchConfig.fixedDepth(0));

            assertFalse(result.hasMove());
            assertEquals(Scores.WIN, result.score());
        }
    }

    @Test
    void rejectsTerminalRootWhenSearching() {
        TicTacToe.Position won = TicTacToe.of("XXXOO....");

        try (MoveSelector<TicTacToe.Position, Integer> selector = new MoveSelector<>(game, game)) {
            assertThrows(IllegalStateException.class,
                    () -> selector.chooseBestMove(won, SearchConfig.fixedDepth(2)));
        }
    }

    @Test
    void takesTheImmediateWin() {
        TicTacToe.Position position = TicTacToe.of("OO..X.X..");

        try (MoveSelector<TicTacToe.Position, Integer> selector = new MoveSelector<>(game, game)) {
            SearchResult<Integer> result = selector.chooseBestMove(position, SearchConfig.fixedDepth(4));

            assertEquals(2, result.move(), "Completing the diagonal wins at once");
            assertEquals(Scores.WIN - 1, result.score());
        }
    }

    @Test
    void perfectPlayFromTheEmptyBoardIsADraw() {
        try (MoveSelector<TicTacToe.Position, Integer> selector = new MoveSelector<>(game, game)) {
            SearchResult<Integer> result = selector.chooseBestMove(TicTacToe.empty(), SearchConfig.fixedDepth(9));

            assertEquals(Scores.DRAW, result.score());
            assertTrue(result.hasMove());
        }
    }

    @Test
    void repeatedCallsReturnIdenticalResults() {
        TicTacToe.Position position = game.randomPosition(7L, 2);
        SearchConfig config = SearchConfig.iterative(6, Duration.ZERO);

        try (MoveSelector<TicTacToe.Position, Integer> selector = new MoveSelector<>(game, game)) {
            SearchResult<Integer> first = selector.chooseBestMove(position, config);
            SearchResult<Integer> second = selector.chooseBestMove(position, config);

            assertEquals(first.move(), second.move());
            assertEquals(first.score(), second.score());
            assertEquals(first.visitedNodes(), second.visitedNodes());
            assertEquals(first.depthEvaluated(), second.depthEvaluated());
        }
    }

    @Test
    void iterativeDeepeningAgreesWithFixedDepth() {
        try (MoveSelector<TicTacToe.Position, Integer> selector = new MoveSelector<>(game, game)) {
            for (long seed = 0; seed < 10; seed++) {
                TicTacToe.Position position = game.randomPosition(seed, 1);
                SearchResult<Integer> iterative = selector.chooseBestMove(position,
                        SearchConfig.iterative(5, Duration.ZERO));
                SearchResult<Integer> fixed = selector.chooseBestMove(position, SearchConfig.fixedDepth(5));

                assertEquals(fixed.score(), iterative.score(), "Scores differ for " + position);
                assertEquals(5, iterative.depthEvaluated());
                assertEquals(5, iterative.telemetry().iterations().size(), "One telemetry entry per depth");
                assertFalse(iterative.stoppedEarly());
            }
        }
    }

    @Test
    void nodeBudgetStopsBetweenDepths() {
        SearchConfig config = SearchConfig.iterative(8, Duration.ZERO).withNodeBudget(1L);

        try (MoveSelector<TicTacToe.Position, Integer> selector = new MoveSelector<>(game, game)) {
            SearchResult<Integer> result = selector.chooseBestMove(TicTacToe.empty(), config);

            assertTrue(result.stoppedEarly(), "The budget should end deepening");
            assertEquals(1, result.depthEvaluated(), "The first depth always completes");
            assertTrue(result.hasMove(), "A completed depth always yields a move");
        }
    }

    @Test
    void timeBudgetStillReturnsACompletedDepth() {
        SearchConfig config = SearchConfig.iterative(9, Duration.ofNanos(1));

        try (MoveSelector<TicTacToe.Position, Integer> selector = new MoveSelector<>(game, game)) {
            SearchResult<Integer> result = selector.chooseBestMove(TicTacToe.empty(), config);

            assertTrue(result.hasMove());
            assertTrue(result.stoppedEarly());
            assertTrue(result.depthEvaluated() >= 1 && result.depthEvaluated() < 9);
        }
    }

    @Test
    void provenWinEndsDeepening() {
        TicTacToe.Position position = TicTacToe.of("OO..X.X..");

        try (MoveSelector<TicTacToe.Position, Integer> selector = new MoveSelector<>(game, game)) {
            SearchResult<Integer> result = selector.chooseBestMove(position, SearchConfig.iterative(6, Duration.ZERO));

            assertEquals(1, result.depthEvaluated(), "A win found at depth one cannot be improved");
            assertEquals(Scores.WIN - 1, result.score());
            assertFalse(result.stoppedEarly());
        }
    }

    @Test
    void randomTieBreakIsReproducible() {
        SearchConfig config = SearchConfig.fixedDepth(2).withTieBreak(TieBreak.RANDOM, 99L);

        try (MoveSelector<TicTacToe.Position, Integer> selector = new MoveSelector<>(game, game)) {
            Integer first = selector.chooseBestMove(TicTacToe.empty(), config).move();
            Integer second = selector.chooseBestMove(TicTacToe.empty(), config).move();

            assertEquals(first, second);
        }
    }

    @Test
    void parallelModeMatchesSequentialMode() {
        SearchConfig sequential = SearchConfig.fixedDepth(5);
        SearchConfig parallel = sequential.withMode(SearchConfig.SearchMode.PAR);

        try (MoveSelector<TicTacToe.Position, Integer> selector = new MoveSelector<>(game, game,
                MoveOrderer.identity(), 4)) {
            for (long seed = 0; seed < 10; seed++) {
                TicTacToe.Position position = game.randomPosition(seed, 2);
                SearchResult<Integer> expected = selector.chooseBestMove(position, sequential);
                SearchResult<Integer> actual = selector.chooseBestMove(position, parallel);

                assertEquals(expected.score(), actual.score(), "Scores differ for " + position);
                assertEquals(expected.move(), actual.move(), "Moves differ for " + position);
            }
        }
    }

    @Test
    void enormousTimeLimitMeansNoDeadline() {
        try (MoveSelector<TicTacToe.Position, Integer> selector = new MoveSelector<>(game, game)) {
            SearchResult<Integer> result = selector.chooseBestMove(TicTacToe.of("X...O...."),
                    SearchConfig.iterative(3, Duration.ofSeconds(Long.MAX_VALUE)));

            assertEquals(3, result.depthEvaluated());
            assertFalse(result.stoppedEarly());
        }
    }
}
