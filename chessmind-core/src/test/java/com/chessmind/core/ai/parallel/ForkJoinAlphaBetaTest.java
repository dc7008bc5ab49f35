package com.chessmind.core.ai.parallel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chessmind.core.ai.AlphaBetaSearcher;
import com.chessmind.core.ai.MoveOrderer;
import com.chessmind.core.ai.SearchConstraints;
import com.chessmind.core.ai.SearchResult;
import com.chessmind.core.ai.TieBreak;
import com.chessmind.core.fixtures.TicTacToe;
import java.util.concurrent.ForkJoinPool;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ForkJoinAlphaBetaTest {

    private final TicTacToe game = new TicTacToe();

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5})
    void matchesSequentialSearch(int depth) {
        AlphaBetaSearcher<TicTacToe.Position, Integer> sequential = new AlphaBetaSearcher<>(game, game);

        try (ForkJoinAlphaBeta<TicTacToe.Position, Integer> parallel =
                new ForkJoinAlphaBeta<>(game, game, MoveOrderer.identity(), 4)) {
            for (long seed = 0; seed < 30; seed++) {
                TicTacToe.Position position = game.randomPosition(seed, (int) (seed % 5));
                if (game.isTerminal(position)) {
                    continue;
                }
                SearchConstraints constraints = SearchConstraints.ofDepth(depth);
                SearchResult<Integer> expected = sequential.search(position, constraints);
                SearchResult<Integer> actual = parallel.search(position, constraints);

                assertEquals(expected.score(), actual.score(), "Scores differ for " + position);
                assertEquals(expected.move(), actual.move(), "Moves differ for " + position);
            }
        }
    }

    @Test
    void randomTieBreakMatchesSequentialForTheSameSeed() {
        AlphaBetaSearcher<TicTacToe.Position, Integer> sequential = new AlphaBetaSearcher<>(game, game);

        try (ForkJoinAlphaBeta<TicTacToe.Position, Integer> parallel =
                new ForkJoinAlphaBeta<>(game, game, MoveOrderer.identity(), 4)) {
            for (long seed = 0; seed < 20; seed++) {
                SearchConstraints constraints = new SearchConstraints(3, true, TieBreak.RANDOM, seed);
                TicTacToe.Position position = game.randomPosition(seed, 1);

                assertEquals(sequential.search(position, constraints).move(),
                        parallel.search(position, constraints).move(),
                        "Tied moves must be collected identically for " + position);
            }
        }
    }

    @Test
    void unprunedParallelSearchMatchesSequential() {
        AlphaBetaSearcher<TicTacToe.Position, Integer> sequential = new AlphaBetaSearcher<>(game, game);
        SearchConstraints constraints = SearchConstraints.ofDepth(4).withPruning(false);

        try (ForkJoinAlphaBeta<TicTacToe.Position, Integer> parallel =
                new ForkJoinAlphaBeta<>(game, game, MoveOrderer.identity(), 2)) {
            SearchResult<Integer> expected = sequential.search(TicTacToe.empty(), constraints);
            SearchResult<Integer> actual = parallel.search(TicTacToe.empty(), constraints);

            assertEquals(expected.score(), actual.score());
            assertEquals(expected.move(), actual.move());
            assertEquals(expected.visitedNodes(), actual.visitedNodes(), "Without pruning both visit the full tree");
        }
    }

    @Test
    void reportsWorkerTelemetry() {
        try (ForkJoinAlphaBeta<TicTacToe.Position, Integer> parallel =
                new ForkJoinAlphaBeta<>(game, game, MoveOrderer.identity(), 2)) {
            SearchResult<Integer> result = parallel.search(TicTacToe.empty(), SearchConstraints.ofDepth(3));

            assertTrue(result.telemetry().maxActiveTasks() >= 1, "At least the root task runs");
            assertTrue(result.visitedNodes() > 9, "Every root child is visited");
        }
    }

    @Test
    void sharedPoolIsLeftRunning() {
        ForkJoinPool pool = new ForkJoinPool(2);
        try {
            ForkJoinAlphaBeta<TicTacToe.Position, Integer> parallel =
                    new ForkJoinAlphaBeta<>(game, game, MoveOrderer.identity(), pool);
            parallel.search(TicTacToe.empty(), SearchConstraints.ofDepth(2));
            parallel.close();

            assertFalse(pool.isShutdown(), "A pool supplied by the caller belongs to the caller");
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void rejectsInvalidParallelism() {
        assertThrows(IllegalArgumentException.class,
                () -> new ForkJoinAlphaBeta<>(game, game, MoveOrderer.identity(), 0));
    }
}
