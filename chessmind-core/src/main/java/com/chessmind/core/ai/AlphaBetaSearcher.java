package com.chessmind.core.ai;

import com.chessmind.core.Evaluator;
import com.chessmind.core.GameRules;
import com.chessmind.core.Scores;
import com.chessmind.core.Side;
import com.chessmind.core.ai.state.SearchCounters;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Sequential fixed-depth minimax searcher with alpha-beta pruning.
 *
 * <p>Root moves are searched in the order produced by the {@link MoveOrderer}. Under
 * {@link TieBreak#RANDOM} each root child is searched with a window one unit wider than the best
 * score so far, which keeps equal scores exact and lets every tied move be collected.
 */
public final class AlphaBetaSearcher<P, M> implements Searcher<P, M> {

    private static final Logger LOGGER = Logger.getLogger(AlphaBetaSearcher.class.getName());

    private final GameRules<P, M> rules;
    private final Evaluator<P> evaluator;
    private final MoveOrderer<P, M> orderer;

    public AlphaBetaSearcher(GameRules<P, M> rules, Evaluator<P> evaluator) {
        this(rules, evaluator, MoveOrderer.identity());
    }

    public AlphaBetaSearcher(GameRules<P, M> rules, Evaluator<P> evaluator, MoveOrderer<P, M> orderer) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.orderer = Objects.requireNonNull(orderer, "orderer");
    }

    @Override
    public SearchResult<M> search(P root, SearchConstraints constraints, M preferredMove) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(constraints, "constraints");

        if (rules.isTerminal(root)) {
            throw new IllegalStateException("Cannot search moves in a terminal position");
        }

        long start = System.nanoTime();
        SearchCounters counters = new SearchCounters();
        MinimaxKernel<P, M> kernel = new MinimaxKernel<>(rules, evaluator, orderer, constraints.pruning(), counters);

        counters.recordNode();
        List<M> moves = kernel.orderedMoves(root, preferredMove);
        if (moves.isEmpty()) {
            throw new IllegalStateException("No legal moves available");
        }

        Side rootSide = rules.sideToMove(root);
        int slack = constraints.tieBreak() == TieBreak.RANDOM ? 1 : 0;
        RootSelection<M> selection = new RootSelection<>(rootSide, constraints.tieBreak());

        for (M move : moves) {
            int alpha = -Scores.INFINITY;
            int beta = Scores.INFINITY;
            if (constraints.pruning() && selection.hasBest()) {
                if (rootSide == Side.MAXIMIZER) {
                    alpha = selection.bestScore() - slack;
                } else {
                    beta = selection.bestScore() + slack;
                }
            }
            int score = kernel.minimax(rules.apply(root, move), constraints.depth() - 1, alpha, beta, 1);
            selection.offer(move, score);
        }

        M bestMove = selection.choose(constraints.seed());
        int bestScore = selection.bestScore();
        long elapsed = System.nanoTime() - start;

        LOGGER.fine(() -> String.format("Alpha-beta depth %d: %d nodes, %d cutoffs, score %d", constraints.depth(),
                counters.visitedNodes(), counters.cutoffs(), bestScore));

        SearchTelemetry.Iteration iteration = new SearchTelemetry.Iteration(constraints.depth(), bestScore,
                counters.visitedNodes(), counters.cutoffs(), counters.evaluations(), 0L, elapsed);
        return new SearchResult<>(bestMove, bestScore, constraints.depth(), counters.visitedNodes(),
                counters.cutoffs(), false, SearchTelemetry.single(iteration));
    }
}
