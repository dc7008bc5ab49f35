package com.chessmind.core.ai;

import com.chessmind.core.Evaluator;
import com.chessmind.core.GameRules;
import com.chessmind.core.Outcome;
import com.chessmind.core.Scores;
import com.chessmind.core.ai.parallel.ForkJoinAlphaBeta;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Entry point of the engine: picks the move to play in a position under a {@link SearchConfig}.
 *
 * <p>Budgets are only checked between iterative-deepening depths, so every returned move comes from
 * a fully searched depth. Apart from the lazily created parallel searcher the selector keeps no
 * state between calls.
 */
public final class MoveSelector<P, M> implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(MoveSelector.class.getName());

    private final GameRules<P, M> rules;
    private final Evaluator<P> evaluator;
    private final MoveOrderer<P, M> orderer;
    private final int parallelism;
    private final AlphaBetaSearcher<P, M> sequentialSearcher;
    private ForkJoinAlphaBeta<P, M> parallelSearcher;

    public MoveSelector(GameRules<P, M> rules, Evaluator<P> evaluator) {
        this(rules, evaluator, MoveOrderer.identity());
    }

    public MoveSelector(GameRules<P, M> rules, Evaluator<P> evaluator, MoveOrderer<P, M> orderer) {
        this(rules, evaluator, orderer, Runtime.getRuntime().availableProcessors());
    }

    public MoveSelector(GameRules<P, M> rules, Evaluator<P> evaluator, MoveOrderer<P, M> orderer, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.rules = Objects.requireNonNull(rules, "rules");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.orderer = Objects.requireNonNull(orderer, "orderer");
        this.parallelism = parallelism;
        this.sequentialSearcher = new AlphaBetaSearcher<>(rules, evaluator, orderer);
    }

    /**
     * Returns the best move for the side to move in {@code position} together with its score.
     *
     * @throws IllegalStateException if {@code position} is terminal and {@code config} asks for a
     *                               search deeper than zero plies
     */
    public SearchResult<M> chooseBestMove(P position, SearchConfig config) {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(config, "config");

        if (config.maxDepth() == 0) {
            return evaluateRoot(position);
        }
        if (rules.isTerminal(position)) {
            throw new IllegalStateException("Cannot search moves in a terminal position");
        }

        Searcher<P, M> searcher = config.mode() == SearchConfig.SearchMode.PAR
                ? getParallelSearcher()
                : sequentialSearcher;

        SearchResult<M> result = config.iterativeDeepening()
                ? iterativeDeepening(searcher, position, config)
                : searcher.search(position, config.constraintsForDepth(config.maxDepth()));

        SearchTelemetry telemetry = result.telemetry();
        LOGGER.info(() -> String.format("Alpha-beta explored %d nodes, pruned %d branches, evaluated %d leaves in "
                + "%d ms (depth=%d, mode=%s, score=%d, move=%s)", telemetry.totalNodes(), telemetry.totalCutoffs(),
                telemetry.totalEvaluations(), TimeUnit.NANOSECONDS.toMillis(telemetry.totalElapsedNanos()),
                result.depthEvaluated(), config.mode(), result.score(), result.move()));
        return result;
    }

    private SearchResult<M> iterativeDeepening(Searcher<P, M> searcher, P position, SearchConfig config) {
        long start = System.nanoTime();
        long deadline = toDeadline(start, config.timeLimit());

        SearchTelemetry telemetry = SearchTelemetry.empty();
        SearchResult<M> lastComplete = null;
        long totalNodes = 0L;
        long totalCutoffs = 0L;
        boolean stoppedEarly = false;
        M preferred = null;

        for (int depth = 1; depth <= config.maxDepth(); depth++) {
            SearchResult<M> iteration = searcher.search(position, config.constraintsForDepth(depth), preferred);
            totalNodes += iteration.visitedNodes();
            totalCutoffs += iteration.cutoffs();
            SearchTelemetry.Iteration latest = iteration.telemetry().latest();
            if (latest != null) {
                telemetry = telemetry.append(latest);
            }
            lastComplete = iteration;
            preferred = iteration.move();

            if (Scores.isDecisive(iteration.score())) {
                break;
            }
            if (depth < config.maxDepth() && budgetSpent(config, deadline, totalNodes)) {
                stoppedEarly = true;
                break;
            }
        }

        if (lastComplete == null) {
            throw new IllegalStateException("Search did not complete any depth");
        }
        return new SearchResult<>(lastComplete.move(), lastComplete.score(), lastComplete.depthEvaluated(),
                totalNodes, totalCutoffs, stoppedEarly, telemetry);
    }

    private SearchResult<M> evaluateRoot(P position) {
        long start = System.nanoTime();
        Outcome outcome = rules.outcome(position);
        int score;
        long evaluations = 0L;
        if (outcome.isTerminal()) {
            score = Scores.terminal(outcome, 0);
        } else {
            score = Scores.clampHeuristic(evaluator.evaluate(position));
            evaluations = 1L;
        }
        SearchTelemetry.Iteration iteration = new SearchTelemetry.Iteration(0, score, 1L, 0L, evaluations, 0L,
                System.nanoTime() - start);
        return new SearchResult<>(null, score, 0, 1L, 0L, false, SearchTelemetry.single(iteration));
    }

    private boolean budgetSpent(SearchConfig config, long deadline, long visitedNodes) {
        if (config.nodeBudget() > 0L && visitedNodes >= config.nodeBudget()) {
            return true;
        }
        return deadline != Long.MAX_VALUE && System.nanoTime() >= deadline;
    }

    private long toDeadline(long start, Duration timeLimit) {
        if (timeLimit.isZero()) {
            return Long.MAX_VALUE;
        }
        try {
            return Math.addExact(start, timeLimit.toNanos());
        } catch (ArithmeticException ex) {
            return Long.MAX_VALUE;
        }
    }

    private synchronized ForkJoinAlphaBeta<P, M> getParallelSearcher() {
        if (parallelSearcher == null) {
            parallelSearcher = new ForkJoinAlphaBeta<>(rules, evaluator, orderer, parallelism);
        }
        return parallelSearcher;
    }

    @Override
    public synchronized void close() {
        if (parallelSearcher != null) {
            parallelSearcher.shutdown();
            parallelSearcher = null;
        }
    }
}
