package com.chessmind.core.ai.parallel;

import com.chessmind.core.Evaluator;
import com.chessmind.core.GameRules;
import com.chessmind.core.Scores;
import com.chessmind.core.Side;
import com.chessmind.core.ai.MinimaxKernel;
import com.chessmind.core.ai.MoveOrderer;
import com.chessmind.core.ai.RootSelection;
import com.chessmind.core.ai.SearchConstraints;
import com.chessmind.core.ai.SearchResult;
import com.chessmind.core.ai.SearchTelemetry;
import com.chessmind.core.ai.Searcher;
import com.chessmind.core.ai.state.SearchCounters;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;
import java.util.logging.Logger;

/**
 * Parallel alpha-beta searcher that splits the root across a {@link ForkJoinPool}.
 *
 * <p>The first root move is searched alone with a full window to seed a {@link SharedBound}; the
 * remaining root moves run as forked tasks. Each task re-reads the bound before every move it tries
 * below the root child, and folds its own score back in only once that score is known to be exact.
 * Scores and, for {@link com.chessmind.core.ai.TieBreak#FIRST}, the chosen move match the sequential
 * {@link com.chessmind.core.ai.AlphaBetaSearcher}.
 */
public final class ForkJoinAlphaBeta<P, M> implements Searcher<P, M>, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ForkJoinAlphaBeta.class.getName());

    private final GameRules<P, M> rules;
    private final Evaluator<P> evaluator;
    private final MoveOrderer<P, M> orderer;
    private final ForkJoinPool pool;
    private final boolean ownsPool;

    public ForkJoinAlphaBeta(GameRules<P, M> rules, Evaluator<P> evaluator, MoveOrderer<P, M> orderer) {
        this(rules, evaluator, orderer, Runtime.getRuntime().availableProcessors());
    }

    public ForkJoinAlphaBeta(GameRules<P, M> rules, Evaluator<P> evaluator, MoveOrderer<P, M> orderer,
            int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.rules = Objects.requireNonNull(rules, "rules");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.orderer = Objects.requireNonNull(orderer, "orderer");
        this.pool = new ForkJoinPool(parallelism);
        this.ownsPool = true;
    }

    public ForkJoinAlphaBeta(GameRules<P, M> rules, Evaluator<P> evaluator, MoveOrderer<P, M> orderer,
            ForkJoinPool pool) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.orderer = Objects.requireNonNull(orderer, "orderer");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.ownsPool = false;
    }

    /**
     * Shuts down the internally managed {@link ForkJoinPool} if this instance created it.
     */
    public void shutdown() {
        if (ownsPool) {
            pool.shutdown();
        }
    }

    @Override
    public void close() {
        shutdown();
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
        SharedBound bound = new SharedBound(rootSide);
        List<RootScore<M>> scores = pool.invoke(new RootTask(root, moves, constraints.depth(), kernel, bound,
                counters));

        RootSelection<M> selection = new RootSelection<>(rootSide, constraints.tieBreak());
        for (RootScore<M> score : scores) {
            if (score.exact) {
                selection.offer(score.move, score.score);
            }
        }

        M bestMove = selection.choose(constraints.seed());
        int bestScore = selection.bestScore();
        long elapsed = System.nanoTime() - start;

        LOGGER.fine(() -> String.format("Parallel alpha-beta depth %d: %d nodes, %d cutoffs, %d max tasks, score %d",
                constraints.depth(), counters.visitedNodes(), counters.cutoffs(), counters.maxActiveTasks(),
                bestScore));

        SearchTelemetry.Iteration iteration = new SearchTelemetry.Iteration(constraints.depth(), bestScore,
                counters.visitedNodes(), counters.cutoffs(), counters.evaluations(), counters.maxActiveTasks(),
                elapsed);
        return new SearchResult<>(bestMove, bestScore, constraints.depth(), counters.visitedNodes(),
                counters.cutoffs(), false, SearchTelemetry.single(iteration));
    }

    private final class RootTask extends RecursiveTask<List<RootScore<M>>> {

        private final P root;
        private final List<M> moves;
        private final int depth;
        private final MinimaxKernel<P, M> kernel;
        private final SharedBound bound;
        private final SearchCounters counters;

        private RootTask(P root, List<M> moves, int depth, MinimaxKernel<P, M> kernel, SharedBound bound,
                SearchCounters counters) {
            this.root = root;
            this.moves = moves;
            this.depth = depth;
            this.kernel = kernel;
            this.bound = bound;
            this.counters = counters;
        }

        @Override
        protected List<RootScore<M>> compute() {
            counters.taskStarted();
            try {
                List<RootScore<M>> scores = new ArrayList<>(moves.size());

                M first = moves.get(0);
                int firstScore = kernel.minimax(rules.apply(root, first), depth - 1, -Scores.INFINITY,
                        Scores.INFINITY, 1);
                bound.tighten(firstScore);
                scores.add(new RootScore<>(first, firstScore, true));

                List<ChildTask> siblings = new ArrayList<>(moves.size() - 1);
                for (int i = 1; i < moves.size(); i++) {
                    ChildTask task = new ChildTask(root, moves.get(i), depth, kernel, bound, counters);
                    siblings.add(task);
                    task.fork();
                }
                for (ChildTask task : siblings) {
                    scores.add(task.join());
                }
                return scores;
            } finally {
                counters.taskFinished();
            }
        }
    }

    private final class ChildTask extends RecursiveTask<RootScore<M>> {

        private final P root;
        private final M move;
        private final int depth;
        private final MinimaxKernel<P, M> kernel;
        private final SharedBound bound;
        private final SearchCounters counters;

        private ChildTask(P root, M move, int depth, MinimaxKernel<P, M> kernel, SharedBound bound,
                SearchCounters counters) {
            this.root = root;
            this.move = move;
            this.depth = depth;
            this.kernel = kernel;
            this.bound = bound;
            this.counters = counters;
        }

        @Override
        protected RootScore<M> compute() {
            counters.taskStarted();
            try {
                SharedBound.TaskWindow window = bound.newWindow();
                int score = kernel.minimax(rules.apply(root, move), depth - 1, -Scores.INFINITY, Scores.INFINITY,
                        1, window);
                boolean exact = !kernel.isPruning() || window.isExact(score);
                if (exact) {
                    bound.tighten(score);
                }
                return new RootScore<>(move, score, exact);
            } finally {
                counters.taskFinished();
            }
        }
    }

    private static final class RootScore<M> {
        private final M move;
        private final int score;
        private final boolean exact;

        private RootScore(M move, int score, boolean exact) {
            this.move = move;
            this.score = score;
            this.exact = exact;
        }
    }
}
