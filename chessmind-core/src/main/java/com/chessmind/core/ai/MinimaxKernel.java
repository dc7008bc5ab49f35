package com.chessmind.core.ai;

import com.chessmind.core.Evaluator;
import com.chessmind.core.GameRules;
import com.chessmind.core.Outcome;
import com.chessmind.core.Scores;
import com.chessmind.core.Side;
import com.chessmind.core.ai.state.SearchCounters;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Recursive minimax with optional alpha-beta pruning, shared by the sequential and the parallel
 * searchers. Maximizing and minimizing nodes are handled by separate branches; all scores are from
 * the maximizer's perspective and returned fail-soft: a value at or below the incoming alpha is an
 * upper bound, a value at or above the incoming beta is a lower bound, anything in between is exact.
 *
 * @param <P> position type
 * @param <M> move type
 */
public final class MinimaxKernel<P, M> {

    private static final Logger LOGGER = Logger.getLogger(MinimaxKernel.class.getName());

    private final GameRules<P, M> rules;
    private final Evaluator<P> evaluator;
    private final MoveOrderer<P, M> orderer;
    private final boolean pruning;
    private final SearchCounters counters;

    public MinimaxKernel(GameRules<P, M> rules, Evaluator<P> evaluator, MoveOrderer<P, M> orderer, boolean pruning,
            SearchCounters counters) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.orderer = Objects.requireNonNull(orderer, "orderer");
        this.pruning = pruning;
        this.counters = Objects.requireNonNull(counters, "counters");
    }

    public boolean isPruning() {
        return pruning;
    }

    /**
     * Scores {@code position} searched {@code depth} plies deep inside the window
     * {@code (alpha, beta)}.
     *
     * @param ply distance from the root, used to prefer quicker wins
     */
    public int minimax(P position, int depth, int alpha, int beta, int ply) {
        return search(position, depth, alpha, beta, ply, null);
    }

    /**
     * Same as {@link #minimax(Object, int, int, int, int)} but narrows the window through
     * {@code window} before every child of {@code position} is searched.
     */
    public int minimax(P position, int depth, int alpha, int beta, int ply, Window window) {
        return search(position, depth, alpha, beta, ply, window);
    }

    /**
     * Exact score for terminal positions, clamped heuristic score otherwise.
     */
    public int leafScore(P position, int ply) {
        Outcome outcome = rules.outcome(position);
        if (outcome.isTerminal()) {
            return Scores.terminal(outcome, ply);
        }
        counters.recordEvaluation();
        return Scores.clampHeuristic(evaluator.evaluate(position));
    }

    /**
     * Legal moves in search order, with {@code preferred} moved to the front when it is legal.
     */
    public List<M> orderedMoves(P position, M preferred) {
        List<M> moves = orderer.order(position, rules.legalMoves(position));
        if (preferred == null || moves.isEmpty() || preferred.equals(moves.get(0))) {
            return moves;
        }
        int index = moves.indexOf(preferred);
        if (index < 0) {
            return moves;
        }
        List<M> reordered = new ArrayList<>(moves.size());
        reordered.add(preferred);
        for (int i = 0; i < moves.size(); i++) {
            if (i != index) {
                reordered.add(moves.get(i));
            }
        }
        return reordered;
    }

    private int search(P position, int depth, int alpha, int beta, int ply, Window window) {
        counters.recordNode();

        Outcome outcome = rules.outcome(position);
        if (outcome.isTerminal()) {
            return Scores.terminal(outcome, ply);
        }
        if (depth <= 0) {
            counters.recordEvaluation();
            return Scores.clampHeuristic(evaluator.evaluate(position));
        }

        List<M> moves = orderedMoves(position, null);
        if (moves.isEmpty()) {
            Outcome stalled = rules.stalledOutcome(position);
            LOGGER.fine(() -> "Position without legal moves reported as ongoing, scoring it as " + stalled);
            return Scores.terminal(stalled.isTerminal() ? stalled : Outcome.DRAW, ply);
        }

        if (rules.sideToMove(position) == Side.MAXIMIZER) {
            int best = -Scores.INFINITY;
            for (M move : moves) {
                if (window != null && pruning) {
                    alpha = window.floor(alpha);
                    beta = window.ceiling(beta);
                    if (alpha >= beta) {
                        counters.recordCutoff();
                        break;
                    }
                }
                int score = search(rules.apply(position, move), depth - 1, alpha, beta, ply + 1, null);
                best = Math.max(best, score);
                if (pruning) {
                    alpha = Math.max(alpha, best);
                    if (alpha >= beta) {
                        counters.recordCutoff();
                        break;
                    }
                }
            }
            return best == -Scores.INFINITY ? alpha : best;
        }

        int best = Scores.INFINITY;
        for (M move : moves) {
            if (window != null && pruning) {
                alpha = window.floor(alpha);
                beta = window.ceiling(beta);
                if (beta <= alpha) {
                    counters.recordCutoff();
                    break;
                }
            }
            int score = search(rules.apply(position, move), depth - 1, alpha, beta, ply + 1, null);
            best = Math.min(best, score);
            if (pruning) {
                beta = Math.min(beta, best);
                if (beta <= alpha) {
                    counters.recordCutoff();
                    break;
                }
            }
        }
        return best == Scores.INFINITY ? beta : best;
    }

    /**
     * Source of externally tightened bounds, consulted before each child is searched.
     */
    public interface Window {

        int floor(int alpha);

        int ceiling(int beta);
    }
}
