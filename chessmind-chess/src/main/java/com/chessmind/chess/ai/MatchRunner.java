package com.chessmind.chess.ai;

import com.chessmind.chess.ChessMove;
import com.chessmind.chess.ChessPosition;
import com.chessmind.chess.ChessRules;
import com.chessmind.chess.Notation;
import com.chessmind.chess.PieceColor;
import com.chessmind.chess.eval.ChessEvaluator;
import com.chessmind.core.Outcome;
import com.chessmind.core.ai.MoveSelector;
import com.chessmind.core.ai.SearchConfig;
import com.chessmind.core.ai.SearchResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Plays engine-versus-engine games, each side searching with its own configuration, and keeps a
 * running tally of the results.
 */
public final class MatchRunner implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(MatchRunner.class.getName());

    private final ChessRules rules = new ChessRules();
    private final MoveSelector<ChessPosition, ChessMove> selector;
    private final SearchConfig whiteConfig;
    private final SearchConfig blackConfig;
    private final int maxPlies;

    private int gamesPlayed;
    private int whiteWins;
    private int blackWins;
    private int draws;
    private int unfinished;

    /**
     * @param maxPlies half-moves after which an unfinished game is abandoned, zero for no limit
     */
    public MatchRunner(SearchConfig whiteConfig, SearchConfig blackConfig, int maxPlies) {
        Objects.requireNonNull(whiteConfig, "whiteConfig");
        Objects.requireNonNull(blackConfig, "blackConfig");
        if (whiteConfig.maxDepth() < 1 || blackConfig.maxDepth() < 1) {
            throw new IllegalArgumentException("Both sides must search at least one ply");
        }
        if (maxPlies < 0) {
            throw new IllegalArgumentException("maxPlies must not be negative");
        }
        this.whiteConfig = whiteConfig;
        this.blackConfig = blackConfig;
        this.maxPlies = maxPlies;
        this.selector = new MoveSelector<>(rules, new ChessEvaluator(), new ChessMoveOrderer());
    }

    public MatchSummary playGames(int gameCount, ChessPosition start) {
        if (gameCount < 1) {
            throw new IllegalArgumentException("Game count must be at least 1");
        }
        Objects.requireNonNull(start, "start");
        for (int i = 0; i < gameCount; i++) {
            playGame(start);
        }
        return summary();
    }

    public GameRecord playGame(ChessPosition start) {
        Objects.requireNonNull(start, "start");
        if (rules.isTerminal(start)) {
            throw new IllegalArgumentException("Cannot start a game from a finished position: " + start);
        }

        ChessPosition position = start;
        List<String> moves = new ArrayList<>();
        while (!rules.isTerminal(position) && (maxPlies == 0 || moves.size() < maxPlies)) {
            SearchConfig config = position.sideToMove() == PieceColor.WHITE ? whiteConfig : blackConfig;
            SearchResult<ChessMove> result = selector.chooseBestMove(position, config);
            moves.add(Notation.san(position, result.move()));
            position = position.apply(result.move());
        }

        Outcome outcome = rules.outcome(position);
        String description = outcome.isTerminal() ? ChessRules.describeResult(position) : "Game ended.";
        tally(outcome);

        GameRecord game = new GameRecord(moves, outcome, description, position);
        final int gameNumber = gamesPlayed;
        LOGGER.info(() -> String.format("Completed match game %d (plies=%d, result=%s, white=%d, black=%d, draws=%d)",
                gameNumber, game.moves().size(), description, whiteWins, blackWins, draws));
        return game;
    }

    public MatchSummary summary() {
        return new MatchSummary(gamesPlayed, whiteWins, blackWins, draws, unfinished);
    }

    private void tally(Outcome outcome) {
        gamesPlayed++;
        switch (outcome) {
            case MAXIMIZER_WINS:
                whiteWins++;
                break;
            case MINIMIZER_WINS:
                blackWins++;
                break;
            case DRAW:
                draws++;
                break;
            default:
                unfinished++;
                break;
        }
    }

    @Override
    public void close() {
        selector.close();
    }

    /**
     * One finished or abandoned game.
     *
     * @param moves moves played, in SAN
     * @param outcome final classification, {@link Outcome#ONGOING} if the ply limit stopped the game
     * @param description result line as printed by the console
     * @param finalPosition position after the last move
     */
    public record GameRecord(List<String> moves, Outcome outcome, String description, ChessPosition finalPosition) {

        public GameRecord {
            moves = Collections.unmodifiableList(new ArrayList<>(moves));
        }
    }

    public record MatchSummary(int games, int whiteWins, int blackWins, int draws, int unfinished) {
    }
}
