package com.chessmind.chess.ai;

import com.chessmind.chess.ChessPosition;
import com.chessmind.chess.Fen;
import com.chessmind.chess.cli.LoggingSetup;
import com.chessmind.core.ai.SearchConfig;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point for running {@link MatchRunner} engine-versus-engine matches.
 */
public final class MatchRunnerMain {

    private static final Logger LOGGER = Logger.getLogger(MatchRunnerMain.class.getName());

    private MatchRunnerMain() {
    }

    public static void main(String[] args) {
        LoggingSetup.configure();
        if (args.length < 3 || args.length > 6) {
            printUsage();
            return;
        }
        try {
            MatchRunner.MatchSummary summary = run(args);
            System.out.printf("Games: %d, White wins: %d, Black wins: %d, Draws: %d, Unfinished: %d%n",
                    summary.games(), summary.whiteWins(), summary.blackWins(), summary.draws(),
                    summary.unfinished());
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
        }
    }

    static MatchRunner.MatchSummary run(String[] args) {
        int gameCount = Integer.parseInt(args[0]);
        int whiteDepth = Integer.parseInt(args[1]);
        int blackDepth = Integer.parseInt(args[2]);
        long timeMillis = 0L;
        int maxPlies = 0;
        String fen = null;

        for (int index = 3; index < args.length; index++) {
            String option = args[index];
            if (option.startsWith("--timeMillis=")) {
                timeMillis = Long.parseLong(option.substring("--timeMillis=".length()));
            } else if (option.startsWith("--maxPlies=")) {
                maxPlies = Integer.parseInt(option.substring("--maxPlies=".length()));
            } else if (option.startsWith("--fen=")) {
                if (fen != null) {
                    throw new IllegalArgumentException("FEN specified more than once");
                }
                fen = option.substring("--fen=".length());
            } else {
                throw new IllegalArgumentException("Unrecognised argument: " + option);
            }
        }
        if (timeMillis < 0L) {
            throw new IllegalArgumentException("timeMillis must be non-negative");
        }

        ChessPosition start = fen == null ? ChessPosition.startingPosition() : Fen.parse(fen);
        try (MatchRunner runner = new MatchRunner(configFor(whiteDepth, timeMillis), configFor(blackDepth, timeMillis),
                maxPlies)) {
            return runner.playGames(gameCount, start);
        }
    }

    private static SearchConfig configFor(int depth, long timeMillis) {
        if (timeMillis == 0L) {
            return SearchConfig.fixedDepth(depth);
        }
        return SearchConfig.iterative(depth, Duration.ofMillis(timeMillis));
    }

    private static void printUsage() {
        System.err.println(
                "Usage: MatchRunnerMain <games> <whiteDepth> <blackDepth> [--timeMillis=<value>] "
                        + "[--fen=<fen>] [--maxPlies=<value>]");
    }
}
