package com.chessmind.chess.cli;

import com.chessmind.chess.ChessMove;
import com.chessmind.chess.ChessPosition;
import com.chessmind.chess.ChessRules;
import com.chessmind.chess.Fen;
import com.chessmind.chess.Notation;
import com.chessmind.chess.PieceColor;
import com.chessmind.chess.ai.ChessMoveOrderer;
import com.chessmind.chess.eval.ChessEvaluator;
import com.chessmind.core.ai.MoveSelector;
import com.chessmind.core.ai.SearchConfig;
import com.chessmind.core.ai.SearchResult;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Scanner;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Console front-end: play against the engine with either colour or watch two engines play.
 */
public final class ChessCLI {

    private static final Logger LOGGER = Logger.getLogger(ChessCLI.class.getName());

    static final int DEFAULT_ENGINE_DEPTH = 3;
    static final int ENGINE_GAME_MAX_PLIES = 400;
    private static final int MOVE_HINT_LIMIT = 10;

    private final Scanner in;
    private final PrintStream out;
    private final ChessPosition start;
    private final ChessRules rules = new ChessRules();
    private final MoveSelector<ChessPosition, ChessMove> selector;
    private Difficulty difficulty = Difficulty.MEDIUM;

    public ChessCLI(Scanner in, PrintStream out, ChessPosition start) {
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.start = Objects.requireNonNull(start, "start");
        this.selector = new MoveSelector<>(rules, new ChessEvaluator(), new ChessMoveOrderer());
    }

    public static void main(String[] args) {
        LoggingSetup.configure();
        ChessPosition start = ChessPosition.startingPosition();
        Difficulty difficulty = Difficulty.MEDIUM;
        try {
            for (String option : args) {
                if (option.startsWith("--fen=")) {
                    start = Fen.parse(option.substring("--fen=".length()));
                } else if (option.startsWith("--difficulty=")) {
                    difficulty = Difficulty.fromLevel(Integer.parseInt(option.substring("--difficulty=".length())));
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            System.err.println("Usage: ChessCLI [--fen=<fen>] [--difficulty=<1-6>]");
            return;
        }

        ChessCLI cli = new ChessCLI(new Scanner(System.in), System.out, start);
        cli.setDifficulty(difficulty);
        cli.run();
    }

    public Difficulty difficulty() {
        return difficulty;
    }

    public void setDifficulty(Difficulty difficulty) {
        this.difficulty = Objects.requireNonNull(difficulty, "difficulty");
    }

    /**
     * Shows the main menu until the user exits or input ends.
     */
    public void run() {
        out.println("=".repeat(50));
        out.println("CHESS ENGINE WITH MINIMAX AND ALPHA-BETA PRUNING");
        out.println("=".repeat(50));
        try {
            while (true) {
                out.println();
                out.println("Main Menu:");
                out.println("1. Play as White against the engine");
                out.println("2. Play as Black against the engine");
                out.println("3. Watch engine vs engine");
                out.printf("4. Set difficulty level (current: %d - %s)%n", difficulty.level(), difficulty.label());
                out.println("5. Exit");
                String choice = prompt("Enter your choice (1-5): ");
                if (choice == null || "5".equals(choice)) {
                    out.println();
                    out.println("Thank you for playing! Goodbye!");
                    return;
                }
                switch (choice) {
                    case "1":
                        playAgainstEngine(PieceColor.WHITE);
                        break;
                    case "2":
                        playAgainstEngine(PieceColor.BLACK);
                        break;
                    case "3":
                        watchEngineGame();
                        break;
                    case "4":
                        chooseDifficulty();
                        break;
                    default:
                        out.println("Invalid choice. Please try again.");
                        break;
                }
            }
        } finally {
            selector.close();
        }
    }

    void playAgainstEngine(PieceColor human) {
        out.println();
        out.println("You are playing as " + human.displayName());
        out.println("Enter moves in UCI format (e.g., 'e2e4') or SAN format (e.g., 'e4')");
        out.println("Type 'quit' to exit, 'board' to redraw the board, 'undo' to take back your last move, "
                + "'moves' to list legal moves");

        ChessPosition position = start;
        while (!rules.isTerminal(position)) {
            printPosition(position);
            if (position.sideToMove() != human) {
                position = playEngineMove(position, difficulty.searchConfig(), "Engine");
                continue;
            }

            String input = prompt("Your move: ");
            if (input == null || "quit".equalsIgnoreCase(input)) {
                out.println("Game terminated by user");
                return;
            }
            if ("board".equalsIgnoreCase(input)) {
                continue;
            }
            if ("moves".equalsIgnoreCase(input)) {
                out.println("Legal moves: " + String.join(", ", sanMoves(position)));
                continue;
            }
            if ("undo".equalsIgnoreCase(input)) {
                ChessPosition beforeReply = position.previous();
                ChessPosition beforeOwnMove = beforeReply == null ? null : beforeReply.previous();
                if (beforeOwnMove == null) {
                    out.println("Nothing to undo.");
                } else {
                    position = beforeOwnMove;
                }
                continue;
            }
            try {
                position = position.apply(Notation.parse(position, input));
            } catch (IllegalArgumentException ex) {
                out.println(ex.getMessage());
                List<String> legal = sanMoves(position);
                String hint = String.join(", ", legal.subList(0, Math.min(MOVE_HINT_LIMIT, legal.size())));
                out.println("Legal moves: " + hint + (legal.size() > MOVE_HINT_LIMIT ? " ..." : ""));
            }
        }
        printResult(position);
    }

    void watchEngineGame() {
        out.println();
        out.println("Engine vs engine setup");
        int whiteDepth;
        int blackDepth;
        try {
            String white = prompt("Enter depth for White (1-10): ");
            String black = prompt("Enter depth for Black (1-10): ");
            if (white == null || black == null) {
                return;
            }
            whiteDepth = SearchConfig.clampDepth(Integer.parseInt(white));
            blackDepth = SearchConfig.clampDepth(Integer.parseInt(black));
        } catch (NumberFormatException ex) {
            out.printf("Invalid input. Using default depths (%d vs %d)%n", DEFAULT_ENGINE_DEPTH, DEFAULT_ENGINE_DEPTH);
            whiteDepth = DEFAULT_ENGINE_DEPTH;
            blackDepth = DEFAULT_ENGINE_DEPTH;
        }

        out.printf("Engine vs engine game: depth %d (White) vs depth %d (Black)%n", whiteDepth, blackDepth);
        SearchConfig whiteConfig = SearchConfig.fixedDepth(whiteDepth);
        SearchConfig blackConfig = SearchConfig.fixedDepth(blackDepth);
        ChessPosition position = start;
        int plies = 0;
        while (!rules.isTerminal(position) && plies < ENGINE_GAME_MAX_PLIES) {
            printPosition(position);
            boolean white = position.sideToMove() == PieceColor.WHITE;
            position = playEngineMove(position, white ? whiteConfig : blackConfig, white ? "White" : "Black");
            plies++;
        }
        printResult(position);
    }

    void chooseDifficulty() {
        out.println();
        out.printf("Current difficulty: %d - %s%n", difficulty.level(), difficulty.label());
        out.println("Difficulty levels:");
        for (Difficulty level : Difficulty.values()) {
            out.printf("%d - %s (depth %d)%n", level.level(), level.label(), level.depth());
        }
        String input = prompt("Enter difficulty level (1-6): ");
        if (input == null) {
            return;
        }
        try {
            difficulty = Difficulty.fromLevel(Integer.parseInt(input));
            out.printf("Difficulty set to level %d - %s%n", difficulty.level(), difficulty.label());
        } catch (NumberFormatException ex) {
            out.println("Invalid input. Keeping current difficulty.");
        } catch (IllegalArgumentException ex) {
            out.println("Invalid level. Keeping current difficulty.");
        }
    }

    private ChessPosition playEngineMove(ChessPosition position, SearchConfig config, String name) {
        out.println(name + " is thinking...");
        long startNanos = System.nanoTime();
        SearchResult<ChessMove> result = selector.chooseBestMove(position, config);
        double seconds = (System.nanoTime() - startNanos) / (double) TimeUnit.SECONDS.toNanos(1);
        out.printf("%s plays: %s%n", name, Notation.san(position, result.move()));
        out.printf("Time taken: %.2f seconds (%d nodes, %d cutoffs)%n", seconds, result.visitedNodes(),
                result.cutoffs());
        return position.apply(result.move());
    }

    private void printPosition(ChessPosition position) {
        out.println();
        out.print(position.board().render());
        if (position.isInCheck()) {
            out.println("CHECK!");
        }
        out.println(position.sideToMove().displayName() + " to move");
    }

    private void printResult(ChessPosition position) {
        printPosition(position);
        out.println();
        out.println("Game Over!");
        out.println(ChessRules.describeResult(position));
    }

    private List<String> sanMoves(ChessPosition position) {
        List<String> moves = new ArrayList<>();
        for (ChessMove move : position.legalMoves()) {
            moves.add(Notation.san(position, move));
        }
        return moves;
    }

    private String prompt(String message) {
        out.print(message);
        out.flush();
        if (!in.hasNextLine()) {
            return null;
        }
        return in.nextLine().trim();
    }
}
