package com.example.chess.console;

import com.example.chess.game.ChessGame.MoveOutcome;
import com.example.chess.service.GameService;
import com.example.chess.service.MoveReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Interactive two-player game on stdin/stdout, started with {@code chess.console.enabled=true}
 */
@Component
@ConditionalOnProperty(name = "chess.console.enabled", havingValue = "true")
public class ConsoleGame implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ConsoleGame.class);

    private final GameService games;

    @Value("${chess.console.show-board:true}")
    private boolean showBoard = true;

    public ConsoleGame(GameService games) {
        this.games = games;
    }

    @Override
    public void run(String... args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        play(in, System.out);
    }

    /** Runs until the game ends, "quit" is entered or input is exhausted */
    public void play(BufferedReader in, PrintStream out) throws IOException {
        out.println("========== Java Chess Game ==========");
        out.println("Enter moves in algebraic notation (e.g., e2 e4)");
        out.println("Enter 'quit' to exit");

        games.newGame();
        while (!games.isGameOver()) {
            if (showBoard) out.print(games.view().text());

            out.print("Enter move: ");
            out.flush();
            String line = in.readLine();
            if (line == null || line.trim().equals("quit")) {
                log.debug("Console input closed");
                break;
            }

            String[] parts = line.trim().toLowerCase(Locale.ROOT).split("\\s+");
            if (parts.length < 2) {
                out.println("Invalid input format. Use 'from to' (e.g., e2 e4).");
                continue;
            }

            MoveReport report;
            try {
                report = games.move(parts[0], parts[1]);
            } catch (IllegalArgumentException e) {
                out.println(e.getMessage());
                out.println("Move failed. Try again.");
                continue;
            }

            MoveOutcome outcome = report.outcome;
            if (outcome != null && !outcome.isApplied()) {
                out.println(outcome.message);
                out.println("Move failed. Try again.");
            }
        }

        if (games.isGameOver()) {
            out.print(games.view().text());
            out.println("Game over!");
        }
        out.println("Thanks for playing!");
    }
}
