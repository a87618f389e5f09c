package com.example.chess.service;

import com.example.chess.game.BoardRenderer;
import com.example.chess.game.ChessGame;
import com.example.chess.game.ChessGame.MoveOutcome;
import com.example.chess.game.ChessJudge;
import com.example.chess.game.ChessJudge.GameResult;
import com.example.chess.game.ChessRules.Pos;
import com.example.chess.game.SquareNotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Holds the single active game. Every operation is synchronized so that one move attempt
 * runs to completion before the next is looked at.
 */
@Service
public class GameService {

    private static final Logger log = LoggerFactory.getLogger(GameService.class);

    private ChessGame game = new ChessGame();
    private int foulCount = 0;

    /** New game */
    public synchronized BoardView newGame() {
        game = new ChessGame();
        foulCount = 0;
        log.info("New game started, {} to move", game.sideToMove().displayName());
        return view();
    }

    /** Parse two square labels and attempt the move */
    public MoveReport move(String from, String to) {
        Pos f = SquareNotation.parse(from);
        Pos t = SquareNotation.parse(to);
        if (f == null || t == null) {
            throw new IllegalArgumentException("Invalid notation. Please use algebraic notation (e.g., e2 to e4).");
        }
        return move(f, t);
    }

    public synchronized MoveReport move(Pos from, Pos to) {
        GameResult before = ChessJudge.checkGameState(game.getBoard());
        if (before != GameResult.IN_PROGRESS) {
            return new MoveReport(null, null, game.sideToMove(), before, foulCount);
        }

        MoveOutcome outcome = game.attemptMove(from, to);
        String text = null;
        if (outcome.isApplied()) {
            text = SquareNotation.formatMove(from, to);
            log.debug("Applied {} ({})", text, outcome);
        } else {
            foulCount++;
            log.debug("Rejected {} -> {}: {}", from, to, outcome.rejection);
        }

        GameResult after = ChessJudge.checkGameState(game.getBoard());
        if (after != GameResult.IN_PROGRESS) {
            log.info("Game over after {}: {}", text, after.getDescription());
        }
        return new MoveReport(outcome, text, game.sideToMove(), after, foulCount);
    }

    public synchronized boolean isGameOver() {
        return game.isGameOver();
    }

    public synchronized BoardView view() {
        return new BoardView(game.getBoard().cells(), game.sideToMove(),
                ChessJudge.checkGameState(game.getBoard()), foulCount,
                BoardRenderer.render(game.getBoard(), game.sideToMove()));
    }
}
