package com.example.chess.service;

import com.example.chess.game.ChessGame.MoveOutcome;
import com.example.chess.game.ChessJudge.GameResult;
import com.example.chess.game.ChessRules.Side;

/**
 * What happened to one move request, captured while the game lock was held.
 * {@code outcome} is null when the request arrived after the game had already ended.
 */
public final class MoveReport {
    public final MoveOutcome outcome;
    public final String move;
    public final Side turn;
    public final GameResult result;
    public final int foulCount;

    MoveReport(MoveOutcome outcome, String move, Side turn, GameResult result, int foulCount) {
        this.outcome = outcome;
        this.move = move;
        this.turn = turn;
        this.result = result;
        this.foulCount = foulCount;
    }

    public boolean isGameOver() {
        return result != GameResult.IN_PROGRESS;
    }

    /** The request was refused because the game had already finished */
    public boolean isLate() {
        return outcome == null;
    }
}
