package com.example.chess.service;

import com.example.chess.game.ChessJudge.GameResult;
import com.example.chess.game.ChessRules.Cell;
import com.example.chess.game.ChessRules.Side;

import java.util.List;

/**
 * Read-only copy of the game for display
 */
public record BoardView(List<Cell> cells, Side turn, GameResult result, int foulCount, String text) {

    public boolean gameOver() {
        return result != GameResult.IN_PROGRESS;
    }
}
