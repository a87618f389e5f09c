// ChessJudge.java
package com.example.chess.game;

import com.example.chess.game.ChessRules.*;

public class ChessJudge {

    /**
     * Game result enum
     */
    public enum GameResult {
        WHITE_WIN("White wins"),
        BLACK_WIN("Black wins"),
        IN_PROGRESS("In progress");

        private final String description;

        GameResult(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    /**
     * True once either king is gone from the board. Rescans all squares on every call.
     */
    public static boolean isGameOver(Board board) {
        return !hasKing(board, Side.WHITE) || !hasKing(board, Side.BLACK);
    }

    /**
     * Check game state; the side whose king is missing has lost
     */
    public static GameResult checkGameState(Board board) {
        if (!hasKing(board, Side.WHITE)) {
            return GameResult.BLACK_WIN;
        }
        if (!hasKing(board, Side.BLACK)) {
            return GameResult.WHITE_WIN;
        }
        return GameResult.IN_PROGRESS;
    }

    /**
     * Winning side, null while the game is in progress
     */
    public static Side winner(GameResult result) {
        switch (result) {
            case WHITE_WIN:
                return Side.WHITE;
            case BLACK_WIN:
                return Side.BLACK;
            default:
                return null;
        }
    }

    /**
     * Get game result description
     */
    public static String getResultDescription(GameResult result) {
        switch (result) {
            case WHITE_WIN:
                return "Black king captured - White wins!";
            case BLACK_WIN:
                return "White king captured - Black wins!";
            default:
                return "Game in progress";
        }
    }

    private static boolean hasKing(Board board, Side side) {
        return board.findKing(side) != null;
    }
}
