package com.example.chess.game;

import com.example.chess.game.ChessRules.Pos;

import java.util.Locale;

/**
 * Algebraic square labels ("a1".."h8") to board positions and back.
 * Files a..h map to columns 0..7, ranks 8..1 map to rows 0..7.
 */
public final class SquareNotation {

    private SquareNotation() {
    }

    /** Parse a square label, null if it is not one of the 64 squares */
    public static Pos parse(String label) {
        if (label == null) return null;
        String s = label.trim().toLowerCase(Locale.ROOT);
        if (s.length() != 2) return null;
        int c = s.charAt(0) - 'a';
        int rank = s.charAt(1) - '0';
        if (c < 0 || c >= ChessRules.SIZE || rank < 1 || rank > ChessRules.SIZE) return null;
        return new Pos(ChessRules.SIZE - rank, c);
    }

    /** Square label of an on-board position */
    public static String format(Pos p) {
        if (p.r < 0 || p.r >= ChessRules.SIZE || p.c < 0 || p.c >= ChessRules.SIZE) {
            throw new IllegalArgumentException("Position off the board: " + p);
        }
        return "" + (char) ('a' + p.c) + (ChessRules.SIZE - p.r);
    }

    /** "e2e4" style move text */
    public static String formatMove(Pos from, Pos to) {
        return format(from) + format(to);
    }
}
