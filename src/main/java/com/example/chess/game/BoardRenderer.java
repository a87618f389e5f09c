package com.example.chess.game;

import com.example.chess.game.ChessRules.*;

/**
 * Plain-text board: White pieces upper case, Black lower case, empty light squares as '.'
 */
public final class BoardRenderer {

    private static final String FILES = "   a b c d e f g h\n";
    private static final String BORDER = "  +-----------------+\n";

    private BoardRenderer() {
    }

    public static String render(Board board, Side toMove) {
        StringBuilder sb = new StringBuilder();
        sb.append('\n').append(FILES).append(BORDER);
        for (int r = 0; r < ChessRules.SIZE; r++) {
            int rank = ChessRules.SIZE - r;
            sb.append(rank).append(" |");
            for (int c = 0; c < ChessRules.SIZE; c++) {
                Piece p = board.at(r, c);
                if (p == null) sb.append((r + c) % 2 == 0 ? '.' : ' ');
                else sb.append(p.symbol());
                sb.append(' ');
            }
            sb.append("| ").append(rank).append('\n');
        }
        sb.append(BORDER).append(FILES).append('\n');
        sb.append(toMove.displayName()).append(" to move\n");
        return sb.toString();
    }
}
