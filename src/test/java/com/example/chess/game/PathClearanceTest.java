package com.example.chess.game;

import static org.junit.jupiter.api.Assertions.*;

import com.example.chess.game.ChessRules.*;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * {@link Board#isPathClear} over straight and diagonal corridors of every length.
 */
class PathClearanceTest {

    private static final Piece BLOCKER = new Piece(PieceType.PAWN, Side.BLACK);

    /** from, direction; corridors run to the board edge so lengths 1..7 (0..6 intermediates) fit */
    static Stream<Arguments> corridors() {
        List<Arguments> out = new ArrayList<>();
        int[][] dirs = {{0, 1}, {0, -1}, {1, 0}, {-1, 0}, {1, 1}, {-1, -1}, {1, -1}, {-1, 1}};
        for (int[] d : dirs) {
            int r0 = d[0] >= 0 ? 0 : 7;
            int c0 = d[1] >= 0 ? 0 : 7;
            for (int len = 1; len <= 7; len++) {
                out.add(Arguments.of(new Pos(r0, c0), new Pos(r0 + d[0] * len, c0 + d[1] * len)));
            }
        }
        return out.stream();
    }

    @ParameterizedTest
    @MethodSource("corridors")
    void emptyCorridorIsClear(Pos from, Pos to) {
        assertTrue(new Board().isPathClear(from, to));
    }

    @ParameterizedTest
    @MethodSource("corridors")
    void anySingleIntermediateBlocks(Pos from, Pos to) {
        int sr = Integer.signum(to.r - from.r), sc = Integer.signum(to.c - from.c);
        for (int r = from.r + sr, c = from.c + sc; r != to.r || c != to.c; r += sr, c += sc) {
            Board b = new Board();
            b.set(r, c, BLOCKER);
            assertFalse(b.isPathClear(from, to), "blocker at " + new Pos(r, c));
        }
    }

    @ParameterizedTest
    @MethodSource("corridors")
    void endpointsAreIgnored(Pos from, Pos to) {
        Board b = new Board();
        b.set(from.r, from.c, BLOCKER);
        b.set(to.r, to.c, BLOCKER);
        assertTrue(b.isPathClear(from, to));
    }

    @Test
    void blockerOffTheLineDoesNotMatter() {
        Board b = new Board();
        b.set(3, 4, BLOCKER);
        assertTrue(b.isPathClear(new Pos(0, 0), new Pos(7, 7)));
        assertTrue(b.isPathClear(new Pos(4, 0), new Pos(4, 7)));
    }
}
