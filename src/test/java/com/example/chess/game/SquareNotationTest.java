package com.example.chess.game;

import static org.junit.jupiter.api.Assertions.*;

import com.example.chess.game.ChessRules.Pos;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class SquareNotationTest {

    @Test
    void cornersAndHomeSquares() {
        assertEquals(new Pos(0, 0), SquareNotation.parse("a8"));
        assertEquals(new Pos(7, 7), SquareNotation.parse("h1"));
        assertEquals(new Pos(7, 0), SquareNotation.parse("a1"));
        assertEquals(new Pos(6, 4), SquareNotation.parse("e2"));
        assertEquals(new Pos(1, 3), SquareNotation.parse("d7"));
    }

    @Test
    void caseAndSurroundingBlanksAreIgnored() {
        assertEquals(new Pos(6, 4), SquareNotation.parse(" E2 "));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"i1", "a9", "a0", "e22", "2e", "e", "quit", "`1"})
    void unknownLabelsAreRejected(String label) {
        assertNull(SquareNotation.parse(label));
    }

    @Test
    void everySquareHasItsOwnLabel() {
        Set<String> seen = new HashSet<>();
        for (int r = 0; r < 8; r++)
            for (int c = 0; c < 8; c++) {
                Pos p = new Pos(r, c);
                String label = SquareNotation.format(p);
                assertTrue(seen.add(label), label);
                assertEquals(p, SquareNotation.parse(label));
            }
        assertEquals(64, seen.size());
    }

    @Test
    void formatRefusesOffBoardPositions() {
        assertThrows(IllegalArgumentException.class, () -> SquareNotation.format(new Pos(8, 0)));
    }

    @Test
    void moveText() {
        assertEquals("e2e4", SquareNotation.formatMove(new Pos(6, 4), new Pos(4, 4)));
    }
}
