package com.example.chess.service;

import static org.junit.jupiter.api.Assertions.*;

import com.example.chess.game.ChessGame.Rejection;
import com.example.chess.game.ChessJudge.GameResult;
import com.example.chess.game.ChessRules.Side;
import org.junit.jupiter.api.*;

class GameServiceTest {

    private GameService games;

    @BeforeEach
    void setUp() {
        games = new GameService();
    }

    @Test
    void appliedMoveReportsNotationAndNextTurn() {
        MoveReport report = games.move("e2", "e4");

        assertTrue(report.outcome.isApplied());
        assertEquals("e2e4", report.move);
        assertEquals(Side.BLACK, report.turn);
        assertEquals(0, report.foulCount);
        assertFalse(report.isGameOver());
    }

    @Test
    void rejectedMovesAreCountedAsFouls() {
        assertEquals(Rejection.ILLEGAL_GEOMETRY, games.move("e2", "e5").outcome.rejection);
        MoveReport second = games.move("e7", "e5");
        assertEquals(Rejection.WRONG_TURN, second.outcome.rejection);
        assertEquals(2, second.foulCount);
        assertEquals(Side.WHITE, second.turn);
        assertNull(second.move);
    }

    @Test
    void newGameResetsBoardAndFouls() {
        games.move("e2", "e4");
        games.move("e2", "e4");

        BoardView view = games.newGame();

        assertEquals(0, view.foulCount());
        assertEquals(Side.WHITE, view.turn());
        assertEquals(64, view.cells().size());
        assertFalse(view.gameOver());
        assertTrue(games.move("e2", "e4").outcome.isApplied());
    }

    @Test
    void unknownSquareIsAnArgumentError() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> games.move("e9", "e4"));
        assertTrue(e.getMessage().startsWith("Invalid notation"));
        assertEquals(0, games.view().foulCount());
    }

    @Test
    void movesAfterKingCaptureAreRefused() {
        playScholarsKingHunt();
        assertTrue(games.isGameOver());

        MoveReport late = games.move("e7", "e5");

        assertTrue(late.isLate());
        assertTrue(late.isGameOver());
        assertEquals(GameResult.WHITE_WIN, late.result);
        assertTrue(games.view().text().contains("8 |r n b q Q b n r | 8"));
    }

    private void playScholarsKingHunt() {
        String[][] moves = {{"e2", "e3"}, {"f7", "f6"}, {"d1", "h5"}, {"a7", "a6"}, {"h5", "e8"}};
        MoveReport last = null;
        for (String[] m : moves) {
            last = games.move(m[0], m[1]);
            assertTrue(last.outcome.isApplied(), m[0] + m[1]);
        }
        assertTrue(last.isGameOver());
        assertEquals(GameResult.WHITE_WIN, last.result);
    }
}
