package com.example.chess.game;

import com.example.chess.game.ChessRules.*;

import java.util.Objects;

/**
 * Board plus side to move. Validates a move through ordered gates and applies it in place.
 * Not thread-safe; callers sharing a game must serialize access (see {@code GameService}).
 */
public class ChessGame {

    /**
     * Why a move attempt was refused, in gate order
     */
    public enum Rejection {
        OUT_OF_RANGE("Invalid coordinates."),
        NO_PIECE_AT_SOURCE("No piece at the starting square."),
        WRONG_TURN("It's not your turn."),
        FRIENDLY_FIRE_CAPTURE("Cannot capture your own piece."),
        ILLEGAL_GEOMETRY("Invalid move for that piece.");

        private final String description;

        Rejection(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    /**
     * Result of {@link #attemptMove}: either applied (with the moved and captured pieces) or rejected with a reason
     */
    public static final class MoveOutcome {
        public final Rejection rejection;
        public final String message;
        public final Piece moved;
        public final Piece captured;

        private MoveOutcome(Rejection rejection, String message, Piece moved, Piece captured) {
            this.rejection = rejection;
            this.message = message;
            this.moved = moved;
            this.captured = captured;
        }

        static MoveOutcome applied(Piece moved, Piece captured) {
            return new MoveOutcome(null, "", moved, captured);
        }

        static MoveOutcome rejected(Rejection reason, String message) {
            return new MoveOutcome(reason, message, null, null);
        }

        public boolean isApplied() {
            return rejection == null;
        }

        public boolean isCapture() {
            return captured != null;
        }

        @Override
        public String toString() {
            return isApplied() ? "applied " + moved + (captured != null ? " x " + captured : "") : rejection.name();
        }
    }

    private final Board board;
    private boolean whiteToMove;

    /** Standard initial position, White to move */
    public ChessGame() {
        this(Board.initial(), true);
    }

    public ChessGame(Board board, boolean whiteToMove) {
        this.board = Objects.requireNonNull(board);
        this.whiteToMove = whiteToMove;
    }

    public Board getBoard() {
        return board;
    }

    public boolean isWhiteToMove() {
        return whiteToMove;
    }

    public Side sideToMove() {
        return whiteToMove ? Side.WHITE : Side.BLACK;
    }

    /**
     * Validate and, if every gate passes, apply a move. A rejected attempt leaves the game untouched.
     */
    public MoveOutcome attemptMove(Pos from, Pos to) {
        // 1) Both squares on the board
        if (!board.in(from) || !board.in(to)) {
            return MoveOutcome.rejected(Rejection.OUT_OF_RANGE, Rejection.OUT_OF_RANGE.getDescription());
        }

        // 2) Something to move
        Piece piece = board.at(from.r, from.c);
        if (piece == null) {
            return MoveOutcome.rejected(Rejection.NO_PIECE_AT_SOURCE,
                    "No piece at position " + SquareNotation.format(from) + ".");
        }

        // 3) Side to move
        if (piece.side != sideToMove()) {
            return MoveOutcome.rejected(Rejection.WRONG_TURN, "It's " + sideToMove().displayName() + "'s turn.");
        }

        // 4) Own piece on the destination
        Piece target = board.at(to.r, to.c);
        if (target != null && target.side == piece.side) {
            return MoveOutcome.rejected(Rejection.FRIENDLY_FIRE_CAPTURE,
                    Rejection.FRIENDLY_FIRE_CAPTURE.getDescription());
        }

        // 5) Piece rule, including blocked paths
        if (!ChessRules.isValidMove(piece, from, to, board)) {
            return MoveOutcome.rejected(Rejection.ILLEGAL_GEOMETRY, "Invalid move for " + piece.symbol() + ".");
        }

        board.set(to.r, to.c, piece);
        board.set(from.r, from.c, null);
        whiteToMove = !whiteToMove;
        return MoveOutcome.applied(piece, target);
    }

    public boolean isGameOver() {
        return ChessJudge.isGameOver(board);
    }
}
