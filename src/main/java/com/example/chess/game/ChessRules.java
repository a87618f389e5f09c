package com.example.chess.game;

import java.util.*;

/**
 * Chess move-legality rules:
 * - 8x8 coordinates: row 0 at top (Black baseline, rank 8), row 7 at bottom (White baseline, rank 1), col 0..7 = files a..h
 * - White moves upward (dir = -1), Black moves downward (dir = +1)
 * - {@link #isValidMove} decides geometry and occupancy for one piece type only; turn order and
 *   own-piece captures are gated by {@link ChessGame#attemptMove}
 * - No check, castling, en passant or promotion
 */
public final class ChessRules {

    public static final int SIZE = 8;

    private ChessRules() {
    }

    /* ===================== Basic Types ===================== */

    public enum Side {
        WHITE(-1, 6), // White at bottom, moves upward
        BLACK(+1, 1); // Black at top, moves downward
        public final int dir;
        public final int pawnRow;

        Side(int d, int pawnRow) {
            this.dir = d;
            this.pawnRow = pawnRow;
        }

        public Side opponent() {
            return this == WHITE ? BLACK : WHITE;
        }

        public String displayName() {
            return this == WHITE ? "White" : "Black";
        }
    }

    public enum PieceType {
        PAWN('P'), KNIGHT('N'), BISHOP('B'), ROOK('R'), QUEEN('Q'), KING('K');

        public final char letter;

        PieceType(char letter) {
            this.letter = letter;
        }
    }

    /**
     * Position coordinates; may hold values off the board, {@link Board#in(Pos)} decides
     */
    public static final class Pos {
        public final int r, c;

        public Pos(int r, int c) {
            this.r = r;
            this.c = c;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Pos p)) return false;
            return p.r == r && p.c == c;
        }

        @Override
        public int hashCode() {
            return Objects.hash(r, c);
        }

        @Override
        public String toString() {
            return "(" + r + "," + c + ")";
        }
    }

    /**
     * Immutable piece descriptor. The board moves references around, pieces never hold a position.
     */
    public static final class Piece {
        public final PieceType type;
        public final Side side;

        public Piece(PieceType type, Side side) {
            this.type = Objects.requireNonNull(type);
            this.side = Objects.requireNonNull(side);
        }

        /** 'P', 'N', ... for White, lower case for Black */
        public char symbol() {
            return side == Side.WHITE ? type.letter : Character.toLowerCase(type.letter);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Piece p)) return false;
            return p.type == type && p.side == side;
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, side);
        }

        @Override
        public String toString() {
            return side.displayName() + " " + type.name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * One cell of the board as seen by renderers and the HTTP layer
     */
    public record Cell(Pos pos, Optional<Piece> piece) {
    }

    /* ===================== Piece Rules ===================== */

    /**
     * Geometry and occupancy legality of moving {@code piece} from {@code from} to {@code to}.
     * Does not look at whose turn it is nor at the colour of a piece standing on {@code to}
     * (except for pawns, whose captures depend on it).
     */
    public static boolean isValidMove(Piece piece, Pos from, Pos to, Board b) {
        int dr = to.r - from.r, dc = to.c - from.c;
        int adr = Math.abs(dr), adc = Math.abs(dc);
        return switch (piece.type) {
            case PAWN -> isValidPawnMove(piece.side, from, to, b);
            case KNIGHT -> (adr == 1 && adc == 2) || (adr == 2 && adc == 1);
            case BISHOP -> adr == adc && adr != 0 && b.isPathClear(from, to);
            case ROOK -> (dr == 0) != (dc == 0) && b.isPathClear(from, to);
            case QUEEN -> ((adr == adc && adr != 0) || (dr == 0) != (dc == 0)) && b.isPathClear(from, to);
            case KING -> Math.max(adr, adc) == 1;
        };
    }

    /**
     * Pawn: one step forward onto an empty square; two steps from the home row through empty squares;
     * one step diagonally forward onto an enemy piece
     */
    private static boolean isValidPawnMove(Side side, Pos from, Pos to, Board b) {
        int dir = side.dir;
        Piece target = b.at(to.r, to.c);
        if (to.c == from.c) {
            if (target != null) return false;
            if (to.r == from.r + dir) return true;
            return from.r == side.pawnRow
                    && to.r == from.r + 2 * dir
                    && b.at(from.r + dir, from.c) == null;
        }
        return Math.abs(to.c - from.c) == 1
                && to.r == from.r + dir
                && target != null
                && target.side != side;
    }

    /* ===================== Board ===================== */

    public static final class Board {
        private final Piece[][] grid = new Piece[SIZE][SIZE];

        public boolean in(int r, int c) {
            return r >= 0 && r < SIZE && c >= 0 && c < SIZE;
        }

        public boolean in(Pos p) {
            return in(p.r, p.c);
        }

        public Piece at(int r, int c) {
            return in(r, c) ? grid[r][c] : null;
        }

        public Optional<Piece> pieceAt(Pos p) {
            return Optional.ofNullable(at(p.r, p.c));
        }

        public void set(int r, int c, Piece p) {
            if (in(r, c)) grid[r][c] = p;
        }

        /**
         * Standard starting position
         */
        public static Board initial() {
            Board b = new Board();
            PieceType[] backRank = {
                    PieceType.ROOK, PieceType.KNIGHT, PieceType.BISHOP, PieceType.QUEEN,
                    PieceType.KING, PieceType.BISHOP, PieceType.KNIGHT, PieceType.ROOK
            };
            for (int c = 0; c < SIZE; c++) {
                // Black side (top)
                b.set(0, c, new Piece(backRank[c], Side.BLACK));
                b.set(1, c, new Piece(PieceType.PAWN, Side.BLACK));
                // White side (bottom)
                b.set(6, c, new Piece(PieceType.PAWN, Side.WHITE));
                b.set(7, c, new Piece(backRank[c], Side.WHITE));
            }
            return b;
        }

        /**
         * True if every square strictly between the two positions is empty.
         * Positions must share a row, a column or a diagonal; endpoints are not inspected.
         */
        public boolean isPathClear(Pos from, Pos to) {
            int sr = Integer.signum(to.r - from.r), sc = Integer.signum(to.c - from.c);
            int r = from.r + sr, c = from.c + sc;
            while (r != to.r || c != to.c) {
                if (grid[r][c] != null) return false;
                r += sr;
                c += sc;
            }
            return true;
        }

        /**
         * Find king position, null if it has been captured
         */
        public Pos findKing(Side s) {
            for (int r = 0; r < SIZE; r++)
                for (int c = 0; c < SIZE; c++) {
                    Piece p = grid[r][c];
                    if (p != null && p.type == PieceType.KING && p.side == s) return new Pos(r, c);
                }
            return null;
        }

        public int occupiedCount() {
            int n = 0;
            for (Piece[] row : grid)
                for (Piece p : row)
                    if (p != null) n++;
            return n;
        }

        /**
         * All 64 cells, row-major from a8 to h1
         */
        public List<Cell> cells() {
            List<Cell> out = new ArrayList<>(SIZE * SIZE);
            for (int r = 0; r < SIZE; r++)
                for (int c = 0; c < SIZE; c++)
                    out.add(new Cell(new Pos(r, c), Optional.ofNullable(grid[r][c])));
            return Collections.unmodifiableList(out);
        }

        /**
         * Clone board; pieces are immutable so references are shared
         */
        public Board copy() {
            Board b = new Board();
            for (int r = 0; r < SIZE; r++) b.grid[r] = grid[r].clone();
            return b;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Board other)) return false;
            return Arrays.deepEquals(grid, other.grid);
        }

        @Override
        public int hashCode() {
            return Arrays.deepHashCode(grid);
        }
    }
}
