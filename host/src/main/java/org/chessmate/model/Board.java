package org.chessmate.model;

import java.util.Arrays;

// Square values: 0 is empty, the sign is the color, the magnitude the PieceType code.
public class Board {
    public static final int SIZE = 8;
    public static final int EMPTY = 0;

    private static final PieceType[] BACK_RANK = {
            PieceType.ROOK, PieceType.KNIGHT, PieceType.BISHOP, PieceType.QUEEN,
            PieceType.KING, PieceType.BISHOP, PieceType.KNIGHT, PieceType.ROOK
    };

    private final int[][] squares;

    public Board() {
        squares = new int[SIZE][SIZE];
    }

    private Board(int[][] squares) {
        this.squares = squares;
    }

    public static Board standard() {
        Board board = new Board();
        for (int col = 0; col < SIZE; col++) {
            board.squares[0][col] = BACK_RANK[col].getCode();
            board.squares[1][col] = PieceType.PAWN.getCode();
            board.squares[SIZE - 2][col] = -PieceType.PAWN.getCode();
            board.squares[SIZE - 1][col] = -BACK_RANK[col].getCode();
        }
        return board;
    }

    public int get(int row, int col) {
        return squares[row][col];
    }

    public int get(Position pos) {
        return squares[pos.row()][pos.col()];
    }

    public void set(Position pos, int value) {
        squares[pos.row()][pos.col()] = value;
    }

    public void place(Position pos, Piece piece) {
        set(pos, piece == null ? EMPTY : piece.value());
    }

    public void clear(Position pos) {
        set(pos, EMPTY);
    }

    public boolean isEmpty(Position pos) {
        return get(pos) == EMPTY;
    }

    public Piece getPiece(Position pos) {
        if (!pos.isValid()) return null;
        return Piece.fromValue(get(pos));
    }

    public Position findKing(PieceColor color) {
        int king = color.getSign() * PieceType.KING.getCode();
        for (int row = 0; row < SIZE; row++) {
            for (int col = 0; col < SIZE; col++) {
                if (squares[row][col] == king) {
                    return new Position(row, col);
                }
            }
        }
        return null;
    }

    public int count(int value) {
        int count = 0;
        for (int[] row : squares) {
            for (int square : row) {
                if (square == value) {
                    count++;
                }
            }
        }
        return count;
    }

    public Board copy() {
        int[][] clone = new int[SIZE][];
        for (int row = 0; row < SIZE; row++) {
            clone[row] = squares[row].clone();
        }
        return new Board(clone);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board other)) return false;
        return Arrays.deepEquals(squares, other.squares);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(squares);
    }
}
