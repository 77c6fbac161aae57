package org.chessmate.model;

// Row 0 is rank 1 (White's back rank), column 0 is file a.
public record Position(int row, int col) {

    public boolean isValid() {
        return row >= 0 && row < Board.SIZE && col >= 0 && col < Board.SIZE;
    }

    public Position offset(int rowDelta, int colDelta) {
        return new Position(row + rowDelta, col + colDelta);
    }

    public String toChessNotation() {
        char file = (char) ('a' + col);
        int rank = row + 1;
        return "" + file + rank;
    }

    public static Position fromNotation(String notation) {
        if (notation == null || notation.length() != 2) {
            return null;
        }
        char file = notation.charAt(0);
        char rank = notation.charAt(1);
        if (file < 'a' || file > 'h' || rank < '1' || rank > '8') {
            return null;
        }
        return new Position(rank - '1', file - 'a');
    }

    @Override
    public String toString() {
        return toChessNotation();
    }
}
