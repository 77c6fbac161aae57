package org.chessmate.game;

import org.chessmate.model.Board;
import org.chessmate.model.Piece;

public final class BoardRenderer {
    public static final String EMPTY_SQUARE = "**";

    private BoardRenderer() {
    }

    public static String render(Board board) {
        StringBuilder sb = new StringBuilder(Board.SIZE * (Board.SIZE * 3 + 1));
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                Piece piece = Piece.fromValue(board.get(row, col));
                sb.append(piece == null ? EMPTY_SQUARE : piece.code()).append(' ');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
