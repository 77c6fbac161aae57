package org.chessmate.rules;

import org.chessmate.model.Board;
import org.chessmate.model.Directive;
import org.chessmate.model.Position;

public final class PathChecker {
    private PathChecker() {
    }

    public static boolean isLineClear(Board board, Position from, Position to) {
        requireLine(from, to);
        int rowStep = Integer.signum(to.row() - from.row());
        int colStep = Integer.signum(to.col() - from.col());
        int row = from.row() + rowStep;
        int col = from.col() + colStep;
        while (row != to.row() || col != to.col()) {
            if (board.get(row, col) != Board.EMPTY) {
                return false;
            }
            row += rowStep;
            col += colStep;
        }
        return true;
    }

    public static PathStatus clearPath(Board board, Position from, Position to, Directive primary) {
        if (!isLineClear(board, from, to)) {
            return PathStatus.BLOCKED;
        }
        if (!board.isEmpty(to) && (primary == null || !primary.isCapture())) {
            return PathStatus.DESTINATION_OCCUPIED;
        }
        return PathStatus.CLEAR;
    }

    private static void requireLine(Position from, Position to) {
        if (!MoveShape.isLine(from, to)) {
            throw new IllegalArgumentException("Not a straight or diagonal line: " + from + " -> " + to);
        }
    }
}
