package org.chessmate.rules;

import org.chessmate.model.PieceType;
import org.chessmate.model.Position;

final class MoveShape {
    private MoveShape() {
    }

    static boolean isOrthogonal(Position from, Position to) {
        return (from.row() == to.row()) != (from.col() == to.col());
    }

    static boolean isDiagonal(Position from, Position to) {
        int rows = Math.abs(to.row() - from.row());
        return rows != 0 && rows == Math.abs(to.col() - from.col());
    }

    static boolean isLine(Position from, Position to) {
        return isOrthogonal(from, to) || isDiagonal(from, to);
    }

    static boolean isKnightJump(Position from, Position to) {
        int rows = Math.abs(to.row() - from.row());
        int cols = Math.abs(to.col() - from.col());
        return (rows == 2 && cols == 1) || (rows == 1 && cols == 2);
    }

    static boolean isKingStep(Position from, Position to) {
        int rows = Math.abs(to.row() - from.row());
        int cols = Math.abs(to.col() - from.col());
        return rows <= 1 && cols <= 1 && rows + cols > 0;
    }

    static boolean fits(PieceType type, Position from, Position to) {
        return switch (type) {
            case ROOK -> isOrthogonal(from, to);
            case BISHOP -> isDiagonal(from, to);
            case QUEEN -> isLine(from, to);
            case KNIGHT -> isKnightJump(from, to);
            case KING -> isKingStep(from, to);
            case PAWN -> throw new IllegalArgumentException("Pawn shape depends on color");
        };
    }
}
