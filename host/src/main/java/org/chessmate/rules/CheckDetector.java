package org.chessmate.rules;

import org.chessmate.model.Board;
import org.chessmate.model.GameState;
import org.chessmate.model.PieceColor;
import org.chessmate.model.PieceType;
import org.chessmate.model.Position;

public final class CheckDetector {
    private static final int[][] RAYS = {
            {1, 0}, {-1, 0}, {0, 1}, {0, -1},
            {1, 1}, {-1, -1}, {1, -1}, {-1, 1}
    };
    private static final int[][] KNIGHT_JUMPS = {
            {2, 1}, {2, -1}, {-2, 1}, {-2, -1},
            {1, 2}, {1, -2}, {-1, 2}, {-1, -2}
    };

    private CheckDetector() {
    }

    public static boolean isInCheck(GameState state, PieceColor color) {
        return isAttacked(state.getBoard(), state.getKing(color), color);
    }

    public static boolean isAttacked(Board board, Position king, PieceColor kingColor) {
        int enemy = kingColor.opposite().getSign();
        return attackedAlongRay(board, king, enemy)
                || attackedByKnight(board, king, enemy)
                || attackedByPawn(board, king, kingColor, enemy)
                || attackedByKing(board, king, enemy);
    }

    private static boolean attackedAlongRay(Board board, Position king, int enemy) {
        for (int[] ray : RAYS) {
            boolean orthogonal = ray[0] == 0 || ray[1] == 0;
            Position pos = king.offset(ray[0], ray[1]);
            while (pos.isValid()) {
                int value = board.get(pos);
                if (value != Board.EMPTY) {
                    if (Integer.signum(value) == enemy) {
                        PieceType type = PieceType.fromCode(Math.abs(value));
                        if (type == PieceType.QUEEN
                                || (type == PieceType.ROOK && orthogonal)
                                || (type == PieceType.BISHOP && !orthogonal)) {
                            return true;
                        }
                    }
                    break;
                }
                pos = pos.offset(ray[0], ray[1]);
            }
        }
        return false;
    }

    private static boolean attackedByKnight(Board board, Position king, int enemy) {
        int knight = enemy * PieceType.KNIGHT.getCode();
        for (int[] jump : KNIGHT_JUMPS) {
            Position pos = king.offset(jump[0], jump[1]);
            if (pos.isValid() && board.get(pos) == knight) {
                return true;
            }
        }
        return false;
    }

    // Enemy pawns attack from one row further along the king's own pawn direction.
    private static boolean attackedByPawn(Board board, Position king, PieceColor kingColor, int enemy) {
        int pawn = enemy * PieceType.PAWN.getCode();
        int row = king.row() + kingColor.pawnDirection();
        for (int colDelta : new int[]{-1, 1}) {
            Position pos = new Position(row, king.col() + colDelta);
            if (pos.isValid() && board.get(pos) == pawn) {
                return true;
            }
        }
        return false;
    }

    private static boolean attackedByKing(Board board, Position king, int enemy) {
        int enemyKing = enemy * PieceType.KING.getCode();
        for (int rowDelta = -1; rowDelta <= 1; rowDelta++) {
            for (int colDelta = -1; colDelta <= 1; colDelta++) {
                if (rowDelta == 0 && colDelta == 0) continue;
                Position pos = king.offset(rowDelta, colDelta);
                if (pos.isValid() && board.get(pos) == enemyKing) {
                    return true;
                }
            }
        }
        return false;
    }
}
