package org.chessmate.rules;

import org.chessmate.model.Board;
import org.chessmate.model.GameState;
import org.chessmate.model.Move;
import org.chessmate.model.PieceColor;
import org.chessmate.model.PieceType;
import org.chessmate.model.Position;

public final class SelfCheckGuard {
    private SelfCheckGuard() {
    }

    public static boolean exposesKing(GameState state, Move move) {
        Board scratch = state.getBoard().copy();
        scratch.clear(move.from());
        scratch.set(move.to(), move.resultingValue());

        PieceColor mover = move.piece().color();
        Position king = move.piece().type() == PieceType.KING ? move.to() : state.getKing(mover);
        return CheckDetector.isAttacked(scratch, king, mover);
    }
}
