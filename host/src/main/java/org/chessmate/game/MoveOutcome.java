package org.chessmate.game;

import org.chessmate.model.Move;

public record MoveOutcome(Move move, boolean inCheck, boolean checkmate) {
    public boolean applied() {
        return move != null;
    }
}
