package org.chessmate.game;

import org.chessmate.model.Move;

public record OpponentOutcome(Move move, boolean inCheck, boolean checkmate, boolean noMovesAvailable) {

    public static OpponentOutcome noMoves(boolean inCheck) {
        return new OpponentOutcome(null, inCheck, inCheck, true);
    }

    public boolean applied() {
        return move != null;
    }
}
