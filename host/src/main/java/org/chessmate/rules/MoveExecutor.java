package org.chessmate.rules;

import org.chessmate.model.Board;
import org.chessmate.model.GameState;
import org.chessmate.model.Move;
import org.chessmate.model.PieceColor;
import org.chessmate.model.PieceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MoveExecutor {
    private static final Logger logger = LoggerFactory.getLogger(MoveExecutor.class);

    public void execute(GameState state, Move move) {
        Board board = state.getBoard();
        PieceColor mover = move.piece().color();

        board.clear(move.from());
        board.set(move.to(), move.resultingValue());
        if (move.piece().type() == PieceType.KING) {
            state.setKing(mover, move.to());
        }

        PieceColor next = state.getTurn().opposite();
        state.setTurn(next);
        state.setInCheck(CheckDetector.isInCheck(state, next));
        logger.debug("Executed {} ({}), {} to move, in check: {}", move.toNotation(), move, next, state.isInCheck());
    }
}
