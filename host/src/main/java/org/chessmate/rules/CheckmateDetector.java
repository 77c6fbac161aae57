package org.chessmate.rules;

import org.chessmate.model.Board;
import org.chessmate.model.GameState;
import org.chessmate.model.PieceColor;
import org.chessmate.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CheckmateDetector {
    private static final Logger logger = LoggerFactory.getLogger(CheckmateDetector.class);

    public boolean isCheckmate(GameState state, LegalityRule rule) {
        GameState scratch = state.copy();
        PieceColor color = scratch.getTurn();
        if (!CheckDetector.isInCheck(scratch, color)) {
            return false;
        }
        boolean mated = !hasLegalMove(scratch, rule);
        if (mated) {
            logger.info("{} is checkmated", color);
        }
        return mated;
    }

    public boolean hasLegalMove(GameState state, LegalityRule rule) {
        GameState scratch = state.copy();
        Board board = scratch.getBoard();
        PieceColor color = scratch.getTurn();
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                if (PieceColor.ofValue(board.get(row, col)) != color) continue;
                Position from = new Position(row, col);
                for (int toRow = 0; toRow < Board.SIZE; toRow++) {
                    for (int toCol = 0; toCol < Board.SIZE; toCol++) {
                        if (rule.isLegal(scratch, from, new Position(toRow, toCol))) {
                            return true;
                        }
                    }
                }
            }
        }
        return false;
    }
}
