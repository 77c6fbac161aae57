package org.chessmate.rules;

import org.chessmate.model.GameState;
import org.chessmate.model.PieceColor;
import org.junit.jupiter.api.Test;

import static org.chessmate.model.PositionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CheckDetectorTest {

    @Test
    void nobodyIsInCheckAtTheStart() {
        GameState state = GameState.newGame();
        assertFalse(CheckDetector.isInCheck(state, PieceColor.WHITE));
        assertFalse(CheckDetector.isInCheck(state, PieceColor.BLACK));
    }

    @Test
    void rookAttacksAlongRanksAndFilesOnly() {
        assertTrue(CheckDetector.isInCheck(position(PieceColor.WHITE, "WKe1", "BKa8", "BRe7"), PieceColor.WHITE));
        assertTrue(CheckDetector.isInCheck(position(PieceColor.WHITE, "WKe1", "BKa8", "BRh1"), PieceColor.WHITE));
        assertFalse(CheckDetector.isInCheck(position(PieceColor.WHITE, "WKe1", "BKa8", "BRh4"), PieceColor.WHITE));
    }

    @Test
    void bishopAttacksAlongDiagonalsOnly() {
        assertTrue(CheckDetector.isInCheck(position(PieceColor.WHITE, "WKe1", "BKa8", "BBh4"), PieceColor.WHITE));
        assertFalse(CheckDetector.isInCheck(position(PieceColor.WHITE, "WKe1", "BKa8", "BBe4"), PieceColor.WHITE));
    }

    @Test
    void queenAttacksInAllEightDirections() {
        String[] squares = {"e5", "e2", "a1", "h1", "b4", "h4", "c3", "g3"};
        for (String sq : squares) {
            GameState state = position(PieceColor.WHITE, "WKe1", "BKa8", "BQ" + sq);
            assertTrue(CheckDetector.isInCheck(state, PieceColor.WHITE), "queen on " + sq);
        }
    }

    @Test
    void anyPieceOnTheRayShieldsTheKing() {
        assertFalse(CheckDetector.isInCheck(position(PieceColor.WHITE, "WKe1", "BKa8", "BRe8", "WNe4"), PieceColor.WHITE));
        assertFalse(CheckDetector.isInCheck(position(PieceColor.WHITE, "WKe1", "BKa8", "BRe8", "BNe4"), PieceColor.WHITE));
    }

    @Test
    void ownPiecesNeverAttack() {
        assertFalse(CheckDetector.isInCheck(position(PieceColor.WHITE, "WKe1", "BKa8", "WQe5", "WNf3"), PieceColor.WHITE));
    }

    @Test
    void knightAttacksFromAnyJumpSquare() {
        String[] squares = {"d3", "f3", "c2", "g2"};
        for (String sq : squares) {
            GameState state = position(PieceColor.WHITE, "WKe1", "BKa8", "BN" + sq);
            assertTrue(CheckDetector.isInCheck(state, PieceColor.WHITE), "knight on " + sq);
        }
        assertFalse(CheckDetector.isInCheck(position(PieceColor.WHITE, "WKe1", "BKa8", "BNe3"), PieceColor.WHITE));
    }

    @Test
    void pawnDirectionFollowsTheAttackedKingsColor() {
        // a black pawn attacks downwards
        assertTrue(CheckDetector.isInCheck(position(PieceColor.WHITE, "WKe4", "BKa8", "BPd5"), PieceColor.WHITE));
        assertTrue(CheckDetector.isInCheck(position(PieceColor.WHITE, "WKe4", "BKa8", "BPf5"), PieceColor.WHITE));
        assertFalse(CheckDetector.isInCheck(position(PieceColor.WHITE, "WKe4", "BKa8", "BPd3"), PieceColor.WHITE));
        assertFalse(CheckDetector.isInCheck(position(PieceColor.WHITE, "WKe4", "BKa8", "BPe5"), PieceColor.WHITE));

        // a white pawn attacks upwards
        assertTrue(CheckDetector.isInCheck(position(PieceColor.BLACK, "WKa1", "BKe5", "WPd4"), PieceColor.BLACK));
        assertTrue(CheckDetector.isInCheck(position(PieceColor.BLACK, "WKa1", "BKe5", "WPf4"), PieceColor.BLACK));
        assertFalse(CheckDetector.isInCheck(position(PieceColor.BLACK, "WKa1", "BKe5", "WPd6"), PieceColor.BLACK));
    }

    @Test
    void pawnOnTheEdgeFileIsHandled() {
        assertTrue(CheckDetector.isInCheck(position(PieceColor.WHITE, "WKa4", "BKh8", "BPb5"), PieceColor.WHITE));
        assertTrue(CheckDetector.isInCheck(position(PieceColor.BLACK, "WKa1", "BKh5", "WPg4"), PieceColor.BLACK));
    }

    @Test
    void adjacentKingCounts() {
        assertTrue(CheckDetector.isAttacked(position(PieceColor.WHITE, "WKe4", "BKe5").getBoard(),
                square("e4"), PieceColor.WHITE));
        assertFalse(CheckDetector.isInCheck(position(PieceColor.WHITE, "WKe4", "BKe6"), PieceColor.WHITE));
    }

    @Test
    void attackedReportsHypotheticalKingSquares() {
        GameState state = position(PieceColor.WHITE, "WKe1", "BKa8", "BRd8");
        assertTrue(CheckDetector.isAttacked(state.getBoard(), square("d1"), PieceColor.WHITE));
        assertFalse(CheckDetector.isAttacked(state.getBoard(), square("f1"), PieceColor.WHITE));
    }
}
