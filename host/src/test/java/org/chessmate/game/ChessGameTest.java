package org.chessmate.game;

import org.chessmate.model.GameState;
import org.chessmate.model.MoveRequest;
import org.chessmate.model.PieceColor;
import org.chessmate.rules.IllegalMoveException;
import org.chessmate.rules.MoveRejection;
import org.chessmate.settings.GameSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.chessmate.model.PositionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ChessGameTest {

    private ChessGame game;

    @BeforeEach
    void setUp() {
        GameSettings settings = new GameSettings();
        settings.setRandomSeed(11L);
        game = ChessGame.fromSettings(settings);
    }

    @Test
    void nothingWorksBeforeANewGame() {
        assertFalse(game.hasActiveGame());
        assertFalse(game.isPlayerTurn());
        assertThrows(IllegalStateException.class, () -> game.submitMove(MoveRequest.of(piece("WP"), "e2", "e4")));
        assertThrows(IllegalStateException.class, () -> game.opponentMove());
        assertThrows(IllegalStateException.class, () -> game.snapshot());
    }

    @Test
    void humanAndOpponentAlternate() {
        game.newGame(PieceColor.WHITE);
        assertTrue(game.isPlayerTurn());

        MoveOutcome outcome = game.submitMove(MoveRequest.of(piece("WP"), "e2", "e4"));
        assertTrue(outcome.applied());
        assertFalse(outcome.inCheck());
        assertFalse(outcome.checkmate());
        assertEquals(PieceColor.BLACK, game.getTurn());
        assertThrows(IllegalStateException.class, () -> game.submitMove(MoveRequest.of(piece("WP"), "d2", "d4")));

        OpponentOutcome reply = game.opponentMove();
        assertTrue(reply.applied());
        assertEquals(PieceColor.BLACK, reply.move().piece().color());
        assertEquals(PieceColor.WHITE, game.getTurn());
        assertThrows(IllegalStateException.class, () -> game.opponentMove());
    }

    @Test
    void humanPlayingBlackWaitsForTheOpponent() {
        game.newGame(PieceColor.BLACK);
        assertEquals(PieceColor.WHITE, game.getOpponentColor());
        assertFalse(game.isPlayerTurn());
        assertTrue(game.opponentMove().applied());
        assertTrue(game.isPlayerTurn());
    }

    @Test
    void rejectedMoveLeavesThePositionUnchanged() {
        game.newGame(PieceColor.WHITE);
        GameState before = game.snapshot();

        IllegalMoveException e = assertThrows(IllegalMoveException.class,
                () -> game.submitMove(MoveRequest.of(piece("WQ"), "d1", "d3")));
        assertEquals(MoveRejection.BLOCKED_PATH, e.getReason());
        assertEquals(before, game.snapshot());
        assertTrue(game.isPlayerTurn());
    }

    @Test
    void snapshotIsDetached() {
        game.newGame(PieceColor.WHITE);
        game.snapshot().getBoard().clear(square("e1"));
        assertEquals(piece("WK"), game.snapshot().getBoard().getPiece(square("e1")));
    }

    @Test
    void humanDeliversFoolsMate() {
        game.load(fromStart(PieceColor.BLACK, "f2f3", "e7e5", "g2g4"), PieceColor.BLACK);

        MoveOutcome outcome = game.submitMove(MoveRequest.of(piece("BQ"), "d8", "h4"));
        assertTrue(outcome.inCheck());
        assertTrue(outcome.checkmate());
        assertTrue(game.isCheckmate());
        assertTrue(game.isGameOver());
        assertThrows(IllegalStateException.class, () -> game.opponentMove());
    }

    @Test
    void checkWithoutMate() {
        game.load(position(PieceColor.WHITE, "WKa1", "WRh2", "BKe8"), PieceColor.WHITE);
        MoveOutcome outcome = game.submitMove(MoveRequest.of(piece("WR"), "h2", "h8"));
        assertTrue(outcome.inCheck());
        assertFalse(outcome.checkmate());
        assertFalse(game.isGameOver());
    }

    @Test
    void opponentWithoutMovesIsStalemated() {
        game.load(position(PieceColor.BLACK, "BKh8", "WQg6", "WKa1"), PieceColor.WHITE);

        OpponentOutcome outcome = game.opponentMove();
        assertTrue(outcome.noMovesAvailable());
        assertFalse(outcome.applied());
        assertFalse(outcome.checkmate());
        assertTrue(game.isStalemate());
        assertFalse(game.isCheckmate());
        assertTrue(game.isGameOver());
    }

    @Test
    void opponentWithoutMovesInCheckIsMated() {
        game.load(position(PieceColor.BLACK, "BKh8", "BPg7", "BPh7", "WRa8", "WKe1"), PieceColor.WHITE);

        OpponentOutcome outcome = game.opponentMove();
        assertTrue(outcome.noMovesAvailable());
        assertTrue(outcome.checkmate());
        assertTrue(game.isCheckmate());
    }

    @Test
    void loadRecomputesTheCheckFlag() {
        GameState position = position(PieceColor.WHITE, "WKe1", "BKa8", "BRe7");
        position.setInCheck(false);
        game.load(position, PieceColor.WHITE);
        assertTrue(game.snapshot().isInCheck());
    }

    @Test
    void resetDiscardsTheGame() {
        game.newGame(PieceColor.WHITE);
        game.reset();
        assertFalse(game.hasActiveGame());
        assertNull(game.getPlayerColor());
        assertThrows(IllegalStateException.class, () -> game.renderBoard());
    }

    @Test
    void fixedSeedReplaysTheSameOpponentMove() {
        GameSettings settings = new GameSettings();
        settings.setRandomSeed(99L);
        ChessGame first = ChessGame.fromSettings(settings);
        ChessGame second = ChessGame.fromSettings(settings);
        first.newGame(PieceColor.BLACK);
        second.newGame(PieceColor.BLACK);

        assertEquals(first.opponentMove().move(), second.opponentMove().move());
    }

    @Test
    void misspelledPromotionSettingStillStartsAGame() {
        GameSettings settings = new GameSettings();
        settings.setOpponentPromotion("QEEN");
        ChessGame lenient = ChessGame.fromSettings(settings);

        lenient.newGame(PieceColor.WHITE);
        assertTrue(lenient.isPlayerTurn());
    }
}
