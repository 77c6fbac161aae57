package org.chessmate.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GameStateTest {

    @Test
    void newGameStartsWithWhiteToMoveAndNoCheck() {
        GameState state = GameState.newGame();

        assertEquals(PieceColor.WHITE, state.getTurn());
        assertFalse(state.isInCheck());
        assertEquals(Position.fromNotation("e1"), state.getKing(PieceColor.WHITE));
        assertEquals(Position.fromNotation("e8"), state.getKing(PieceColor.BLACK));
    }

    @Test
    void copySharesNothingWithTheOriginal() {
        GameState state = GameState.newGame();
        GameState copy = state.copy();
        assertEquals(state, copy);

        copy.getBoard().clear(Position.fromNotation("d1"));
        copy.setTurn(PieceColor.BLACK);
        copy.setKing(PieceColor.WHITE, Position.fromNotation("d1"));

        assertEquals(GameState.newGame(), state);
    }

    @Test
    void fromBoardRequiresExactlyOneKingPerColor() {
        Board board = new Board();
        board.place(Position.fromNotation("e1"), Piece.of(PieceColor.WHITE, PieceType.KING));
        assertThrows(IllegalArgumentException.class, () -> GameState.fromBoard(board, PieceColor.WHITE));

        board.place(Position.fromNotation("e8"), Piece.of(PieceColor.BLACK, PieceType.KING));
        board.place(Position.fromNotation("a8"), Piece.of(PieceColor.BLACK, PieceType.KING));
        assertThrows(IllegalArgumentException.class, () -> GameState.fromBoard(board, PieceColor.WHITE));
    }

    @Test
    void pieceValuesEncodeColorBySign() {
        assertEquals(5, Piece.of(PieceColor.WHITE, PieceType.QUEEN).value());
        assertEquals(-2, Piece.of(PieceColor.BLACK, PieceType.KNIGHT).value());
        assertEquals(Piece.of(PieceColor.BLACK, PieceType.ROOK), Piece.fromValue(-4));
        assertNull(Piece.fromValue(0));
        assertThrows(IllegalArgumentException.class, () -> Piece.fromValue(7));
        assertEquals("BN", Piece.fromValue(-2).code());
    }
}
