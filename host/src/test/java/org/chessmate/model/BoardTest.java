package org.chessmate.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BoardTest {

    @Test
    void standardSetupUsesSignedPieceCodes() {
        Board board = Board.standard();

        assertEquals(PieceType.ROOK.getCode(), board.get(0, 0));
        assertEquals(PieceType.KING.getCode(), board.get(0, 4));
        assertEquals(PieceType.QUEEN.getCode(), board.get(0, 3));
        assertEquals(-PieceType.KING.getCode(), board.get(7, 4));
        assertEquals(-PieceType.PAWN.getCode(), board.get(6, 2));
        assertEquals(Board.EMPTY, board.get(4, 4));
        assertEquals(8, board.count(PieceType.PAWN.getCode()));
        assertEquals(8, board.count(-PieceType.PAWN.getCode()));
    }

    @Test
    void getPieceDecodesColorAndKind() {
        Board board = Board.standard();

        assertEquals(Piece.of(PieceColor.WHITE, PieceType.KNIGHT), board.getPiece(Position.fromNotation("g1")));
        assertEquals(Piece.of(PieceColor.BLACK, PieceType.BISHOP), board.getPiece(Position.fromNotation("c8")));
        assertNull(board.getPiece(Position.fromNotation("e4")));
        assertNull(board.getPiece(new Position(8, 0)));
    }

    @Test
    void copyIsIndependent() {
        Board board = Board.standard();
        Board copy = board.copy();
        assertEquals(board, copy);

        copy.clear(Position.fromNotation("e2"));

        assertNotEquals(board, copy);
        assertEquals(PieceType.PAWN.getCode(), board.get(Position.fromNotation("e2")));
    }

    @Test
    void findsKings() {
        Board board = Board.standard();
        assertEquals(Position.fromNotation("e1"), board.findKing(PieceColor.WHITE));
        assertEquals(Position.fromNotation("e8"), board.findKing(PieceColor.BLACK));
        assertNull(new Board().findKing(PieceColor.WHITE));
    }
}
