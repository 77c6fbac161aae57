package org.chessmate.model;

import java.util.Objects;

public class GameState {
    private final Board board;
    private Position whiteKing;
    private Position blackKing;
    private PieceColor turn;
    private boolean inCheck;

    public GameState(Board board, Position whiteKing, Position blackKing, PieceColor turn, boolean inCheck) {
        this.board = Objects.requireNonNull(board, "board");
        this.whiteKing = whiteKing;
        this.blackKing = blackKing;
        this.turn = Objects.requireNonNull(turn, "turn");
        this.inCheck = inCheck;
    }

    public static GameState newGame() {
        return fromBoard(Board.standard(), PieceColor.WHITE);
    }

    public static GameState fromBoard(Board board, PieceColor turn) {
        for (PieceColor color : PieceColor.values()) {
            int kings = board.count(color.getSign() * PieceType.KING.getCode());
            if (kings != 1) {
                throw new IllegalArgumentException("Expected one " + color + " king, found " + kings);
            }
        }
        return new GameState(board, board.findKing(PieceColor.WHITE), board.findKing(PieceColor.BLACK), turn, false);
    }

    public Board getBoard() {
        return board;
    }

    public Position getKing(PieceColor color) {
        return color == PieceColor.WHITE ? whiteKing : blackKing;
    }

    public void setKing(PieceColor color, Position pos) {
        if (color == PieceColor.WHITE) {
            whiteKing = pos;
        } else {
            blackKing = pos;
        }
    }

    public PieceColor getTurn() {
        return turn;
    }

    public void setTurn(PieceColor turn) {
        this.turn = turn;
    }

    public boolean isInCheck() {
        return inCheck;
    }

    public void setInCheck(boolean inCheck) {
        this.inCheck = inCheck;
    }

    public GameState copy() {
        return new GameState(board.copy(), whiteKing, blackKing, turn, inCheck);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameState other)) return false;
        return inCheck == other.inCheck
                && turn == other.turn
                && board.equals(other.board)
                && Objects.equals(whiteKing, other.whiteKing)
                && Objects.equals(blackKing, other.blackKing);
    }

    @Override
    public int hashCode() {
        return Objects.hash(board, whiteKing, blackKing, turn, inCheck);
    }
}
