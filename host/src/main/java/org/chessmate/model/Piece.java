package org.chessmate.model;

import java.util.Objects;

public record Piece(PieceType type, PieceColor color) {

    public Piece {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(color, "color");
    }

    public static Piece of(PieceColor color, PieceType type) {
        return new Piece(type, color);
    }

    public static Piece fromValue(int value) {
        if (value == Board.EMPTY) {
            return null;
        }
        PieceType type = PieceType.fromCode(Math.abs(value));
        if (type == null) {
            throw new IllegalArgumentException("Not a piece value: " + value);
        }
        return new Piece(type, PieceColor.ofValue(value));
    }

    public int value() {
        return color.getSign() * type.getCode();
    }

    public boolean isOpponentOf(Piece other) {
        return other != null && other.color != color;
    }

    public String code() {
        return "" + color.getLetter() + type.getLetter();
    }

    @Override
    public String toString() {
        return color + " " + type;
    }
}
