package org.chessmate.model;

public enum PieceColor {
    WHITE(1, 'W'),
    BLACK(-1, 'B');

    private final int sign;
    private final char letter;

    PieceColor(int sign, char letter) {
        this.sign = sign;
        this.letter = letter;
    }

    public int getSign() {
        return sign;
    }

    public char getLetter() {
        return letter;
    }

    public PieceColor opposite() {
        return this == WHITE ? BLACK : WHITE;
    }

    public int pawnDirection() {
        return sign;
    }

    public int pawnStartRow() {
        return this == WHITE ? 1 : Board.SIZE - 2;
    }

    public int farRow() {
        return this == WHITE ? Board.SIZE - 1 : 0;
    }

    public static PieceColor ofValue(int squareValue) {
        if (squareValue > 0) {
            return WHITE;
        }
        if (squareValue < 0) {
            return BLACK;
        }
        return null;
    }

    public static PieceColor fromLetter(char letter) {
        return switch (letter) {
            case 'W' -> WHITE;
            case 'B' -> BLACK;
            default -> null;
        };
    }
}
