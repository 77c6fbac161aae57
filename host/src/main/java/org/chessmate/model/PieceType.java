package org.chessmate.model;

public enum PieceType {
    PAWN(1, 'P'),
    KNIGHT(2, 'N'),
    BISHOP(3, 'B'),
    ROOK(4, 'R'),
    QUEEN(5, 'Q'),
    KING(6, 'K');

    private final int code;
    private final char letter;

    PieceType(int code, char letter) {
        this.code = code;
        this.letter = letter;
    }

    public int getCode() {
        return code;
    }

    public char getLetter() {
        return letter;
    }

    public static PieceType fromCode(int code) {
        for (PieceType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        return null;
    }

    public static PieceType fromLetter(char letter) {
        return switch (letter) {
            case 'P' -> PAWN;
            case 'N' -> KNIGHT;
            case 'B' -> BISHOP;
            case 'R' -> ROOK;
            case 'Q' -> QUEEN;
            case 'K' -> KING;
            default -> null;
        };
    }
}
