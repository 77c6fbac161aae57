package org.chessmate.command;

public enum Response {
    NEW_GAME("New game"),
    OK("OK"),
    CHECK("CHECK"),
    MATE("MATE"),
    NO_GAME("NOGAME"),
    OUT_OF_TURN("OOT"),
    INVALID_FORMAT("INVFMT"),
    ILLEGAL_MOVE("ILLMOVE"),
    NO_MOVES("NOMOVES");

    private final String label;

    Response(String label) {
        this.label = label;
    }

    public String text() {
        return label + "\n";
    }
}
