package org.chessmate.rules;

public enum MoveRejection {
    INVALID_SHAPE("move geometry impossible for the piece"),
    BLOCKED_PATH("an intervening square is occupied"),
    DIRECTIVE_MISMATCH("capture or promotion directive contradicts the board"),
    SELF_CHECK("move would leave the mover's king attacked"),
    PIECE_MISMATCH("declared piece does not stand on the start square or is not on move");

    private final String description;

    MoveRejection(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
