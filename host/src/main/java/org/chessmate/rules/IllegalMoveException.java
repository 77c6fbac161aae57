package org.chessmate.rules;

public class IllegalMoveException extends RuntimeException {
    private final MoveRejection reason;

    public IllegalMoveException(MoveRejection reason, String move) {
        super(move + ": " + reason.getDescription());
        this.reason = reason;
    }

    public MoveRejection getReason() {
        return reason;
    }
}
