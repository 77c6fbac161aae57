package org.chessmate.model;

public enum DirectiveKind {
    CAPTURE('x'),
    PROMOTE('y');

    private final char marker;

    DirectiveKind(char marker) {
        this.marker = marker;
    }

    public char getMarker() {
        return marker;
    }

    public static DirectiveKind fromMarker(char marker) {
        return switch (marker) {
            case 'x' -> CAPTURE;
            case 'y' -> PROMOTE;
            default -> null;
        };
    }
}
