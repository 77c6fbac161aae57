package org.chessmate.model;

import java.util.Objects;

public record MoveRequest(Piece piece, Position from, Position to, Directive primary, Directive secondary) {

    public MoveRequest {
        Objects.requireNonNull(piece, "piece");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public static MoveRequest of(Piece piece, String from, String to) {
        return new MoveRequest(piece, parse(from), parse(to), null, null);
    }

    public MoveRequest withPrimary(Directive directive) {
        return new MoveRequest(piece, from, to, directive, secondary);
    }

    public MoveRequest withSecondary(Directive directive) {
        return new MoveRequest(piece, from, to, primary, directive);
    }

    public boolean hasDirective() {
        return primary != null || secondary != null;
    }

    public boolean capturePrimary() {
        return primary != null && primary.isCapture();
    }

    public boolean hasPromotion() {
        return (primary != null && primary.isPromotion()) || (secondary != null && secondary.isPromotion());
    }

    private static Position parse(String notation) {
        Position pos = Position.fromNotation(notation);
        if (pos == null) {
            throw new IllegalArgumentException("Invalid square: " + notation);
        }
        return pos;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(piece.code()).append(from).append('-').append(to);
        if (primary != null) sb.append(primary.toToken());
        if (secondary != null) sb.append(secondary.toToken());
        return sb.toString();
    }
}
