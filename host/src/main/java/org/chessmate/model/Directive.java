package org.chessmate.model;

import java.util.Objects;

public record Directive(DirectiveKind kind, Piece piece) {

    public Directive {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(piece, "piece");
    }

    public static Directive capture(Piece captured) {
        return new Directive(DirectiveKind.CAPTURE, captured);
    }

    public static Directive promote(Piece target) {
        return new Directive(DirectiveKind.PROMOTE, target);
    }

    public boolean isCapture() {
        return kind == DirectiveKind.CAPTURE;
    }

    public boolean isPromotion() {
        return kind == DirectiveKind.PROMOTE;
    }

    public String toToken() {
        return kind.getMarker() + piece.code();
    }

    @Override
    public String toString() {
        return toToken();
    }
}
