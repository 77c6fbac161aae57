package org.chessmate.model;

public record Move(Position from, Position to, Piece piece, Piece captured, PieceType promotion) {

    public Move(Position from, Position to, Piece piece, Piece captured) {
        this(from, to, piece, captured, null);
    }

    public boolean isCapture() {
        return captured != null;
    }

    public boolean isPromotion() {
        return promotion != null;
    }

    public Move withPromotion(PieceType type) {
        return new Move(from, to, piece, captured, type);
    }

    public int resultingValue() {
        return promotion == null ? piece.value() : Piece.of(piece.color(), promotion).value();
    }

    public String toNotation() {
        String pieceSymbol = piece.type() == PieceType.PAWN ? "" : String.valueOf(piece.type().getLetter());
        String capture = captured != null ? "x" : "";
        String promo = promotion != null ? "=" + promotion.getLetter() : "";
        return pieceSymbol + capture + to.toChessNotation() + promo;
    }

    @Override
    public String toString() {
        if (captured != null) {
            return from.toChessNotation() + " x " + to.toChessNotation();
        }
        return from.toChessNotation() + " -> " + to.toChessNotation();
    }
}
