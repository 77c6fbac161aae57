package org.chessmate.command;

import org.chessmate.model.Directive;
import org.chessmate.model.DirectiveKind;
import org.chessmate.model.MoveRequest;
import org.chessmate.model.Piece;
import org.chessmate.model.PieceColor;
import org.chessmate.model.PieceType;
import org.chessmate.model.Position;

public final class CommandParser {
    private static final int MOVE_LENGTH = 7;
    private static final int TOKEN_LENGTH = 3;

    private CommandParser() {
    }

    public static PieceColor parseColor(String args) throws CommandFormatException {
        String trimmed = args == null ? "" : args.strip();
        if (trimmed.length() != 1) {
            throw new CommandFormatException("Expected W or B, got '" + trimmed + "'");
        }
        PieceColor color = PieceColor.fromLetter(trimmed.charAt(0));
        if (color == null) {
            throw new CommandFormatException("Unknown color: " + trimmed);
        }
        return color;
    }

    public static MoveRequest parseMove(String args) throws CommandFormatException {
        String text = args == null ? "" : args.strip();
        int extra = text.length() - MOVE_LENGTH;
        if (extra < 0 || extra % TOKEN_LENGTH != 0 || extra > 2 * TOKEN_LENGTH) {
            throw new CommandFormatException("Malformed move: " + text);
        }
        Piece piece = parsePiece(text, 0);
        Position from = parseSquare(text.substring(2, 4));
        if (text.charAt(4) != '-') {
            throw new CommandFormatException("Missing '-' in " + text);
        }
        Position to = parseSquare(text.substring(5, 7));

        Directive primary = null;
        Directive secondary = null;
        if (extra >= TOKEN_LENGTH) {
            primary = parseDirective(text, MOVE_LENGTH);
        }
        if (extra == 2 * TOKEN_LENGTH) {
            secondary = parseDirective(text, MOVE_LENGTH + TOKEN_LENGTH);
        }
        return new MoveRequest(piece, from, to, primary, secondary);
    }

    static Directive parseDirective(String text, int offset) throws CommandFormatException {
        DirectiveKind kind = DirectiveKind.fromMarker(text.charAt(offset));
        if (kind == null) {
            throw new CommandFormatException("Unknown directive marker in " + text.substring(offset));
        }
        return new Directive(kind, parsePiece(text, offset + 1));
    }

    private static Piece parsePiece(String text, int offset) throws CommandFormatException {
        PieceColor color = PieceColor.fromLetter(text.charAt(offset));
        PieceType type = PieceType.fromLetter(text.charAt(offset + 1));
        if (color == null || type == null) {
            throw new CommandFormatException("Unknown piece: " + text.substring(offset, offset + 2));
        }
        return Piece.of(color, type);
    }

    private static Position parseSquare(String square) throws CommandFormatException {
        Position pos = Position.fromNotation(square);
        if (pos == null) {
            throw new CommandFormatException("Invalid square: " + square);
        }
        return pos;
    }
}
