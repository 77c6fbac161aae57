package org.chessmate.command;

import org.chessmate.model.DirectiveKind;
import org.chessmate.model.MoveRequest;
import org.chessmate.model.PieceColor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.chessmate.model.PositionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CommandParserTest {

    @Test
    void parsesColors() throws CommandFormatException {
        assertEquals(PieceColor.WHITE, CommandParser.parseColor("W"));
        assertEquals(PieceColor.BLACK, CommandParser.parseColor(" B "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "w", "X", "WB"})
    void rejectsUnknownColors(String args) {
        assertThrows(CommandFormatException.class, () -> CommandParser.parseColor(args));
    }

    @Test
    void parsesPlainMove() throws CommandFormatException {
        MoveRequest request = CommandParser.parseMove("WPe2-e4");
        assertEquals(piece("WP"), request.piece());
        assertEquals(square("e2"), request.from());
        assertEquals(square("e4"), request.to());
        assertNull(request.primary());
        assertNull(request.secondary());
    }

    @Test
    void parsesCaptureToken() throws CommandFormatException {
        MoveRequest request = CommandParser.parseMove("WQd1-d7xBP");
        assertEquals(DirectiveKind.CAPTURE, request.primary().kind());
        assertEquals(piece("BP"), request.primary().piece());
        assertNull(request.secondary());
    }

    @Test
    void parsesCaptureAndPromotionTokens() throws CommandFormatException {
        MoveRequest request = CommandParser.parseMove("WPd7-c8xBRyWQ");
        assertEquals(DirectiveKind.CAPTURE, request.primary().kind());
        assertEquals(piece("BR"), request.primary().piece());
        assertEquals(DirectiveKind.PROMOTE, request.secondary().kind());
        assertEquals(piece("WQ"), request.secondary().piece());
        assertEquals("WPd7-c8xBRyWQ", request.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "WPe2e4",
            "WPe2-e",
            "WPe2+e4",
            "WPi2-e4",
            "WPe2-e9",
            "WXe2-e4",
            "wpe2-e4",
            "WPe2-e4x",
            "WPe2-e4xB",
            "WPe2-e4zBP",
            "WPe2-e4xBPyWQxBN",
            "WPe2-e4xBQ1"
    })
    void rejectsMalformedMoves(String args) {
        assertThrows(CommandFormatException.class, () -> CommandParser.parseMove(args));
    }

    @Test
    void directiveMarkersAreCaseSensitive() {
        assertThrows(CommandFormatException.class, () -> CommandParser.parseDirective("XBP", 0));
        assertThrows(CommandFormatException.class, () -> CommandParser.parseDirective("Ywq", 0));
    }
}
