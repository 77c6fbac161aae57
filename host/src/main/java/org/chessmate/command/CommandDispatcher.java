package org.chessmate.command;

import org.chessmate.game.ChessGame;
import org.chessmate.game.MoveOutcome;
import org.chessmate.game.OpponentOutcome;
import org.chessmate.model.MoveRequest;
import org.chessmate.model.PieceColor;
import org.chessmate.rules.IllegalMoveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

public class CommandDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    private final ChessGame game;
    private final PieceColor defaultPlayerColor;

    public CommandDispatcher(ChessGame game) {
        this(game, PieceColor.WHITE);
    }

    public CommandDispatcher(ChessGame game, PieceColor defaultPlayerColor) {
        this.game = Objects.requireNonNull(game, "game");
        this.defaultPlayerColor = Objects.requireNonNull(defaultPlayerColor, "defaultPlayerColor");
    }

    public String dispatch(String line) {
        String command = line == null ? "" : line.strip();
        if (command.length() < 2) {
            return Response.INVALID_FORMAT.text();
        }
        String code = command.substring(0, 2);
        String args = command.substring(2);

        String response;
        synchronized (game) {
            response = switch (code) {
                case "00" -> newGame(args);
                case "01" -> dumpBoard();
                case "02" -> humanMove(args);
                case "03" -> opponentMove();
                case "04" -> reset();
                default -> Response.INVALID_FORMAT.text();
            };
        }
        logger.debug("Command '{}' -> {}", command, response.strip());
        return response;
    }

    private String newGame(String args) {
        try {
            PieceColor player = args.isBlank() ? defaultPlayerColor : CommandParser.parseColor(args);
            game.newGame(player);
            return Response.NEW_GAME.text();
        } catch (CommandFormatException e) {
            logger.debug("Rejected new game command: {}", e.getMessage());
            return Response.INVALID_FORMAT.text();
        }
    }

    private String dumpBoard() {
        if (!game.hasActiveGame()) {
            return Response.NO_GAME.text();
        }
        if (game.isGameOver()) {
            return gameOver().text();
        }
        return game.renderBoard();
    }

    private String humanMove(String args) {
        Response gate = gate(game.getPlayerColor());
        if (gate != null) {
            return gate.text();
        }

        MoveRequest request;
        try {
            request = CommandParser.parseMove(args);
        } catch (CommandFormatException e) {
            logger.debug("Malformed move: {}", e.getMessage());
            return Response.INVALID_FORMAT.text();
        }
        if (request.piece().color() != game.getPlayerColor()) {
            return Response.ILLEGAL_MOVE.text();
        }

        try {
            MoveOutcome outcome = game.submitMove(request);
            return classify(outcome.checkmate(), outcome.inCheck()).text();
        } catch (IllegalMoveException e) {
            logger.debug("Illegal move {}: {}", request, e.getReason());
            return Response.ILLEGAL_MOVE.text();
        }
    }

    private String opponentMove() {
        Response gate = gate(game.getOpponentColor());
        if (gate != null) {
            return gate.text();
        }
        OpponentOutcome outcome = game.opponentMove();
        if (outcome.noMovesAvailable()) {
            return (outcome.checkmate() ? Response.MATE : Response.NO_MOVES).text();
        }
        return classify(outcome.checkmate(), outcome.inCheck()).text();
    }

    private String reset() {
        Response gate = gate(game.getPlayerColor());
        if (gate != null) {
            return gate.text();
        }
        game.reset();
        return Response.OK.text();
    }

    // Shared preconditions: a live game, not finished, and the given side on move.
    private Response gate(PieceColor expectedTurn) {
        if (!game.hasActiveGame()) {
            return Response.NO_GAME;
        }
        if (game.isGameOver()) {
            return gameOver();
        }
        if (game.getTurn() != expectedTurn) {
            return Response.OUT_OF_TURN;
        }
        return null;
    }

    private Response gameOver() {
        return game.isCheckmate() ? Response.MATE : Response.NO_MOVES;
    }

    private Response classify(boolean checkmate, boolean inCheck) {
        if (checkmate) {
            return Response.MATE;
        }
        return inCheck ? Response.CHECK : Response.OK;
    }
}
