package org.chessmate.game;

import org.chessmate.model.GameState;
import org.chessmate.model.Move;
import org.chessmate.model.MoveRequest;
import org.chessmate.model.PieceColor;
import org.chessmate.rules.CheckDetector;
import org.chessmate.rules.CheckmateDetector;
import org.chessmate.rules.HumanMoveValidator;
import org.chessmate.rules.LegalityRule;
import org.chessmate.rules.MoveExecutor;
import org.chessmate.rules.OpponentMoveGenerator;
import org.chessmate.rules.PromotionPolicy;
import org.chessmate.settings.GameSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Random;

public class ChessGame {
    private static final Logger logger = LoggerFactory.getLogger(ChessGame.class);

    private final HumanMoveValidator validator;
    private final OpponentMoveGenerator opponent;
    private final CheckmateDetector checkmateDetector;
    private final MoveExecutor executor;

    private GameState state;
    private PieceColor playerColor;
    private boolean checkmate;
    private boolean stalemate;

    public ChessGame(HumanMoveValidator validator, OpponentMoveGenerator opponent,
                     CheckmateDetector checkmateDetector, MoveExecutor executor) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.opponent = Objects.requireNonNull(opponent, "opponent");
        this.checkmateDetector = Objects.requireNonNull(checkmateDetector, "checkmateDetector");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public static ChessGame fromSettings(GameSettings settings) {
        Random random = settings.getRandomSeed() == 0L ? new Random() : new Random(settings.getRandomSeed());
        PromotionPolicy policy = PromotionPolicy.fromName(settings.getOpponentPromotion());
        MoveExecutor executor = new MoveExecutor();
        return new ChessGame(new HumanMoveValidator(), new OpponentMoveGenerator(random, policy, executor),
                new CheckmateDetector(), executor);
    }

    public synchronized void newGame(PieceColor player) {
        load(GameState.newGame(), player);
        logger.info("New game, human plays {}", player);
    }

    public synchronized void load(GameState position, PieceColor player) {
        this.state = Objects.requireNonNull(position, "position");
        state.setInCheck(CheckDetector.isInCheck(state, state.getTurn()));
        this.playerColor = Objects.requireNonNull(player, "player");
        this.checkmate = false;
        this.stalemate = false;
    }

    public synchronized void reset() {
        logger.info("Game reset");
        state = null;
        playerColor = null;
        checkmate = false;
        stalemate = false;
    }

    public synchronized boolean hasActiveGame() {
        return state != null;
    }

    public synchronized boolean isCheckmate() {
        return checkmate;
    }

    public synchronized boolean isStalemate() {
        return stalemate;
    }

    public synchronized boolean isGameOver() {
        return checkmate || stalemate;
    }

    public synchronized PieceColor getPlayerColor() {
        return playerColor;
    }

    public synchronized PieceColor getOpponentColor() {
        return playerColor == null ? null : playerColor.opposite();
    }

    public synchronized PieceColor getTurn() {
        requireActive();
        return state.getTurn();
    }

    public synchronized boolean isPlayerTurn() {
        return state != null && state.getTurn() == playerColor;
    }

    public synchronized GameState snapshot() {
        requireActive();
        return state.copy();
    }

    public synchronized MoveOutcome submitMove(MoveRequest request) {
        requirePlayable();
        if (state.getTurn() != playerColor) {
            throw new IllegalStateException("Not the human's turn");
        }
        Move move = validator.validate(state, request);
        executor.execute(state, move);
        checkmate = checkmateDetector.isCheckmate(state, ruleFor(state.getTurn()));
        logger.debug("Human played {}, check: {}, mate: {}", move, state.isInCheck(), checkmate);
        return new MoveOutcome(move, state.isInCheck(), checkmate);
    }

    // Without a legal move the game ends: mate when in check, stalemate otherwise.
    public synchronized OpponentOutcome opponentMove() {
        requirePlayable();
        if (state.getTurn() != playerColor.opposite()) {
            throw new IllegalStateException("Not the opponent's turn");
        }
        Optional<Move> move = opponent.play(state);
        if (move.isEmpty()) {
            boolean inCheck = CheckDetector.isInCheck(state, state.getTurn());
            checkmate = inCheck;
            stalemate = !inCheck;
            logger.info("Opponent has no legal move ({})", inCheck ? "checkmate" : "stalemate");
            return OpponentOutcome.noMoves(inCheck);
        }
        checkmate = checkmateDetector.isCheckmate(state, ruleFor(state.getTurn()));
        return new OpponentOutcome(move.get(), state.isInCheck(), checkmate, false);
    }

    public synchronized String renderBoard() {
        requireActive();
        return BoardRenderer.render(state.getBoard());
    }

    private LegalityRule ruleFor(PieceColor color) {
        return color == playerColor ? validator : opponent;
    }

    private void requireActive() {
        if (state == null) {
            throw new IllegalStateException("No active game");
        }
    }

    private void requirePlayable() {
        requireActive();
        if (isGameOver()) {
            throw new IllegalStateException("Game is over");
        }
    }
}
