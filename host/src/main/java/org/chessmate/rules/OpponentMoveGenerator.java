package org.chessmate.rules;

import org.chessmate.model.Board;
import org.chessmate.model.GameState;
import org.chessmate.model.Move;
import org.chessmate.model.Piece;
import org.chessmate.model.PieceColor;
import org.chessmate.model.PieceType;
import org.chessmate.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

public class OpponentMoveGenerator implements LegalityRule {
    private static final Logger logger = LoggerFactory.getLogger(OpponentMoveGenerator.class);

    private final Random random;
    private final PromotionPolicy promotionPolicy;
    private final MoveExecutor executor;

    public OpponentMoveGenerator(Random random, PromotionPolicy promotionPolicy, MoveExecutor executor) {
        this.random = Objects.requireNonNull(random, "random");
        this.promotionPolicy = Objects.requireNonNull(promotionPolicy, "promotionPolicy");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public List<Move> legalMoves(GameState state) {
        List<Move> moves = new ArrayList<>();
        PieceColor color = state.getTurn();
        Board board = state.getBoard();
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                if (PieceColor.ofValue(board.get(row, col)) != color) continue;
                Position from = new Position(row, col);
                for (int toRow = 0; toRow < Board.SIZE; toRow++) {
                    for (int toCol = 0; toCol < Board.SIZE; toCol++) {
                        Move move = candidate(state, from, new Position(toRow, toCol));
                        if (move != null) {
                            moves.add(move);
                        }
                    }
                }
            }
        }
        return moves;
    }

    @Override
    public boolean isLegal(GameState state, Position from, Position to) {
        return from.isValid() && to.isValid() && candidate(state, from, to) != null;
    }

    public Optional<Move> chooseMove(GameState state) {
        List<Move> moves = legalMoves(state);
        logger.debug("{} legal moves for {}", moves.size(), state.getTurn());
        if (moves.isEmpty()) {
            return Optional.empty();
        }
        Move pick = moves.get(random.nextInt(moves.size()));
        if (pick.piece().type() == PieceType.PAWN && pick.to().row() == pick.piece().color().farRow()) {
            pick = pick.withPromotion(promotionPolicy.choose(random));
        }
        return Optional.of(pick);
    }

    public Optional<Move> play(GameState state) {
        Optional<Move> move = chooseMove(state);
        if (move.isPresent()) {
            executor.execute(state, move.get());
            logger.info("Opponent played {}", move.get());
        } else {
            logger.info("No legal moves available for {}", state.getTurn());
        }
        return move;
    }

    // No directives: an enemy occupant is a capture, an empty square a quiet move.
    private Move candidate(GameState state, Position from, Position to) {
        Board board = state.getBoard();
        Piece piece = board.getPiece(from);
        if (piece == null || piece.color() != state.getTurn() || from.equals(to)) {
            return null;
        }
        Piece occupant = board.getPiece(to);
        if (occupant != null && occupant.color() == piece.color()) {
            return null;
        }

        boolean reachable = switch (piece.type()) {
            case PAWN -> pawnReaches(board, piece, from, to, occupant);
            case KNIGHT, KING -> MoveShape.fits(piece.type(), from, to);
            case BISHOP, ROOK, QUEEN -> MoveShape.fits(piece.type(), from, to) && PathChecker.isLineClear(board, from, to);
        };
        if (!reachable) {
            return null;
        }

        Move move = new Move(from, to, piece, occupant);
        return SelfCheckGuard.exposesKing(state, move) ? null : move;
    }

    private boolean pawnReaches(Board board, Piece pawn, Position from, Position to, Piece occupant) {
        PieceColor color = pawn.color();
        int direction = color.pawnDirection();
        int rowDelta = to.row() - from.row();
        int colDelta = to.col() - from.col();

        if (colDelta == 0 && rowDelta == direction) {
            return occupant == null;
        }
        if (colDelta == 0 && rowDelta == 2 * direction && from.row() == color.pawnStartRow()) {
            return occupant == null && PathChecker.isLineClear(board, from, to);
        }
        if (Math.abs(colDelta) == 1 && rowDelta == direction) {
            return occupant != null;
        }
        return false;
    }
}
