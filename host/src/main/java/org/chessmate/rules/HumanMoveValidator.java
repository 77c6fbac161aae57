package org.chessmate.rules;

import org.chessmate.model.Board;
import org.chessmate.model.Directive;
import org.chessmate.model.GameState;
import org.chessmate.model.Move;
import org.chessmate.model.MoveRequest;
import org.chessmate.model.Piece;
import org.chessmate.model.PieceColor;
import org.chessmate.model.PieceType;
import org.chessmate.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

public class HumanMoveValidator implements LegalityRule {
    private static final Logger logger = LoggerFactory.getLogger(HumanMoveValidator.class);

    private record Verdict(Move move, MoveRejection rejection) {
        static Verdict accept(Move move) {
            return new Verdict(move, null);
        }

        static Verdict reject(MoveRejection rejection) {
            return new Verdict(null, rejection);
        }

        boolean rejected() {
            return rejection != null;
        }
    }

    public Move validate(GameState state, MoveRequest request) {
        Verdict verdict = evaluate(state, request);
        if (verdict.rejected()) {
            logger.debug("Rejected {}: {}", request, verdict.rejection());
            throw new IllegalMoveException(verdict.rejection(), request.toString());
        }
        return verdict.move();
    }

    public Optional<MoveRejection> findViolation(GameState state, MoveRequest request) {
        return Optional.ofNullable(evaluate(state, request).rejection());
    }

    @Override
    public boolean isLegal(GameState state, Position from, Position to) {
        if (!from.isValid() || !to.isValid()) return false;
        Piece piece = state.getBoard().getPiece(from);
        if (piece == null) return false;
        return !evaluate(state, annotate(state.getBoard(), piece, from, to)).rejected();
    }

    // What a careful player would type: a capture naming the occupant, a queen promotion on the far row.
    MoveRequest annotate(Board board, Piece piece, Position from, Position to) {
        Piece occupant = board.getPiece(to);
        MoveRequest request = new MoveRequest(piece, from, to, null, null);
        if (occupant != null) {
            request = request.withPrimary(Directive.capture(occupant));
        }
        if (piece.type() == PieceType.PAWN && to.row() == piece.color().farRow()) {
            Directive promotion = Directive.promote(Piece.of(piece.color(), PieceType.QUEEN));
            request = occupant == null ? request.withPrimary(promotion) : request.withSecondary(promotion);
        }
        return request;
    }

    private Verdict evaluate(GameState state, MoveRequest request) {
        Board board = state.getBoard();
        Position from = request.from();
        Position to = request.to();
        if (!from.isValid() || !to.isValid() || from.equals(to)) {
            return Verdict.reject(MoveRejection.INVALID_SHAPE);
        }

        Piece piece = board.getPiece(from);
        if (!request.piece().equals(piece) || piece.color() != state.getTurn()) {
            return Verdict.reject(MoveRejection.PIECE_MISMATCH);
        }

        Verdict verdict = switch (piece.type()) {
            case PAWN -> pawn(board, piece, request);
            case KNIGHT, KING -> stepper(board, piece, request);
            case BISHOP, ROOK, QUEEN -> slider(board, piece, request);
        };
        if (verdict.rejected()) {
            return verdict;
        }

        if (SelfCheckGuard.exposesKing(state, verdict.move())) {
            return Verdict.reject(MoveRejection.SELF_CHECK);
        }
        return verdict;
    }

    private Verdict slider(Board board, Piece piece, MoveRequest request) {
        if (!MoveShape.fits(piece.type(), request.from(), request.to())) {
            return Verdict.reject(MoveRejection.INVALID_SHAPE);
        }
        PathStatus path = PathChecker.clearPath(board, request.from(), request.to(), request.primary());
        if (path == PathStatus.BLOCKED) {
            return Verdict.reject(MoveRejection.BLOCKED_PATH);
        }
        if (path == PathStatus.DESTINATION_OCCUPIED) {
            return Verdict.reject(MoveRejection.DIRECTIVE_MISMATCH);
        }
        return settleDestination(board, piece, request);
    }

    // Knight and king: no path, only the destination rule.
    private Verdict stepper(Board board, Piece piece, MoveRequest request) {
        if (!MoveShape.fits(piece.type(), request.from(), request.to())) {
            return Verdict.reject(MoveRejection.INVALID_SHAPE);
        }
        return settleDestination(board, piece, request);
    }

    private Verdict settleDestination(Board board, Piece piece, MoveRequest request) {
        if (request.hasPromotion()) {
            return Verdict.reject(MoveRejection.DIRECTIVE_MISMATCH);
        }
        if (request.secondary() != null) {
            return Verdict.reject(MoveRejection.DIRECTIVE_MISMATCH);
        }
        Piece occupant = board.getPiece(request.to());
        if (request.capturePrimary()) {
            if (!isNamedOpponent(occupant, piece, request.primary())) {
                return Verdict.reject(MoveRejection.DIRECTIVE_MISMATCH);
            }
            return Verdict.accept(new Move(request.from(), request.to(), piece, occupant));
        }
        if (occupant != null) {
            return Verdict.reject(MoveRejection.DIRECTIVE_MISMATCH);
        }
        return Verdict.accept(new Move(request.from(), request.to(), piece, null));
    }

    private Verdict pawn(Board board, Piece pawn, MoveRequest request) {
        PieceColor color = pawn.color();
        Position from = request.from();
        Position to = request.to();
        int direction = color.pawnDirection();
        int rowDelta = to.row() - from.row();
        int colDelta = to.col() - from.col();
        boolean reachesFarRow = to.row() == color.farRow();

        if (colDelta == 0 && rowDelta == direction) {
            if (!board.isEmpty(to)) {
                return Verdict.reject(MoveRejection.BLOCKED_PATH);
            }
            Move push = new Move(from, to, pawn, null);
            if (reachesFarRow) {
                Directive promotion = pushPromotion(request);
                if (promotion == null) {
                    return Verdict.reject(MoveRejection.DIRECTIVE_MISMATCH);
                }
                return promote(push, color, promotion);
            }
            return request.hasDirective() ? Verdict.reject(MoveRejection.DIRECTIVE_MISMATCH) : Verdict.accept(push);
        }

        if (colDelta == 0 && rowDelta == 2 * direction && from.row() == color.pawnStartRow()) {
            if (!PathChecker.isLineClear(board, from, to) || !board.isEmpty(to)) {
                return Verdict.reject(MoveRejection.BLOCKED_PATH);
            }
            if (request.hasDirective()) {
                return Verdict.reject(MoveRejection.DIRECTIVE_MISMATCH);
            }
            return Verdict.accept(new Move(from, to, pawn, null));
        }

        if (Math.abs(colDelta) == 1 && rowDelta == direction) {
            Piece occupant = board.getPiece(to);
            if (!request.capturePrimary() || !isNamedOpponent(occupant, pawn, request.primary())) {
                return Verdict.reject(MoveRejection.DIRECTIVE_MISMATCH);
            }
            Move capture = new Move(from, to, pawn, occupant);
            Directive secondary = request.secondary();
            if (reachesFarRow) {
                if (secondary == null || !secondary.isPromotion()) {
                    return Verdict.reject(MoveRejection.DIRECTIVE_MISMATCH);
                }
                return promote(capture, color, secondary);
            }
            return secondary != null ? Verdict.reject(MoveRejection.DIRECTIVE_MISMATCH) : Verdict.accept(capture);
        }

        return Verdict.reject(MoveRejection.INVALID_SHAPE);
    }

    // A push onto the far row carries its promotion in either slot, as long as it is the only token.
    private Directive pushPromotion(MoveRequest request) {
        Directive primary = request.primary();
        Directive secondary = request.secondary();
        if (primary != null && primary.isPromotion() && secondary == null) {
            return primary;
        }
        if (primary == null && secondary != null && secondary.isPromotion()) {
            return secondary;
        }
        return null;
    }

    private Verdict promote(Move move, PieceColor color, Directive directive) {
        Piece target = directive.piece();
        if (target.color() != color || target.type() == PieceType.PAWN || target.type() == PieceType.KING) {
            return Verdict.reject(MoveRejection.DIRECTIVE_MISMATCH);
        }
        return Verdict.accept(move.withPromotion(target.type()));
    }

    private boolean isNamedOpponent(Piece occupant, Piece mover, Directive capture) {
        return mover.isOpponentOf(occupant) && occupant.equals(capture.piece());
    }
}
