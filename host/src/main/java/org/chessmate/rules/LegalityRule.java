package org.chessmate.rules;

import org.chessmate.model.GameState;
import org.chessmate.model.Position;

public interface LegalityRule {
    boolean isLegal(GameState state, Position from, Position to);
}
