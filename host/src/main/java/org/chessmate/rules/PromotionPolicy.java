package org.chessmate.rules;

import org.chessmate.model.PieceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Random;

public enum PromotionPolicy {
    QUEEN,
    RANDOM;

    private static final Logger logger = LoggerFactory.getLogger(PromotionPolicy.class);
    private static final PieceType[] TARGETS = {
            PieceType.KNIGHT, PieceType.BISHOP, PieceType.ROOK, PieceType.QUEEN
    };

    public PieceType choose(Random random) {
        return switch (this) {
            case QUEEN -> PieceType.QUEEN;
            case RANDOM -> TARGETS[random.nextInt(TARGETS.length)];
        };
    }

    public static PromotionPolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            return QUEEN;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown opponent promotion '{}', using QUEEN", name);
            return QUEEN;
        }
    }
}
