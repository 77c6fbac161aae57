package org.chessmate.settings;

import lombok.Data;

@Data
public class GameSettings {

    private String defaultPlayerColor = "W";

    private String opponentPromotion = "QUEEN";

    // 0 draws a fresh seed per run
    private long randomSeed = 0L;
}
