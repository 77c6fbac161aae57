package org.chessmate.settings;

import lombok.Data;

@Data
public class AppSettings {
    private GameSettings game = new GameSettings();
    private MqttSettings mqtt = new MqttSettings();
}
