package org.chessmate;

import org.chessmate.command.CommandDispatcher;
import org.chessmate.game.ChessGame;
import org.chessmate.model.PieceColor;
import org.chessmate.mqtt.GameMqttBridge;
import org.chessmate.mqtt.GameMqttClient;
import org.chessmate.mqtt.MqttBrokerService;
import org.chessmate.settings.AppSettings;
import org.chessmate.settings.GameSettings;
import org.chessmate.settings.MqttSettings;
import org.chessmate.settings.SettingsManager;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        logger.info("Chessmate host starting...");
        AppSettings settings = SettingsManager.getInstance().getSettings();
        ChessGame game = ChessGame.fromSettings(settings.getGame());
        CommandDispatcher dispatcher = new CommandDispatcher(game, defaultColor(settings.getGame()));

        MqttSettings mqtt = settings.getMqtt();
        MqttBrokerService brokerService = new MqttBrokerService();
        logger.info("Command broker: {}", brokerService.applySettings(mqtt));
        GameMqttBridge bridge = startBridge(dispatcher, mqtt);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown requested, stopping services");
            if (bridge != null) {
                bridge.stop();
            }
            brokerService.shutdown();
        }, "chessmate-shutdown"));

        try {
            runConsole(dispatcher, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
        } catch (IOException e) {
            logger.error("Console input failed", e);
        }
        logger.info("Chessmate host stopped");
    }

    static void runConsole(CommandDispatcher dispatcher, BufferedReader in, PrintStream out) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (line.isBlank()) continue;
            if ("quit".equalsIgnoreCase(line.strip())) break;
            out.print(dispatcher.dispatch(line));
            out.flush();
        }
    }

    private static PieceColor defaultColor(GameSettings settings) {
        String letter = settings.getDefaultPlayerColor();
        PieceColor color = letter == null || letter.length() != 1 ? null : PieceColor.fromLetter(letter.charAt(0));
        if (color == null) {
            logger.warn("Invalid default player color '{}', using W", letter);
            return PieceColor.WHITE;
        }
        return color;
    }

    private static GameMqttBridge startBridge(CommandDispatcher dispatcher, MqttSettings mqtt) {
        if (!mqtt.isClientEnabled()) {
            return null;
        }
        GameMqttBridge bridge = new GameMqttBridge(dispatcher, new GameMqttClient(mqtt));
        try {
            bridge.start();
            return bridge;
        } catch (MqttException e) {
            logger.error("Failed to start MQTT command bridge, continuing with console only", e);
            return null;
        }
    }
}
