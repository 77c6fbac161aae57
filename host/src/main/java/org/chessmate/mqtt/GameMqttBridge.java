package org.chessmate.mqtt;

import org.chessmate.command.CommandDispatcher;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

// Each message on the command topic is one command line; its answer goes out as a CommandReply.
public class GameMqttBridge {
    private static final Logger logger = LoggerFactory.getLogger(GameMqttBridge.class);

    private final CommandDispatcher dispatcher;
    private final GameMqttClient client;
    private final ExecutorService executor;

    public GameMqttBridge(CommandDispatcher dispatcher, GameMqttClient client) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.client = Objects.requireNonNull(client, "client");
        // Paho must not block inside its callback thread, so replies are published from here.
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mqtt-command-thread");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() throws MqttException {
        client.connect(payload -> executor.execute(() -> onCommand(payload)));
        logger.info("Serving chess commands on {}, replying on {}", client.getCommandTopic(), client.getReplyTopic());
    }

    public void stop() {
        logger.info("Stopping MQTT command bridge");
        client.disconnect();
        executor.shutdownNow();
    }

    CommandReply handle(String payload) {
        String command = payload == null ? "" : payload.strip();
        return new CommandReply(command, dispatcher.dispatch(command));
    }

    void onCommand(String payload) {
        CommandReply reply;
        try {
            reply = handle(payload);
        } catch (RuntimeException e) {
            logger.error("Command '{}' failed, no reply sent", payload, e);
            return;
        }
        try {
            client.publishReply(reply);
        } catch (MqttException e) {
            logger.error("Failed to publish reply for '{}'", reply.command(), e);
        }
    }
}
