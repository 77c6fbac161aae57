package org.chessmate.mqtt;

import com.google.gson.Gson;
import org.chessmate.settings.MqttSettings;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Consumer;

// Command channel of the host: receives command lines on one topic, publishes JSON replies on another.
public class GameMqttClient {
    private static final Logger logger = LoggerFactory.getLogger(GameMqttClient.class);
    private static final long TIMEOUT_MS = 10_000;
    private static final int QOS = 1;

    private final MqttSettings settings;
    private final Gson gson = new Gson();
    private volatile MqttAsyncClient client;
    private volatile Consumer<String> commandHandler;

    public GameMqttClient(MqttSettings settings) {
        this.settings = settings.copy();
    }

    public String getCommandTopic() {
        return settings.getCommandTopic();
    }

    public String getReplyTopic() {
        return settings.getReplyTopic();
    }

    public synchronized void connect(Consumer<String> onCommand) throws MqttException {
        commandHandler = Objects.requireNonNull(onCommand, "onCommand");
        logger.info("Connecting command channel to {}", settings.getBrokerUrl());
        client = new MqttAsyncClient(settings.getBrokerUrl(), settings.getClientId(), new MemoryPersistence());
        client.setCallback(new MqttCallbackExtended() {
            @Override
            public void connectComplete(boolean reconnect, String serverURI) {
                // A clean session loses the subscription, so every automatic reconnect renews it.
                if (reconnect) {
                    logger.info("Reconnected to {}, renewing command subscription", serverURI);
                    subscribeCommands();
                }
            }

            @Override
            public void connectionLost(Throwable cause) {
                logger.warn("Command channel lost, waiting for automatic reconnect", cause);
            }

            @Override
            public void messageArrived(String topic, MqttMessage message) {
                String payload = new String(message.getPayload(), StandardCharsets.UTF_8);
                logger.debug("Command received on {}: {}", topic, payload);
                commandHandler.accept(payload);
            }

            @Override
            public void deliveryComplete(IMqttDeliveryToken token) {
                // replies are fire-and-forget
            }
        });

        client.connect(connectOptions()).waitForCompletion(TIMEOUT_MS);
        client.subscribe(settings.getCommandTopic(), QOS).waitForCompletion(TIMEOUT_MS);
        logger.info("Command channel connected, listening on {}", settings.getCommandTopic());
    }

    public boolean isConnected() {
        MqttAsyncClient current = client;
        return current != null && current.isConnected();
    }

    public void publishReply(CommandReply reply) throws MqttException {
        MqttAsyncClient current = client;
        if (current == null || !current.isConnected()) {
            throw new MqttException(MqttException.REASON_CODE_CLIENT_NOT_CONNECTED);
        }
        String json = gson.toJson(reply);
        MqttMessage message = new MqttMessage(json.getBytes(StandardCharsets.UTF_8));
        message.setQos(QOS);
        logger.debug("Reply on {}: {}", settings.getReplyTopic(), json);
        current.publish(settings.getReplyTopic(), message);
    }

    public synchronized void disconnect() {
        if (client == null) {
            return;
        }
        try {
            if (client.isConnected()) {
                client.unsubscribe(settings.getCommandTopic()).waitForCompletion(TIMEOUT_MS);
                client.disconnect().waitForCompletion(TIMEOUT_MS);
            }
            client.close();
            logger.info("Command channel closed");
        } catch (MqttException e) {
            logger.error("Error closing command channel", e);
        }
        client = null;
    }

    private MqttConnectOptions connectOptions() {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(true);
        options.setConnectionTimeout(10);
        options.setKeepAliveInterval(60);
        String username = settings.getUsername();
        if (username != null && !username.isBlank()) {
            options.setUserName(username);
            String password = settings.getPassword();
            options.setPassword((password == null ? "" : password).toCharArray());
        }
        return options;
    }

    // Runs on Paho's callback thread, so it must not wait for the SUBACK.
    private void subscribeCommands() {
        try {
            client.subscribe(settings.getCommandTopic(), QOS);
        } catch (MqttException e) {
            logger.error("Failed to renew subscription to {}", settings.getCommandTopic(), e);
        }
    }
}
