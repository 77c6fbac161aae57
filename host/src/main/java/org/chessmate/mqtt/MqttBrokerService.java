package org.chessmate.mqtt;

import io.moquette.broker.Server;
import io.moquette.broker.config.MemoryConfig;
import io.moquette.broker.security.IAuthenticator;
import io.moquette.broker.security.PermitAllAuthorizatorPolicy;
import io.moquette.interception.InterceptHandler;
import org.chessmate.settings.MqttSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

// Embedded broker that lets a board controller reach the command topic without external infrastructure.
public class MqttBrokerService {
    private static final Logger logger = LoggerFactory.getLogger(MqttBrokerService.class);

    public enum BrokerChange {
        STARTED,
        RESTARTED,
        STOPPED,
        NO_CHANGE
    }

    // Only these fields matter to the broker; client-side settings never force a restart.
    private record BrokerConfig(String host, int port, boolean persistence, boolean allowAnonymous,
                                String username, String password) {
        static BrokerConfig of(MqttSettings settings) {
            return new BrokerConfig(settings.getHost(), settings.getPort(), settings.isPersistenceEnabled(),
                    settings.isAllowAnonymous(), settings.getUsername(), settings.getPassword());
        }
    }

    private final Path dataDir;
    private Server server;
    private BrokerConfig active;

    public MqttBrokerService() {
        this(Paths.get(System.getProperty("user.home"), ".chessmate", "mqtt"));
    }

    public MqttBrokerService(Path dataDir) {
        this.dataDir = dataDir;
    }

    public synchronized BrokerChange applySettings(MqttSettings settings) {
        if (settings == null || !settings.isBrokerEnabled()) {
            if (server == null) {
                return BrokerChange.NO_CHANGE;
            }
            logger.info("Command broker disabled by settings");
            stopServer();
            return BrokerChange.STOPPED;
        }

        BrokerConfig wanted = BrokerConfig.of(settings);
        if (wanted.equals(active)) {
            return BrokerChange.NO_CHANGE;
        }
        boolean restart = server != null;
        if (restart) {
            stopServer();
        }
        startServer(settings, wanted);
        return restart ? BrokerChange.RESTARTED : BrokerChange.STARTED;
    }

    public synchronized boolean isRunning() {
        return server != null;
    }

    public synchronized void shutdown() {
        stopServer();
    }

    private void startServer(MqttSettings settings, BrokerConfig config) {
        logger.info("Starting command broker on {}:{}", config.host(), config.port());
        Server candidate = new Server();
        try {
            IAuthenticator authenticator = config.allowAnonymous() ? null : buildAuthenticator(settings);
            List<InterceptHandler> handlers = Collections.emptyList();
            candidate.startServer(new MemoryConfig(buildProperties(settings, dataDir)), handlers, null,
                    authenticator, new PermitAllAuthorizatorPolicy());
        } catch (IOException | RuntimeException e) {
            logger.error("Command broker failed to start", e);
            throw new IllegalStateException("Failed to start MQTT broker on port " + config.port(), e);
        }
        server = candidate;
        active = config;
    }

    private void stopServer() {
        if (server == null) {
            return;
        }
        try {
            server.stopServer();
            logger.info("Command broker stopped");
        } catch (RuntimeException e) {
            logger.warn("Command broker did not stop cleanly", e);
        }
        server = null;
        active = null;
    }

    Properties buildProperties(MqttSettings settings, Path brokerDir) throws IOException {
        Properties props = new Properties();
        props.setProperty("host", settings.getHost());
        props.setProperty("port", Integer.toString(settings.getPort()));
        props.setProperty("allow_anonymous", Boolean.toString(settings.isAllowAnonymous()));
        props.setProperty("persistence_enabled", Boolean.toString(settings.isPersistenceEnabled()));
        if (settings.isPersistenceEnabled()) {
            Files.createDirectories(brokerDir);
            props.setProperty("data_path", brokerDir.toString().replace("\\", "/"));
        }
        return props;
    }

    IAuthenticator buildAuthenticator(MqttSettings settings) {
        String user = settings.getUsername();
        if (user == null || user.isBlank()) {
            throw new IllegalArgumentException("Username must be provided when anonymous access is disabled.");
        }
        String secret = settings.getPassword() == null ? "" : settings.getPassword();
        return (clientId, username, password) -> user.equals(username)
                && secret.equals(password == null ? "" : new String(password, StandardCharsets.UTF_8));
    }
}
