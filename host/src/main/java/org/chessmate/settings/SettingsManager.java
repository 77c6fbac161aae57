package org.chessmate.settings;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class SettingsManager {
    private static final Logger logger = LoggerFactory.getLogger(SettingsManager.class);
    private static final String SETTINGS_FILE = "settings.json";
    private static SettingsManager instance;
    private AppSettings settings;
    private final Gson gson;
    private final Path settingsPath;

    public SettingsManager(Path settingsPath) {
        logger.info("Initializing SettingsManager");
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        this.settingsPath = settingsPath;
        logger.debug("Settings path: {}", settingsPath);
        load();
    }

    public static synchronized SettingsManager getInstance() {
        if (instance == null) {
            instance = new SettingsManager(Paths.get(System.getProperty("user.home"), ".chessmate", SETTINGS_FILE));
        }
        return instance;
    }

    public AppSettings getSettings() {
        return settings;
    }

    public void load() {
        logger.debug("Loading settings from {}", settingsPath);
        try {
            if (Files.exists(settingsPath)) {
                String json = Files.readString(settingsPath);
                settings = gson.fromJson(json, AppSettings.class);
                if (settings == null) {
                    logger.warn("Settings file exists but is empty, using defaults");
                    settings = new AppSettings();
                }
                logger.info("Settings loaded successfully");
            } else {
                logger.info("Settings file not found, creating with defaults");
                settings = new AppSettings();
                save();
            }
        } catch (IOException | JsonParseException e) {
            logger.error("Failed to load settings", e);
            settings = new AppSettings();
        }
        ensureNonNullSections();
    }

    public void save() {
        logger.debug("Saving settings to {}", settingsPath);
        try {
            Path parent = settingsPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String json = gson.toJson(settings);
            Files.writeString(settingsPath, json);
            logger.info("Settings saved successfully");
        } catch (IOException e) {
            logger.error("Failed to save settings", e);
        }
    }

    public void reset() {
        logger.info("Resetting settings to defaults");
        settings = new AppSettings();
        save();
    }

    private void ensureNonNullSections() {
        if (settings.getGame() == null) {
            settings.setGame(new GameSettings());
        }
        if (settings.getMqtt() == null) {
            settings.setMqtt(new MqttSettings());
        }
    }
}
