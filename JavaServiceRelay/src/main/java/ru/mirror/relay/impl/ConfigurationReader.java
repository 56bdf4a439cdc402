package ru.mirror.relay.impl;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import lombok.extern.slf4j.Slf4j;
import ru.mirror.relay.ConfigReader;

import java.io.File;

@Slf4j
public class ConfigurationReader implements ConfigReader {
    private final Config baseConfig;
    private Config liveConfig;
    private long liveModifiedAt = Long.MIN_VALUE;
    private long liveLength = -1;

    public ConfigurationReader() {
        this(ConfigFactory.load());
    }

    public ConfigurationReader(Config baseConfig) {
        this.baseConfig = baseConfig;
        this.liveConfig = baseConfig;
    }

    @Override
    public Config loadConfig() {
        return baseConfig;
    }

    @Override
    public synchronized Config loadLiveConfig() {
        if (!baseConfig.hasPath("relay.settingsFile")) {
            return baseConfig;
        }
        File settingsFile = new File(baseConfig.getString("relay.settingsFile"));
        if (!settingsFile.isFile()) {
            if (liveModifiedAt != Long.MIN_VALUE) {
                log.info("SETTINGS_FILE_REMOVED {}", settingsFile);
                liveConfig = baseConfig;
                liveModifiedAt = Long.MIN_VALUE;
            }
            return liveConfig;
        }
        long modifiedAt = settingsFile.lastModified();
        long length = settingsFile.length();
        if (modifiedAt != liveModifiedAt || length != liveLength) {
            try {
                liveConfig = ConfigFactory.parseFile(settingsFile).withFallback(baseConfig).resolve();
                log.info("SETTINGS_FILE_LOADED {}", settingsFile);
            } catch (ConfigException e) {
                log.error("NOT_CORRECT_SETTINGS_FILE {}, keeping previous settings", settingsFile, e);
            }
            liveModifiedAt = modifiedAt;
            liveLength = length;
        }
        return liveConfig;
    }
}
