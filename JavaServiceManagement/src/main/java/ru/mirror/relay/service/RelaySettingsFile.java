package ru.mirror.relay.service;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;
import com.typesafe.config.ConfigValueFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import ru.mirror.relay.model.RelaySettings;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The live settings file shared with the relay, kept in HOCON. The relay re-reads it when it
 * changes, so every update rewrites the whole file through a temp file and a move.
 */
@Slf4j
@Service
public class RelaySettingsFile {
    static final String DAYS_PATH = "relay.retention.days";
    static final String TIME_PATH = "relay.retention.time";
    static final String REGEX_PATH = "relay.codes.regex";
    static final String SOURCES_PATH = "relay.sources";

    static final String DEFAULT_DAYS = "30";
    static final String DEFAULT_TIME = "00:05";
    static final String DEFAULT_REGEX = "\\b[A-Za-z0-9]{6,}\\b";

    private static final ConfigRenderOptions RENDER_OPTIONS = ConfigRenderOptions.defaults()
            .setOriginComments(false)
            .setComments(false)
            .setJson(false)
            .setFormatted(true);

    private final Path settingsFile;
    private final String defaultSources;

    public RelaySettingsFile(@Value("${relay.settings-file}") String settingsFile,
                             @Value("${relay.sources:}") String defaultSources) {
        this.settingsFile = Path.of(settingsFile);
        this.defaultSources = defaultSources;
    }

    public synchronized RelaySettings read() {
        Config config = load();
        return new RelaySettings(
                stringOrDefault(config, DAYS_PATH, DEFAULT_DAYS),
                stringOrDefault(config, TIME_PATH, DEFAULT_TIME),
                stringOrDefault(config, REGEX_PATH, DEFAULT_REGEX),
                sources(config));
    }

    public synchronized RelaySettings updateRetention(int days, String time) {
        write(load()
                .withValue(DAYS_PATH, ConfigValueFactory.fromAnyRef(days))
                .withValue(TIME_PATH, ConfigValueFactory.fromAnyRef(time)));
        log.info("RETENTION_SETTINGS_UPDATED days={} time={}", days, time);
        return read();
    }

    public synchronized RelaySettings updateCodeRegex(String regex) {
        Config config = load();
        if (regex == null || regex.isBlank()) {
            config = config.withoutPath(REGEX_PATH);
            log.info("CODE_REGEX_RESET");
        } else {
            config = config.withValue(REGEX_PATH, ConfigValueFactory.fromAnyRef(regex));
            log.info("CODE_REGEX_UPDATED '{}'", regex);
        }
        write(config);
        return read();
    }

    public synchronized List<String> sources() {
        return sources(load());
    }

    public synchronized void addSource(String sourceId) {
        Config config = load();
        List<String> sources = new ArrayList<>(sources(config));
        if (sources.contains(sourceId)) {
            return;
        }
        sources.add(sourceId);
        write(config.withValue(SOURCES_PATH, ConfigValueFactory.fromAnyRef(String.join(",", sources))));
        log.info("SOURCE_ADDED {}", sourceId);
    }

    private List<String> sources(Config config) {
        String value = config.hasPath(SOURCES_PATH) ? config.getString(SOURCES_PATH) : defaultSources;
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(source -> !source.isEmpty())
                .toList();
    }

    private Config load() {
        if (!Files.isRegularFile(settingsFile)) {
            return ConfigFactory.empty();
        }
        try {
            return ConfigFactory.parseFile(settingsFile.toFile());
        } catch (ConfigException e) {
            log.error("NOT_CORRECT_SETTINGS_FILE {}", settingsFile, e);
            throw new ResponseStatusException(HttpStatus.CONFLICT, "SETTINGS_FILE_MALFORMED", e);
        }
    }

    private void write(Config config) {
        try {
            Path parent = settingsFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = settingsFile.resolveSibling(settingsFile.getFileName() + ".tmp");
            Files.writeString(temp, config.root().render(RENDER_OPTIONS), StandardCharsets.UTF_8);
            try {
                Files.move(temp, settingsFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, settingsFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("SETTINGS_WRITE_FAILED {}", settingsFile, e);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "SETTINGS_WRITE_FAILED", e);
        }
    }

    private static String stringOrDefault(Config config, String path, String defaultValue) {
        if (!config.hasPath(path)) {
            return defaultValue;
        }
        return String.valueOf(config.getValue(path).unwrapped());
    }
}
