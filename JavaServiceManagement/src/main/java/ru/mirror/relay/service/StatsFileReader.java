package ru.mirror.relay.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import ru.mirror.relay.model.RelayStats;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@Service
public class StatsFileReader {
    static final String UNKNOWN = "unknown";
    static final String ERROR = "error";

    private final Path statsFile;
    private final ObjectMapper objectMapper;

    public StatsFileReader(@Value("${relay.stats-file}") String statsFile, ObjectMapper objectMapper) {
        this.statsFile = Path.of(statsFile);
        this.objectMapper = objectMapper;
    }

    public RelayStats read() {
        if (!Files.isRegularFile(statsFile)) {
            return new RelayStats(0, UNKNOWN);
        }
        try {
            RelayStats stats = objectMapper.readValue(statsFile.toFile(), RelayStats.class);
            if (stats == null || stats.getStatus() == null) {
                return new RelayStats(0, ERROR);
            }
            return stats;
        } catch (IOException e) {
            log.warn("NOT_CORRECT_STATS_FILE {}: {}", statsFile, e.getMessage());
            return new RelayStats(0, ERROR);
        }
    }
}
