package ru.mirror.relay.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import ru.mirror.relay.model.ServiceStatus;
import ru.mirror.relay.model.Stats;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Running message counter and service status, persisted as one JSON object that is
 * rewritten in full on every change. Guarded by its own lock, independent of the store.
 */
@Slf4j
public class StatsRecorder {
    private final Path statsFile;
    private final ObjectMapper objectMapper;
    private final ReentrantLock statsLock = new ReentrantLock();
    private final Stats stats;

    public StatsRecorder(Path statsFile, ObjectMapper objectMapper) {
        this.statsFile = statsFile;
        this.objectMapper = objectMapper;
        this.stats = load(statsFile, objectMapper);
    }

    static Stats load(Path statsFile, ObjectMapper objectMapper) {
        if (!Files.exists(statsFile)) {
            return new Stats(0, ServiceStatus.STARTING);
        }
        try {
            Stats loaded = objectMapper.readValue(statsFile.toFile(), Stats.class);
            if (loaded == null) {
                return new Stats(0, ServiceStatus.RESET);
            }
            return loaded;
        } catch (IOException e) {
            log.warn("NOT_CORRECT_STATS_FILE {}, counter reset: {}", statsFile, e.getMessage());
            return new Stats(0, ServiceStatus.RESET);
        }
    }

    public void markRunning() {
        setStatus(ServiceStatus.RUNNING);
    }

    public void markStopped() {
        setStatus(ServiceStatus.STOPPED);
    }

    public void increment() {
        statsLock.lock();
        try {
            stats.setMessages(stats.getMessages() + 1);
            persist();
        } finally {
            statsLock.unlock();
        }
    }

    public Stats snapshot() {
        statsLock.lock();
        try {
            return new Stats(stats.getMessages(), stats.getStatus());
        } finally {
            statsLock.unlock();
        }
    }

    private void setStatus(ServiceStatus status) {
        statsLock.lock();
        try {
            stats.setStatus(status);
            persist();
        } finally {
            statsLock.unlock();
        }
    }

    private void persist() {
        try {
            Path parent = statsFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = statsFile.resolveSibling(statsFile.getFileName() + ".tmp");
            byte[] json = objectMapper.writeValueAsBytes(stats);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                channel.write(ByteBuffer.wrap(json));
                channel.force(true);
            }
            try {
                Files.move(temp, statsFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, statsFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("STATS_WRITE_FAILED {}", statsFile, e);
        }
    }
}
