package ru.mirror.relay.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.mirror.relay.model.ServiceStatus;
import ru.mirror.relay.model.Stats;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StatsRecorderTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void testMissingFileStartsFromZero() {
        StatsRecorder statsRecorder = new StatsRecorder(tempDir.resolve("stats.json"), objectMapper);

        Stats stats = statsRecorder.snapshot();
        assertEquals(0, stats.getMessages());
        assertEquals(ServiceStatus.STARTING, stats.getStatus());
    }

    @Test
    void testCounterSurvivesRestart() throws IOException {
        Path statsFile = tempDir.resolve("nested").resolve("stats.json");
        StatsRecorder statsRecorder = new StatsRecorder(statsFile, objectMapper);
        statsRecorder.markRunning();
        statsRecorder.increment();
        statsRecorder.increment();
        statsRecorder.markStopped();

        Stats onDisk = objectMapper.readValue(statsFile.toFile(), Stats.class);
        assertEquals(2, onDisk.getMessages());
        assertEquals(ServiceStatus.STOPPED, onDisk.getStatus());
        assertTrue(Files.readString(statsFile).contains("\"status\":\"stopped\""));
        assertFalse(Files.exists(statsFile.resolveSibling("stats.json.tmp")));

        StatsRecorder restarted = new StatsRecorder(statsFile, objectMapper);
        restarted.markRunning();
        restarted.increment();
        assertEquals(3, restarted.snapshot().getMessages());
        assertEquals(ServiceStatus.RUNNING, restarted.snapshot().getStatus());
    }

    /**
     * Поврежденный файл не роняет сервис, счетчик начинается заново
     */
    @Test
    void testMalformedFileResetsCounter() throws IOException {
        Path statsFile = tempDir.resolve("stats.json");
        Files.writeString(statsFile, "{\"messages\": 12, \"status\": ");

        StatsRecorder statsRecorder = new StatsRecorder(statsFile, objectMapper);

        assertEquals(0, statsRecorder.snapshot().getMessages());
        assertEquals(ServiceStatus.RESET, statsRecorder.snapshot().getStatus());
    }

    @Test
    void testConcurrentIncrementsAreNotLost() throws Exception {
        Path statsFile = tempDir.resolve("stats.json");
        StatsRecorder statsRecorder = new StatsRecorder(statsFile, objectMapper);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 40; i++) {
            executor.submit(statsRecorder::increment);
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(40, statsRecorder.snapshot().getMessages());
        assertEquals(40, objectMapper.readValue(statsFile.toFile(), Stats.class).getMessages());
    }
}
