package ru.mirror.relay.impl;

import com.typesafe.config.ConfigException;
import lombok.extern.slf4j.Slf4j;
import org.jooq.exception.DataAccessException;
import ru.mirror.relay.ConfigReader;
import ru.mirror.relay.StateStore;
import ru.mirror.relay.impl.settings.RetentionSettings;
import ru.mirror.relay.model.SweepResult;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Once a day, at the configured local time, deletes processed rows older than the
 * retention window and clears the duplicate code cache. Settings are re-read every cycle.
 */
@Slf4j
public class RetentionScheduler implements Runnable {
    enum Phase { WAIT, SWEEP }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final ConfigReader configReader;
    private final StateStore stateStore;
    private final Clock clock;
    private final Sleeper sleeper;
    private final AtomicBoolean isExit;

    public RetentionScheduler(ConfigReader configReader, StateStore stateStore, Clock clock,
                              Sleeper sleeper, AtomicBoolean isExit) {
        this.configReader = configReader;
        this.stateStore = stateStore;
        this.clock = clock;
        this.sleeper = sleeper;
        this.isExit = isExit;
    }

    public RetentionScheduler(ConfigReader configReader, StateStore stateStore, AtomicBoolean isExit) {
        this(configReader, stateStore, Clock.systemDefaultZone(), RetentionScheduler::sleepUntilDeadline, isExit);
    }

    @Override
    public void run() {
        Phase phase = Phase.WAIT;
        log.info("RETENTION_SCHEDULER_STARTED");
        try {
            while (!isExit.get()) {
                switch (phase) {
                    case WAIT -> {
                        Duration wait = untilNextRun(currentSettings());
                        log.debug("RETENTION_WAIT {}s", wait.toSeconds());
                        sleeper.sleep(wait);
                        phase = Phase.SWEEP;
                    }
                    case SWEEP -> {
                        if (!isExit.get()) {
                            sweep();
                        }
                        phase = Phase.WAIT;
                    }
                }
            }
        } catch (InterruptedException e) {
            log.info("RETENTION_SCHEDULER_INTERRUPTED");
            Thread.currentThread().interrupt();
        }
        log.info("RETENTION_SCHEDULER_STOPPED");
    }

    public SweepResult sweep() {
        RetentionSettings settings = currentSettings();
        int processedRemoved = -1;
        int codesRemoved = -1;
        try {
            if (settings.isSweepEnabled()) {
                LocalDateTime cutoff = LocalDateTime.now(clock.withZone(ZoneOffset.UTC))
                        .minusDays(settings.getDays());
                processedRemoved = stateStore.purgeProcessedBefore(cutoff);
                log.info("Cleanup removed {} rows older than {} days", processedRemoved, settings.getDays());
            } else {
                log.info("Cleanup of processed rows disabled, retention days {}", settings.getDays());
            }
            if (settings.isSweepEnabled() || settings.isClearCodesWhenDisabled()) {
                codesRemoved = stateStore.clearCodes();
                log.info("Code cache cleanup removed {} rows", codesRemoved);
            }
        } catch (DataAccessException e) {
            log.error("Cleanup failed, retrying next cycle: {}", e.getMessage());
        }
        return new SweepResult(processedRemoved, codesRemoved);
    }

    Duration untilNextRun(RetentionSettings settings) {
        return untilNextRun(ZonedDateTime.now(clock), settings);
    }

    static Duration untilNextRun(ZonedDateTime now, RetentionSettings settings) {
        ZonedDateTime runAt = now.with(settings.getRunAt()).withSecond(0).withNano(0);
        if (!runAt.isAfter(now)) {
            runAt = runAt.plusDays(1);
        }
        long seconds = Duration.between(now, runAt).getSeconds();
        return Duration.ofSeconds(Math.max(settings.getMinWaitSec(), seconds));
    }

    private RetentionSettings currentSettings() {
        try {
            return RetentionSettings.fromConfig(configReader.loadLiveConfig());
        } catch (ConfigException e) {
            log.error("NOT_CORRECT_RETENTION_CONFIG, using defaults: {}", e.getMessage());
            return RetentionSettings.builder()
                    .days(RetentionSettings.DEFAULT_DAYS)
                    .runAt(RetentionSettings.DEFAULT_TIME)
                    .clearCodesWhenDisabled(true)
                    .minWaitSec(60)
                    .build();
        }
    }

    static void sleepUntilDeadline(Duration duration) throws InterruptedException {
        long deadline = System.nanoTime() + duration.toNanos();
        long remaining = duration.toNanos();
        while (remaining > 0) {
            TimeUnit.NANOSECONDS.sleep(remaining);
            remaining = deadline - System.nanoTime();
        }
    }
}
