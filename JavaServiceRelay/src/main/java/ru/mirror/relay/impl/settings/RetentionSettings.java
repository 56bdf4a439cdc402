package ru.mirror.relay.impl.settings;

import com.typesafe.config.Config;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

@Slf4j
@Getter
@Builder
@ToString
public class RetentionSettings {
    public static final int DEFAULT_DAYS = 30;
    public static final LocalTime DEFAULT_TIME = LocalTime.of(0, 5);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm")
            .withResolverStyle(ResolverStyle.STRICT);

    private int days;
    private LocalTime runAt;
    private boolean clearCodesWhenDisabled;
    private long minWaitSec;

    public boolean isSweepEnabled() {
        return days > 0;
    }

    public static RetentionSettings fromConfig(Config config) {
        Config retention = config.getConfig("relay.retention");
        return RetentionSettings.builder()
                .days(parseDays(retention.hasPath("days") ? retention.getValue("days").unwrapped() : null))
                .runAt(parseTime(retention.hasPath("time") ? retention.getString("time") : null))
                .clearCodesWhenDisabled(!retention.hasPath("clearCodesWhenDisabled") || retention.getBoolean("clearCodesWhenDisabled"))
                .minWaitSec(retention.hasPath("minWaitSec") ? retention.getLong("minWaitSec") : 60L)
                .build();
    }

    static int parseDays(Object value) {
        if (value == null) {
            return DEFAULT_DAYS;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            log.warn("NOT_CORRECT_RETENTION_DAYS {}, using {}", value, DEFAULT_DAYS);
            return DEFAULT_DAYS;
        }
    }

    static LocalTime parseTime(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_TIME;
        }
        try {
            return LocalTime.parse(value.trim(), TIME_FORMAT);
        } catch (DateTimeParseException e) {
            log.warn("NOT_CORRECT_RETENTION_TIME {}, using {}", value, DEFAULT_TIME);
            return DEFAULT_TIME;
        }
    }
}
