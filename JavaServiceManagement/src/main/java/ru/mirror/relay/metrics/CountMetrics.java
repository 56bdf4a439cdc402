package ru.mirror.relay.metrics;

import org.springframework.boot.actuate.info.Info;
import org.springframework.boot.actuate.info.InfoContributor;

import java.util.function.LongSupplier;

/**
 * One row count published under one key of {@code /actuator/info}.
 */
abstract class CountMetrics implements InfoContributor {
    private final String detail;
    private final LongSupplier count;

    protected CountMetrics(String detail, LongSupplier count) {
        this.detail = detail;
        this.count = count;
    }

    @Override
    public void contribute(Info.Builder builder) {
        builder.withDetail(detail, count.getAsLong());
    }
}
