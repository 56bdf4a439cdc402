package ru.mirror.relay.impl;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.SQLDialect;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import ru.mirror.relay.StateStore;
import ru.mirror.relay.impl.settings.DBSettings;
import ru.mirror.relay.model.FilterRule;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.selectOne;
import static org.jooq.impl.DSL.table;

@Slf4j
public class DbStateStore implements StateStore {
    private static final String SCHEMA_RESOURCE = "db/schema.sql";

    private static final Table<Record> PROCESSED = table("processed");
    private static final Field<String> SOURCE_ID = field("source_id", SQLDataType.VARCHAR);
    private static final Field<Long> MESSAGE_ID = field("message_id", SQLDataType.BIGINT);
    private static final Field<LocalDateTime> CREATED_AT = field("created_at", SQLDataType.LOCALDATETIME);

    private static final Table<Record> CODES = table("duplicate_codes");
    private static final Field<String> CODE = field("code", SQLDataType.VARCHAR);

    private static final Table<Record> FILTERS = table("url_filters");
    private static final Field<Long> FILTER_ID = field("id", SQLDataType.BIGINT);
    private static final Field<String> PATTERN = field("pattern", SQLDataType.VARCHAR);
    private static final Field<String> REPLACEMENT = field("replacement", SQLDataType.VARCHAR);
    private static final Field<Integer> SORT_ORDER = field("sort_order", SQLDataType.INTEGER);

    private final DSLContext context;
    private final Clock clock;
    private final ReentrantLock dbMutex = new ReentrantLock();

    public DbStateStore(DataSource dataSource, SQLDialect dialect, Clock clock) {
        this.context = DSL.using(dataSource, dialect);
        this.clock = clock;
    }

    public static HikariDataSource createDataSource(DBSettings dbSettings) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(dbSettings.getJdbcUrl());
        hikariConfig.setUsername(dbSettings.getUser());
        hikariConfig.setPassword(dbSettings.getPassword());
        hikariConfig.setDriverClassName(dbSettings.getDriver());
        hikariConfig.setMaximumPoolSize(dbSettings.getMaximumPoolSize());
        hikariConfig.setPoolName("relay-state");
        log.debug("HIKARI_CONFIG_MADE {}", dbSettings);
        return new HikariDataSource(hikariConfig);
    }

    @Override
    public void init() {
        String script = readSchemaScript();
        locked(() -> {
            context.transaction(configuration -> {
                DSLContext tx = DSL.using(configuration);
                for (String statement : script.split(";")) {
                    if (!statement.isBlank()) {
                        tx.execute(statement.trim());
                    }
                }
            });
            return null;
        });
        log.info("STATE_STORE_SCHEMA_READY");
    }

    @Override
    public boolean isProcessed(String sourceId, long messageId) {
        return locked(() -> context.fetchExists(
                selectOne().from(PROCESSED).where(SOURCE_ID.eq(sourceId)).and(MESSAGE_ID.eq(messageId))));
    }

    @Override
    public boolean markProcessed(String sourceId, long messageId) {
        LocalDateTime now = LocalDateTime.now(clock);
        boolean inserted = locked(() -> context.transactionResult(configuration -> {
            DSLContext tx = DSL.using(configuration);
            if (tx.fetchExists(selectOne().from(PROCESSED)
                    .where(SOURCE_ID.eq(sourceId)).and(MESSAGE_ID.eq(messageId)))) {
                return false;
            }
            tx.insertInto(PROCESSED, SOURCE_ID, MESSAGE_ID, CREATED_AT)
                    .values(sourceId, messageId, now)
                    .execute();
            return true;
        }));
        log.debug("MARK_PROCESSED {}:{} inserted={}", sourceId, messageId, inserted);
        return inserted;
    }

    @Override
    public Set<String> findExistingCodes(Collection<String> codes) {
        if (codes.isEmpty()) {
            return Set.of();
        }
        return locked(() -> context.select(CODE).from(CODES).where(CODE.in(codes)).fetchSet(CODE));
    }

    @Override
    public void recordCodes(Collection<String> codes) {
        if (codes.isEmpty()) {
            return;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        locked(() -> {
            context.transaction(configuration -> {
                DSLContext tx = DSL.using(configuration);
                Set<String> existing = tx.select(CODE).from(CODES).where(CODE.in(codes)).fetchSet(CODE);
                for (String code : new LinkedHashSet<>(codes)) {
                    if (!existing.contains(code)) {
                        tx.insertInto(CODES, CODE, CREATED_AT).values(code, now).execute();
                    }
                }
            });
            return null;
        });
    }

    @Override
    public int purgeProcessedBefore(LocalDateTime cutoff) {
        return locked(() -> context.deleteFrom(PROCESSED).where(CREATED_AT.lt(cutoff)).execute());
    }

    @Override
    public int clearCodes() {
        return locked(() -> context.deleteFrom(CODES).execute());
    }

    @Override
    public List<FilterRule> listFilters() {
        return locked(() -> context.select(FILTER_ID, PATTERN, REPLACEMENT, SORT_ORDER)
                .from(FILTERS)
                .orderBy(SORT_ORDER.asc(), FILTER_ID.asc())
                .fetch(record -> FilterRule.builder()
                        .id(record.get(FILTER_ID))
                        .pattern(record.get(PATTERN))
                        .replacement(record.get(REPLACEMENT) == null ? "" : record.get(REPLACEMENT))
                        .sortOrder(record.get(SORT_ORDER) == null ? 0 : record.get(SORT_ORDER))
                        .build()));
    }

    private <T> T locked(Supplier<T> operation) {
        dbMutex.lock();
        try {
            return operation.get();
        } finally {
            dbMutex.unlock();
        }
    }

    private static String readSchemaScript() {
        try (InputStream stream = DbStateStore.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (stream == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DataAccessException("Cannot read " + SCHEMA_RESOURCE, e);
        }
    }
}
