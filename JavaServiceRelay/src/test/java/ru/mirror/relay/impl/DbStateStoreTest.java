package ru.mirror.relay.impl;

import lombok.extern.slf4j.Slf4j;
import org.h2.jdbcx.JdbcDataSource;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.mirror.relay.model.FilterRule;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.table;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class DbStateStoreTest {
    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    private JdbcDataSource dataSource;
    private DbStateStore stateStore;

    @BeforeEach
    void setUp() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        stateStore = storeAt(NOW);
        stateStore.init();
    }

    /**
     * Повторная инициализация схемы не должна падать и не должна терять данные
     */
    @Test
    void testInitIsIdempotent() {
        stateStore.markProcessed("-100", 1L);
        stateStore.init();
        assertTrue(stateStore.isProcessed("-100", 1L));
    }

    @Test
    void testMarkProcessedInsertsOnlyOnce() {
        assertFalse(stateStore.isProcessed("-100", 42L));

        assertTrue(stateStore.markProcessed("-100", 42L));
        assertFalse(stateStore.markProcessed("-100", 42L));

        assertTrue(stateStore.isProcessed("-100", 42L));
        assertFalse(stateStore.isProcessed("-200", 42L));
        assertFalse(stateStore.isProcessed("-100", 43L));
    }

    @Test
    void testCodesAreRecordedOnceAndFound() {
        assertEquals(Set.of(), stateStore.findExistingCodes(List.of("B0ABC12345")));

        stateStore.recordCodes(List.of("B0ABC12345", "XYZ987"));
        stateStore.recordCodes(List.of("B0ABC12345"));

        assertEquals(Set.of("B0ABC12345"), stateStore.findExistingCodes(List.of("B0ABC12345", "NOPE00")));
        assertEquals(Set.of(), stateStore.findExistingCodes(List.of()));
        assertEquals(2, DSL.using(dataSource, SQLDialect.H2).fetchCount(table("duplicate_codes")));
    }

    /**
     * Удаляются только строки строго старше границы
     */
    @Test
    void testPurgeProcessedBeforeKeepsBoundaryRows() {
        storeAt(NOW.minusSeconds(31L * 24 * 3600)).markProcessed("-100", 1L);
        storeAt(NOW.minusSeconds(30L * 24 * 3600)).markProcessed("-100", 2L);
        storeAt(NOW.minusSeconds(29L * 24 * 3600)).markProcessed("-100", 3L);

        LocalDateTime cutoff = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).minusDays(30);
        int removed = stateStore.purgeProcessedBefore(cutoff);

        assertEquals(1, removed);
        assertFalse(stateStore.isProcessed("-100", 1L));
        assertTrue(stateStore.isProcessed("-100", 2L));
        assertTrue(stateStore.isProcessed("-100", 3L));
    }

    @Test
    void testClearCodes() {
        stateStore.recordCodes(List.of("AAAAAA", "BBBBBB", "CCCCCC"));

        assertEquals(3, stateStore.clearCodes());
        assertEquals(0, stateStore.clearCodes());
        assertTrue(stateStore.findExistingCodes(List.of("AAAAAA")).isEmpty());
    }

    @Test
    void testListFiltersOrderedBySortOrderThenId() {
        var context = DSL.using(dataSource, SQLDialect.H2);
        context.insertInto(table("url_filters"), field("pattern"), field("replacement"), field("sort_order"))
                .values("second", "2", 2)
                .values("first", "1", 1)
                .values("second-too", "22", 2)
                .execute();
        context.insertInto(table("url_filters"), field("pattern"), field("sort_order"))
                .values("no-replacement", 3)
                .execute();

        List<FilterRule> filters = stateStore.listFilters();
        log.info("Filters: {}", filters);

        assertEquals(List.of("first", "second", "second-too", "no-replacement"),
                filters.stream().map(FilterRule::getPattern).toList());
        assertEquals("", filters.get(3).getReplacement());
        assertTrue(filters.get(1).getId() < filters.get(2).getId());
    }

    @Test
    void testListFiltersEmpty() {
        assertTrue(stateStore.listFilters().isEmpty());
    }

    private DbStateStore storeAt(Instant instant) {
        return new DbStateStore(dataSource, SQLDialect.H2, Clock.fixed(instant, ZoneOffset.UTC));
    }
}
