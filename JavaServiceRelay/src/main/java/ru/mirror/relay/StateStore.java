package ru.mirror.relay;

import ru.mirror.relay.model.FilterRule;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Durable state shared by the pipeline, the retention scheduler and the management service.
 * Every operation is one exclusion unit; failures surface as jOOQ {@code DataAccessException}.
 */
public interface StateStore {
    void init();

    boolean isProcessed(String sourceId, long messageId);

    /**
     * @return true when the row was inserted by this call, false when it already existed
     */
    boolean markProcessed(String sourceId, long messageId);

    Set<String> findExistingCodes(Collection<String> codes);

    void recordCodes(Collection<String> codes);

    int purgeProcessedBefore(LocalDateTime cutoff);

    int clearCodes();

    List<FilterRule> listFilters();
}
