package ru.mirror.relay.metrics;

import org.springframework.stereotype.Component;
import ru.mirror.relay.repository.UrlFilterRepository;

@Component
public class FilterMetrics extends CountMetrics {
    static final String COUNT_FILTERS = "countFilters";

    public FilterMetrics(UrlFilterRepository urlFilterRepository) {
        super(COUNT_FILTERS, urlFilterRepository::count);
    }
}
