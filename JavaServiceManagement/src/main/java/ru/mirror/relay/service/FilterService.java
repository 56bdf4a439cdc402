package ru.mirror.relay.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;
import ru.mirror.relay.model.UrlFilter;
import ru.mirror.relay.repository.UrlFilterRepository;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Changes to the filter list. Each change runs under one lock and inside one transaction.
 */
@Slf4j
@Service
public class FilterService {
    private final UrlFilterRepository urlFilterRepository;
    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock filterLock = new ReentrantLock();

    public FilterService(UrlFilterRepository urlFilterRepository, PlatformTransactionManager transactionManager) {
        this.urlFilterRepository = urlFilterRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public List<UrlFilter> findAll() {
        return urlFilterRepository.findAllByOrderBySortOrderAscIdAsc();
    }

    public UrlFilter add(UrlFilter filter) {
        return locked(() -> {
            filter.setId(null);
            filter.setSortOrder(urlFilterRepository.findMaxSortOrder() + 1);
            UrlFilter saved = urlFilterRepository.save(filter);
            log.info("FILTER_ADDED {} '{}' -> '{}'", saved.getId(), saved.getPattern(), saved.getReplacement());
            return saved;
        });
    }

    public UrlFilter update(long id, UrlFilter changes) {
        return locked(() -> {
            UrlFilter filter = findOrThrow(id);
            filter.setPattern(changes.getPattern());
            filter.setReplacement(changes.getReplacement());
            log.info("FILTER_UPDATED {} '{}' -> '{}'", id, filter.getPattern(), filter.getReplacement());
            return urlFilterRepository.save(filter);
        });
    }

    public void delete(long id) {
        locked(() -> {
            urlFilterRepository.delete(findOrThrow(id));
            log.info("FILTER_DELETED {}", id);
            return null;
        });
    }

    public List<UrlFilter> moveUp(long id) {
        return move(id, -1);
    }

    public List<UrlFilter> moveDown(long id) {
        return move(id, 1);
    }

    private List<UrlFilter> move(long id, int direction) {
        return locked(() -> {
            findOrThrow(id);
            List<UrlFilter> ordered = urlFilterRepository.findAllByOrderBySortOrderAscIdAsc();
            int index = indexOf(ordered, id);
            int neighbor = index + direction;
            if (neighbor < 0 || neighbor >= ordered.size()) {
                return ordered;
            }
            UrlFilter current = ordered.get(index);
            UrlFilter other = ordered.get(neighbor);
            if (current.getSortOrder() == other.getSortOrder()) {
                // одинаковые порядки: сначала пронумеровать подряд, иначе обмен ничего не меняет
                for (int i = 0; i < ordered.size(); i++) {
                    ordered.get(i).setSortOrder(i + 1);
                }
            }
            int sortOrder = current.getSortOrder();
            current.setSortOrder(other.getSortOrder());
            other.setSortOrder(sortOrder);
            urlFilterRepository.saveAll(ordered);
            log.info("FILTER_MOVED {} {}", id, direction < 0 ? "up" : "down");
            return urlFilterRepository.findAllByOrderBySortOrderAscIdAsc();
        });
    }

    private UrlFilter findOrThrow(long id) {
        return urlFilterRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "FILTER_NOT_FOUND " + id));
    }

    private static int indexOf(List<UrlFilter> filters, long id) {
        for (int i = 0; i < filters.size(); i++) {
            if (filters.get(i).getId() == id) {
                return i;
            }
        }
        return -1;
    }

    private <T> T locked(Supplier<T> operation) {
        filterLock.lock();
        try {
            return transactionTemplate.execute(status -> operation.get());
        } finally {
            filterLock.unlock();
        }
    }
}
