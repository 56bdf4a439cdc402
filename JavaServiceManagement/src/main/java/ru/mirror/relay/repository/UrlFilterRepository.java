package ru.mirror.relay.repository;

import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import ru.mirror.relay.model.UrlFilter;

import java.util.List;

@Repository
public interface UrlFilterRepository extends CrudRepository<UrlFilter, Long> {
    List<UrlFilter> findAllByOrderBySortOrderAscIdAsc();

    @Query("select coalesce(max(f.sortOrder), 0) from UrlFilter f")
    int findMaxSortOrder();
}
