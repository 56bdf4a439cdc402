package ru.mirror.relay.repository;

import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import ru.mirror.relay.model.DuplicateCode;

@Repository
public interface DuplicateCodeRepository extends CrudRepository<DuplicateCode, String> {

    @Modifying
    @Query("delete from DuplicateCode")
    int deleteAllRows();
}
