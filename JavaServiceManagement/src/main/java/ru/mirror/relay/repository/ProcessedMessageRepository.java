package ru.mirror.relay.repository;

import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import ru.mirror.relay.model.ProcessedMessage;
import ru.mirror.relay.model.ProcessedMessageId;

import java.util.List;

@Repository
public interface ProcessedMessageRepository extends CrudRepository<ProcessedMessage, ProcessedMessageId> {

    interface SourceCount {
        String getSourceId();

        long getMessages();
    }

    @Query("select p.id.sourceId as sourceId, count(p.id.messageId) as messages from ProcessedMessage p "
            + "group by p.id.sourceId order by p.id.sourceId")
    List<SourceCount> countBySource();

    @Query("select count(p.id.messageId) from ProcessedMessage p")
    long countAll();

    @Modifying
    @Query("delete from ProcessedMessage")
    int deleteAllRows();
}
