package ru.mirror.relay.repository;

import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import ru.mirror.relay.model.Channel;

@Repository
public interface ChannelRepository extends CrudRepository<Channel, String> {
}
