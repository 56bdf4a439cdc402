package ru.mirror.relay;

import ru.mirror.relay.model.OutboundMessage;

public interface KafkaWriter {
    void deliver(OutboundMessage message) throws DeliveryException; // отправляет сообщение в ленту-получатель и дожидается подтверждения
}
