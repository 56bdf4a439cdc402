package ru.mirror.relay.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.StringSerializer;
import ru.mirror.relay.DeliveryException;
import ru.mirror.relay.KafkaWriter;
import ru.mirror.relay.impl.settings.ProducerSettings;
import ru.mirror.relay.model.OutboundMessage;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Getter
@Setter
@Builder
public class WriterToKafka implements KafkaWriter, AutoCloseable {
    static final String SILENT_HEADER = "silent";

    private ProducerSettings producerSettings;
    private ObjectMapper objectMapper;
    private Producer<String, String> kafkaProducer;

    @Override
    public void deliver(OutboundMessage message) throws DeliveryException {
        if (kafkaProducer == null) {
            createKafkaProducer();
        }
        String value;
        try {
            value = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new DeliveryException("Cannot serialize message for " + message.getDestination(), e);
        }
        ProducerRecord<String, String> producerRecord =
                new ProducerRecord<>(producerSettings.getTopicOut(), message.getDestination(), value);
        producerRecord.headers().add(SILENT_HEADER, Boolean.toString(message.isSilent()).getBytes(StandardCharsets.UTF_8));
        try {
            kafkaProducer.send(producerRecord).get(producerSettings.getSendTimeoutSec(), TimeUnit.SECONDS);
            log.debug("SENT_TO_TOPIC {} : {}", producerSettings.getTopicOut(), value);
        } catch (ExecutionException e) {
            throw new DeliveryException("Send to " + producerSettings.getTopicOut() + " failed", e.getCause());
        } catch (TimeoutException e) {
            throw new DeliveryException("Send to " + producerSettings.getTopicOut() + " timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Interrupted while sending to " + producerSettings.getTopicOut(), e);
        } catch (KafkaException e) {
            throw new DeliveryException("Producer rejected message for " + producerSettings.getTopicOut(), e);
        }
    }

    void createKafkaProducer() {
        kafkaProducer = new KafkaProducer<>(
                Map.of(
                        ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, producerSettings.getBootstrapServers(),
                        ProducerConfig.CLIENT_ID_CONFIG, "relay-" + UUID.randomUUID(),
                        ProducerConfig.ACKS_CONFIG, "all"
                ),
                new StringSerializer(),
                new StringSerializer()
        );
    }

    @Override
    public void close() {
        if (kafkaProducer != null) {
            kafkaProducer.close();
        }
    }
}
