package ru.mirror.relay.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import ru.mirror.relay.ConfigReader;
import ru.mirror.relay.KafkaReader;
import ru.mirror.relay.impl.settings.ConsumerSettings;
import ru.mirror.relay.model.Message;
import ru.mirror.relay.model.ProcessingResult;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Getter
@Setter
@Builder
public class ReaderFromKafka implements KafkaReader {
    static final String SOURCES_PATH = "relay.sources";

    private AtomicBoolean isExit;
    private ConsumerSettings consumerSettings;
    private ForwardingPipeline pipeline;
    private ObjectMapper objectMapper;
    private Consumer<String, String> kafkaConsumer;
    private ConfigReader configReader; // если задан, список источников берется из живых настроек

    @Override
    public void processing() {
        Consumer<String, String> consumer = kafkaConsumer != null ? kafkaConsumer : createKafkaConsumer();
        log.debug("KAFKA_CONSUMER_START_READING_FROM_TOPIC {}", consumerSettings.getTopicIn());
        consumer.subscribe(Collections.singletonList(consumerSettings.getTopicIn()));
        try (consumer) {
            while (!isExit.get()) {
                ConsumerRecords<String, String> consumerRecords =
                        consumer.poll(Duration.ofMillis(consumerSettings.getPollIntervalMs()));
                for (ConsumerRecord<String, String> consumerRecord : consumerRecords) {
                    log.debug("MESSAGE_FROM_KAFKA_TOPIC {} : {}", consumerRecord.topic(), consumerRecord.value());
                    handle(consumerRecord.value());
                }
            }
            log.debug("READ_IS_DONE");
        }
    }

    Optional<ProcessingResult> handle(String value) {
        Optional<Message> message = toMessage(value);
        if (message.isEmpty()) {
            return Optional.empty();
        }
        if (!isAcceptedSource(message.get().getSourceId())) {
            log.debug("SOURCE_NOT_CONFIGURED {}", message.get().getSourceId());
            return Optional.empty();
        }
        try {
            return Optional.of(pipeline.process(message.get()));
        } catch (RuntimeException e) {
            log.error("Unexpected error processing {}", message.get().identity(), e);
            return Optional.empty();
        }
    }

    Optional<Message> toMessage(String value) {
        if (value == null || value.isBlank()) {
            log.warn("NOT_CORRECT_MESSAGE: empty value");
            return Optional.empty();
        }
        try {
            Message message = objectMapper.readValue(value, Message.class);
            if (message == null || message.getSourceId() == null || message.getSourceId().isBlank()
                    || message.getMessageId() == null) {
                log.warn("NOT_CORRECT_MESSAGE: {}", value);
                return Optional.empty();
            }
            return Optional.of(message);
        } catch (JsonProcessingException e) {
            log.warn("NOT_CORRECT_MESSAGE: {}", value);
            return Optional.empty();
        }
    }

    private boolean isAcceptedSource(String sourceId) {
        List<String> sources = currentSources();
        return sources == null || sources.isEmpty() || sources.contains(sourceId);
    }

    private List<String> currentSources() {
        if (configReader == null) {
            return consumerSettings.getSources();
        }
        try {
            Config config = configReader.loadLiveConfig();
            return config.hasPath(SOURCES_PATH)
                    ? ConsumerSettings.parseSources(config.getString(SOURCES_PATH))
                    : consumerSettings.getSources();
        } catch (ConfigException e) {
            log.error("NOT_CORRECT_SOURCES_SETTING, using startup list: {}", e.getMessage());
            return consumerSettings.getSources();
        }
    }

    private Consumer<String, String> createKafkaConsumer() {
        return new KafkaConsumer<>(
                Map.of(
                        ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, consumerSettings.getBootstrapServers(),
                        ConsumerConfig.GROUP_ID_CONFIG, consumerSettings.getGroupId(),
                        ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, consumerSettings.getAutoOffsetReset()
                ),
                new StringDeserializer(),
                new StringDeserializer()
        );
    }
}
