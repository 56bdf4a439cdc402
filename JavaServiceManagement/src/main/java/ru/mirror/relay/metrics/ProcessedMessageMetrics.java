package ru.mirror.relay.metrics;

import org.springframework.stereotype.Component;
import ru.mirror.relay.repository.ProcessedMessageRepository;

@Component
public class ProcessedMessageMetrics extends CountMetrics {
    static final String PROCESSED_MESSAGES = "processedMessages";

    public ProcessedMessageMetrics(ProcessedMessageRepository processedMessageRepository) {
        super(PROCESSED_MESSAGES, processedMessageRepository::countAll);
    }
}
