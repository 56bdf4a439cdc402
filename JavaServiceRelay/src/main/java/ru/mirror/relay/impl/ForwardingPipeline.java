package ru.mirror.relay.impl;

import lombok.extern.slf4j.Slf4j;
import org.jooq.exception.DataAccessException;
import ru.mirror.relay.DeliveryException;
import ru.mirror.relay.FilterChain;
import ru.mirror.relay.KafkaWriter;
import ru.mirror.relay.StateStore;
import ru.mirror.relay.model.Message;
import ru.mirror.relay.model.OutboundMessage;
import ru.mirror.relay.model.ProcessingResult;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * identity check -> filter chain -> code check -> delivery -> state commit -> stats.
 * Holds no state between calls apart from the identities currently in flight, which keeps
 * two concurrent deliveries of the same message from both reaching the destination.
 */
@Slf4j
public class ForwardingPipeline {
    private final StateStore stateStore;
    private final FilterChain filterChain;
    private final CodeDeduplicator codeDeduplicator;
    private final KafkaWriter writer;
    private final StatsRecorder statsRecorder;
    private final String destination;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public ForwardingPipeline(StateStore stateStore, FilterChain filterChain, CodeDeduplicator codeDeduplicator,
                              KafkaWriter writer, StatsRecorder statsRecorder, String destination) {
        this.stateStore = stateStore;
        this.filterChain = filterChain;
        this.codeDeduplicator = codeDeduplicator;
        this.writer = writer;
        this.statsRecorder = statsRecorder;
        this.destination = destination;
    }

    public ProcessingResult process(Message message) {
        String identity = message.identity();
        if (!inFlight.add(identity)) {
            log.debug("IN_FLIGHT {}", identity);
            return ProcessingResult.ALREADY_PROCESSED;
        }
        try {
            return processExclusively(message);
        } catch (DataAccessException e) {
            log.error("Store unavailable while processing {}: {}", identity, e.getMessage());
            return ProcessingResult.STORE_FAILED;
        } finally {
            inFlight.remove(identity);
        }
    }

    private ProcessingResult processExclusively(Message message) {
        String sourceId = message.getSourceId();
        long messageId = message.getMessageId();
        if (stateStore.isProcessed(sourceId, messageId)) {
            return ProcessingResult.ALREADY_PROCESSED;
        }

        String text = filterChain.apply(message.getText() == null ? "" : message.getText());

        // коды извлекаются после раскрытия ссылок, чтобы были видны id товаров из редиректов
        List<String> codes = codeDeduplicator.extract(text);
        if (!codes.isEmpty()) {
            Set<String> existing = codeDeduplicator.exists(codes);
            if (!existing.isEmpty()) {
                log.info("[SKIP] Duplicate codes {} in {}", String.join(",", new TreeSet<>(existing)), message.identity());
                stateStore.markProcessed(sourceId, messageId);
                return ProcessingResult.DUPLICATE_CODE;
            }
        }

        try {
            writer.deliver(OutboundMessage.of(destination, message, text));
        } catch (DeliveryException e) {
            log.error("Error forwarding {}: {}", message.identity(), e.getMessage());
            return ProcessingResult.DELIVERY_FAILED;
        }
        log.info("[OK] Forwarded {}", message.identity());

        // счетчик растет сразу после отметки, сбой записи кодов не должен терять доставленное сообщение
        if (stateStore.markProcessed(sourceId, messageId)) {
            statsRecorder.increment();
        }
        codeDeduplicator.record(codes);
        return ProcessingResult.FORWARDED;
    }
}
