package ru.mirror.relay.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import ru.mirror.relay.model.ClearedState;
import ru.mirror.relay.repository.DuplicateCodeRepository;
import ru.mirror.relay.repository.ProcessedMessageRepository;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Wipes the relay's persisted dedup state. Filters and channel labels are kept.
 */
@Slf4j
@Service
public class StateService {
    private final ProcessedMessageRepository processedMessageRepository;
    private final DuplicateCodeRepository duplicateCodeRepository;
    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock stateLock = new ReentrantLock();

    public StateService(ProcessedMessageRepository processedMessageRepository,
                        DuplicateCodeRepository duplicateCodeRepository,
                        PlatformTransactionManager transactionManager) {
        this.processedMessageRepository = processedMessageRepository;
        this.duplicateCodeRepository = duplicateCodeRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public ClearedState clear() {
        stateLock.lock();
        try {
            ClearedState cleared = transactionTemplate.execute(status -> new ClearedState(
                    processedMessageRepository.deleteAllRows(),
                    duplicateCodeRepository.deleteAllRows()));
            log.info("STATE_CLEARED processed={} codes={}", cleared.getProcessedMessages(), cleared.getDuplicateCodes());
            return cleared;
        } finally {
            stateLock.unlock();
        }
    }
}
