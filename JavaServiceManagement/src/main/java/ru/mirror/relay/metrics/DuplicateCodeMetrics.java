package ru.mirror.relay.metrics;

import org.springframework.stereotype.Component;
import ru.mirror.relay.repository.DuplicateCodeRepository;

@Component
public class DuplicateCodeMetrics extends CountMetrics {
    static final String DUPLICATE_CODES = "duplicateCodes";

    public DuplicateCodeMetrics(DuplicateCodeRepository duplicateCodeRepository) {
        super(DUPLICATE_CODES, duplicateCodeRepository::count);
    }
}
