package ru.mirror.relay.impl;

import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.mirror.relay.StateStore;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CodeDeduplicatorTest {
    @Mock
    private StateStore stateStore;

    @Test
    void testDefaultPatternFindsLongAlphanumericRuns() {
        CodeDeduplicator codeDeduplicator = withRegex(null);

        assertEquals(List.of("ABC123", "PROMO2024"),
                codeDeduplicator.extract("use abc123 or promo2024, not ab12 or ABC123 again"));
    }

    @Test
    void testCaptureGroupIsTheCode() {
        CodeDeduplicator codeDeduplicator = withRegex("/dp/([A-Z0-9]{10})");

        assertEquals(List.of("B0ABC12345"),
                codeDeduplicator.extract("https://www.amazon.com/dp/B0ABC12345 and https://amazon.com/dp/B0ABC12345"));
    }

    /**
     * Если группа не участвовала в совпадении, кодом считается все совпадение
     */
    @Test
    void testUnmatchedGroupFallsBackToWholeMatch() {
        CodeDeduplicator codeDeduplicator = withRegex("/dp/([A-Z0-9]{10})|\\b[A-Z]{3}[0-9]{3}\\b");

        assertEquals(List.of("B0ABC12345", "XYZ123"),
                codeDeduplicator.extract("see /dp/B0ABC12345 and XYZ123"));
    }

    @Test
    void testNoMatchesGivesEmptyList() {
        assertTrue(withRegex(null).extract("tiny text").isEmpty());
        assertTrue(withRegex(null).extract("").isEmpty());
        assertTrue(withRegex(null).extract(null).isEmpty());
    }

    /**
     * Некорректный шаблон отключает извлечение, но не ломает обработку
     */
    @Test
    void testInvalidPatternDisablesExtraction() {
        CodeDeduplicator codeDeduplicator = withRegex("([A-Z");

        assertTrue(codeDeduplicator.extract("CODE123456").isEmpty());
    }

    @Test
    void testBlankPatternDisablesExtraction() {
        assertTrue(withRegex("  ").extract("CODE123456").isEmpty());
    }

    @Test
    void testNormalize() {
        assertEquals("ABC123", CodeDeduplicator.normalize("  abc123 "));
    }

    @Test
    void testExistsAndRecordNormalize() {
        CodeDeduplicator codeDeduplicator = withRegex(null);
        when(stateStore.findExistingCodes(List.of("ABC123"))).thenReturn(Set.of("ABC123"));

        assertEquals(Set.of("ABC123"), codeDeduplicator.exists(List.of(" abc123", "ABC123")));

        codeDeduplicator.record(List.of("xyz789", " XYZ789 ", ""));
        verify(stateStore).recordCodes(List.of("XYZ789"));
    }

    private CodeDeduplicator withRegex(String regex) {
        var config = ConfigFactory.empty();
        if (regex != null) {
            config = config.withValue(CodeDeduplicator.REGEX_PATH, ConfigValueFactory.fromAnyRef(regex));
        }
        return new CodeDeduplicator(new ConfigurationReader(config), stateStore);
    }
}
