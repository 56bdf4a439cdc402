package ru.mirror.relay.impl;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled regular expressions keyed by their source text. A pattern that does not
 * compile is remembered as empty and reported once, so the owning rule stays disabled
 * until the stored text changes.
 */
@Slf4j
class PatternCache {
    private final String owner;
    private final ConcurrentMap<String, Optional<Pattern>> compiled = new ConcurrentHashMap<>();

    PatternCache(String owner) {
        this.owner = owner;
    }

    Optional<Pattern> compile(String regex) {
        if (regex == null || regex.isBlank()) {
            return Optional.empty();
        }
        return compiled.computeIfAbsent(regex, this::tryCompile);
    }

    private Optional<Pattern> tryCompile(String regex) {
        try {
            return Optional.of(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            log.error("{}_PATTERN_DISABLED '{}': {}", owner, regex, e.getDescription());
            return Optional.empty();
        }
    }
}
