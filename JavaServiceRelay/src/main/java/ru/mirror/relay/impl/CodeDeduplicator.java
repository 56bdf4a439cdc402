package ru.mirror.relay.impl;

import com.typesafe.config.Config;
import lombok.extern.slf4j.Slf4j;
import ru.mirror.relay.ConfigReader;
import ru.mirror.relay.StateStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls identifying codes out of filtered text and checks them against the
 * duplicate_codes cache. The pattern is re-read from the live settings on every call.
 */
@Slf4j
public class CodeDeduplicator {
    public static final String DEFAULT_REGEX = "\\b[A-Za-z0-9]{6,}\\b";
    static final String REGEX_PATH = "relay.codes.regex";

    private final ConfigReader configReader;
    private final StateStore stateStore;
    private final PatternCache patternCache = new PatternCache("DUP_CODE");

    public CodeDeduplicator(ConfigReader configReader, StateStore stateStore) {
        this.configReader = configReader;
        this.stateStore = stateStore;
    }

    public List<String> extract(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Optional<Pattern> pattern = patternCache.compile(currentRegex());
        if (pattern.isEmpty()) {
            return List.of();
        }
        Set<String> codes = new LinkedHashSet<>();
        Matcher matcher = pattern.get().matcher(text);
        while (matcher.find()) {
            // если в шаблоне есть группа, кодом считается ее содержимое, например (?:/dp/)([A-Z0-9]{10})
            String raw = matcher.groupCount() > 0 && matcher.group(1) != null ? matcher.group(1) : matcher.group();
            String code = normalize(raw);
            if (!code.isEmpty()) {
                codes.add(code);
            }
        }
        return new ArrayList<>(codes);
    }

    public Set<String> exists(Collection<String> codes) {
        return stateStore.findExistingCodes(normalizeAll(codes));
    }

    public void record(Collection<String> codes) {
        stateStore.recordCodes(normalizeAll(codes));
    }

    public static String normalize(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }

    private static List<String> normalizeAll(Collection<String> codes) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String code : codes) {
            String value = normalize(code);
            if (!value.isEmpty()) {
                normalized.add(value);
            }
        }
        return new ArrayList<>(normalized);
    }

    private String currentRegex() {
        Config config = configReader.loadLiveConfig();
        return config.hasPath(REGEX_PATH) ? config.getString(REGEX_PATH) : DEFAULT_REGEX;
    }
}
