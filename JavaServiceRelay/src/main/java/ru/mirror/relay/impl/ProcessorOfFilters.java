package ru.mirror.relay.impl;

import lombok.extern.slf4j.Slf4j;
import ru.mirror.relay.FilterChain;
import ru.mirror.relay.LinkResolver;
import ru.mirror.relay.StateStore;
import ru.mirror.relay.model.FilterRule;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
public class ProcessorOfFilters implements FilterChain {
    private final StateStore stateStore;
    private final LinkResolver linkResolver;
    private final PatternCache patternCache = new PatternCache("URL_FILTER");

    public ProcessorOfFilters(StateStore stateStore, LinkResolver linkResolver) {
        this.stateStore = stateStore;
        this.linkResolver = linkResolver;
    }

    @Override
    public String apply(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        // правила читаются на каждое сообщение, чтобы правки из менеджера действовали сразу
        List<FilterRule> rules = stateStore.listFilters();
        String result = text;
        for (FilterRule rule : rules) {
            Optional<Pattern> pattern = patternCache.compile(rule.getPattern());
            if (pattern.isEmpty()) {
                continue;
            }
            try {
                result = rule.isExpansion()
                        ? expandLinks(result, pattern.get())
                        : substitute(result, pattern.get(), rule);
            } catch (RuntimeException e) {
                log.error("Filter {} '{}' failed, skipping it: {}", rule.getId(), rule.getPattern(), e.getMessage());
            }
        }
        return result;
    }

    private String substitute(String text, Pattern pattern, FilterRule rule) {
        String replaced = pattern.matcher(text).replaceAll(rule.getReplacement());
        if (!replaced.equals(text)) {
            log.info("Filter matched: '{}'", rule.getPattern());
        }
        return replaced;
    }

    private String expandLinks(String text, Pattern pattern) {
        Set<String> urls = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            urls.add(matcher.groupCount() > 0 && matcher.group(1) != null ? matcher.group(1) : matcher.group());
        }
        String result = text;
        for (String url : urls) {
            String resolved = resolveQuietly(url);
            if (!resolved.equals(url)) {
                result = result.replace(url, resolved);
                log.info("Expanded {} -> {}", url, resolved);
            }
        }
        return result;
    }

    private String resolveQuietly(String url) {
        try {
            String resolved = linkResolver.resolve(url);
            return resolved == null ? url : resolved;
        } catch (RuntimeException e) {
            log.error("Failed to expand {}: {}", url, e.getMessage());
            return url;
        }
    }
}
