package ru.mirror.relay.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
@AllArgsConstructor
public class FilterRule {
    // значение replacement, при котором правило раскрывает ссылки по сети вместо замены текста
    public static final String EXPAND_SENTINEL = "amz";

    private final Long id;
    private final String pattern;
    private final String replacement; // шаблон замены в синтаксисе Matcher ($1) или EXPAND_SENTINEL
    private final int sortOrder;

    public boolean isExpansion() {
        return EXPAND_SENTINEL.equals(replacement);
    }
}
