package ru.mirror.relay;

public interface FilterChain {
    String apply(String text); // применяет правила url_filters по порядку sort_order, каждое видит результат предыдущего
}
