package ru.mirror.relay.model;

/**
 * Итог одной очистки. -1 означает, что соответствующий шаг в этом цикле был отключен.
 */
public record SweepResult(int processedRemoved, int codesRemoved) {
}
