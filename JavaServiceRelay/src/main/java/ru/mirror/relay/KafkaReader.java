package ru.mirror.relay;

public interface KafkaReader {
    void processing(); // читает входной топик в цикле до выставления флага выхода и передает сообщения в конвейер
}
