package ru.mirror.relay.model;

public enum ProcessingResult {
    FORWARDED, // доставлено и записано как обработанное
    ALREADY_PROCESSED, // идентификатор уже встречался или обрабатывается прямо сейчас
    DUPLICATE_CODE, // код уже в кеше, сообщение помечено обработанным без доставки
    DELIVERY_FAILED, // доставка не удалась, сообщение не помечено
    STORE_FAILED // хранилище недоступно, обработка прервана
}
