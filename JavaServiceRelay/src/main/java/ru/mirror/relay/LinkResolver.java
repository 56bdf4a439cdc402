package ru.mirror.relay;

public interface LinkResolver {
    String resolve(String url); // конечный адрес после редиректов; при сетевой ошибке возвращает url без изменений
}
