package ru.mirror.relay;

import com.typesafe.config.Config;

public interface Service {
    void start(Config config); // стартует сервис и блокирует поток до остановки
}
