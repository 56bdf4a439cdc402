package ru.mirror.relay;

import com.typesafe.config.Config;

public interface ConfigReader {
    Config loadConfig(); // базовая конфигурация сервиса из application.conf

    Config loadLiveConfig(); // базовая конфигурация, поверх которой наложен файл живых настроек relay.settingsFile
}
