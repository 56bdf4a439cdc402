package ru.mirror.relay;

import lombok.extern.slf4j.Slf4j;
import ru.mirror.relay.impl.ConfigurationReader;
import ru.mirror.relay.impl.ServiceRelay;

@Slf4j
public class ServiceRelayMain {
    public static void main(String[] args) {
        log.info("Start service Relay");
        ConfigReader configReader = new ConfigurationReader();
        Service service = new ServiceRelay();
        service.start(configReader.loadConfig());
        log.info("Terminate service Relay");
    }
}
