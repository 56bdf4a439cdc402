package ru.mirror.relay.controller;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import ru.mirror.relay.model.RelayStats;
import ru.mirror.relay.service.StatsFileReader;

@RestController
@RequestMapping("stats")
public class StatsController {
    @Autowired
    private StatsFileReader statsFileReader;

    @GetMapping
    @Operation(summary = "Счетчик пересланных сообщений и состояние ретранслятора")
    @ResponseStatus(value = HttpStatus.OK)
    public RelayStats getStats() {
        return statsFileReader.read();
    }
}
