package ru.mirror.relay.controller;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import ru.mirror.relay.model.CodeSettings;
import ru.mirror.relay.model.RelaySettings;
import ru.mirror.relay.model.RetentionSettings;
import ru.mirror.relay.service.RelaySettingsFile;

@RestController
@RequestMapping("settings")
public class SettingsController {
    @Autowired
    private RelaySettingsFile relaySettingsFile;

    @GetMapping
    @Operation(summary = "Текущие живые настройки ретранслятора")
    @ResponseStatus(value = HttpStatus.OK)
    public RelaySettings getSettings() {
        return relaySettingsFile.read();
    }

    @PutMapping("/retention")
    @Operation(summary = "Изменить срок хранения и время ежедневной очистки")
    @ResponseStatus(value = HttpStatus.OK)
    public RelaySettings updateRetention(@RequestBody @Valid RetentionSettings retention) {
        return relaySettingsFile.updateRetention(retention.getDays(), retention.getTime());
    }

    @PutMapping("/codes")
    @Operation(summary = "Изменить шаблон кодов для дедубликации, пустой шаблон возвращает значение по умолчанию")
    @ResponseStatus(value = HttpStatus.OK)
    public RelaySettings updateCodes(@RequestBody @Valid CodeSettings codes) {
        return relaySettingsFile.updateCodeRegex(codes.getRegex());
    }
}
