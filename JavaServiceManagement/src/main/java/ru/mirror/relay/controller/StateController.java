package ru.mirror.relay.controller;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import ru.mirror.relay.model.ClearedState;
import ru.mirror.relay.service.StateService;

@RestController
@RequestMapping("state")
public class StateController {
    @Autowired
    private StateService stateService;

    @PostMapping("/clear")
    @Operation(summary = "Очистить обработанные сообщения и кэш кодов, фильтры и подписи лент сохраняются")
    @ResponseStatus(value = HttpStatus.OK)
    public ClearedState clear() {
        return stateService.clear();
    }
}
