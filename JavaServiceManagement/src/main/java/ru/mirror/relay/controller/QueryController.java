package ru.mirror.relay.controller;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import ru.mirror.relay.model.QueryRequest;
import ru.mirror.relay.model.QueryResult;
import ru.mirror.relay.service.ReadOnlyQueryService;

@RestController
@RequestMapping("query")
public class QueryController {
    @Autowired
    private ReadOnlyQueryService readOnlyQueryService;

    @PostMapping
    @Operation(summary = "Выполнить запрос SELECT в транзакции только для чтения")
    @ResponseStatus(value = HttpStatus.OK)
    public QueryResult execute(@RequestBody QueryRequest request) {
        return readOnlyQueryService.execute(request.getQuery());
    }
}
