package ru.mirror.relay.controller;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import ru.mirror.relay.model.UrlFilter;
import ru.mirror.relay.service.FilterService;

import java.util.List;

@RestController
@RequestMapping("filter")
public class FilterController {

    @Autowired
    private FilterService filterService;

    @GetMapping("/findAll")
    @Operation(summary = "Получить все фильтры в порядке применения")
    @ResponseStatus(value = HttpStatus.OK)
    public List<UrlFilter> getAllFilters() {
        return filterService.findAll();
    }

    @PostMapping("/save")
    @Operation(summary = "Создать фильтр в конце цепочки")
    @ResponseStatus(value = HttpStatus.CREATED)
    public UrlFilter save(@RequestBody @Valid UrlFilter filter) {
        return filterService.add(filter);
    }

    @PutMapping("/update/{id}")
    @Operation(summary = "Изменить шаблон и замену фильтра")
    @ResponseStatus(value = HttpStatus.OK)
    public UrlFilter update(@PathVariable long id, @RequestBody @Valid UrlFilter filter) {
        return filterService.update(id, filter);
    }

    @DeleteMapping("/delete/{id}")
    @Operation(summary = "Удалить фильтр")
    @ResponseStatus(value = HttpStatus.OK)
    public void deleteFilterById(@PathVariable long id) {
        filterService.delete(id);
    }

    @PostMapping("/moveUp/{id}")
    @Operation(summary = "Поднять фильтр на одну позицию")
    @ResponseStatus(value = HttpStatus.OK)
    public List<UrlFilter> moveUp(@PathVariable long id) {
        return filterService.moveUp(id);
    }

    @PostMapping("/moveDown/{id}")
    @Operation(summary = "Опустить фильтр на одну позицию")
    @ResponseStatus(value = HttpStatus.OK)
    public List<UrlFilter> moveDown(@PathVariable long id) {
        return filterService.moveDown(id);
    }
}
