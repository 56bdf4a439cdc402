package ru.mirror.relay.controller;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import ru.mirror.relay.model.Channel;
import ru.mirror.relay.model.ChannelStats;
import ru.mirror.relay.repository.ChannelRepository;
import ru.mirror.relay.repository.ProcessedMessageRepository;
import ru.mirror.relay.service.RelaySettingsFile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("channel")
public class ChannelController {
    @Autowired
    private ChannelRepository channelRepository;
    @Autowired
    private ProcessedMessageRepository processedMessageRepository;
    @Autowired
    private RelaySettingsFile relaySettingsFile;

    @GetMapping("/stats")
    @Operation(summary = "Количество обработанных сообщений по лентам-источникам")
    @ResponseStatus(value = HttpStatus.OK)
    public List<ChannelStats> getStats() {
        Map<String, Long> counts = new LinkedHashMap<>();
        processedMessageRepository.countBySource()
                .forEach(count -> counts.put(count.getSourceId(), count.getMessages()));
        Map<String, String> names = new LinkedHashMap<>();
        channelRepository.findAll().forEach(channel -> names.put(channel.getSourceId(), channel.getName()));

        // сначала настроенные источники в порядке настройки, затем остальные встреченные
        List<String> order = new ArrayList<>(relaySettingsFile.sources());
        counts.keySet().stream().filter(sourceId -> !order.contains(sourceId)).forEach(order::add);

        return order.stream()
                .map(sourceId -> new ChannelStats(sourceId, names.get(sourceId), counts.getOrDefault(sourceId, 0L)))
                .toList();
    }

    @PostMapping("/save")
    @Operation(summary = "Сохранить подпись ленты и добавить ее в список источников")
    @ResponseStatus(value = HttpStatus.CREATED)
    public Channel save(@RequestBody @Valid Channel channel) {
        Channel saved = channelRepository.save(channel);
        relaySettingsFile.addSource(saved.getSourceId());
        return saved;
    }
}
