package ru.mirror.relay.impl.settings;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.Arrays;
import java.util.List;

@Getter
@Setter
@Builder
@ToString
public class ConsumerSettings {
    private String bootstrapServers;
    private String groupId;
    private String autoOffsetReset;
    private String topicIn;
    private List<String> sources; // пустой список - принимаются все источники
    private int pollIntervalMs;

    public static List<String> parseSources(String sources) {
        return Arrays.stream(sources.split(","))
                .map(String::trim)
                .filter(source -> !source.isEmpty())
                .toList();
    }
}
