package ru.mirror.relay.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChannelStats {
    private String sourceId;
    private String name;
    private long messages;
}
