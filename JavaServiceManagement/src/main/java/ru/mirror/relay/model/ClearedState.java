package ru.mirror.relay.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClearedState {
    private int processedMessages;
    private int duplicateCodes;
}
