package ru.mirror.relay.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelaySettings {
    private String retentionDays; // как записано в файле, может быть некорректным
    private String retentionTime;
    private String codeRegex;
    private List<String> sources;
}
