package ru.mirror.relay.impl.settings;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@Builder
@ToString
public class LinkSettings {
    private int timeoutSec;
    private String userAgent;
    private List<String> productMarkers; // части пути, по которым ссылка считается страницей товара
}
