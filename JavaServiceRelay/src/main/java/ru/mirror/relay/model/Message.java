package ru.mirror.relay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Message {
    private String sourceId; // id ленты-источника
    private Long messageId; // id сообщения внутри ленты
    private String text; // исходный текст, может отсутствовать у сообщений с одним вложением
    private String attachment; // ссылка на вложение, null если вложения нет

    public boolean hasAttachment() {
        return attachment != null && !attachment.isBlank();
    }

    public String identity() {
        return sourceId + ":" + messageId;
    }
}
