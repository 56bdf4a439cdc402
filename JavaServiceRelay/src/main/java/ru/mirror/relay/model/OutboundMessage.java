package ru.mirror.relay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Сообщение для ленты-получателя: либо {@code text}, либо {@code attachment} с подписью {@code caption}.
 * Доставка всегда без уведомления.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutboundMessage {
    private String destination;
    private String text;
    private String attachment;
    private String caption;
    @Builder.Default
    private boolean silent = true;

    public static OutboundMessage of(String destination, Message source, String filteredText) {
        if (source.hasAttachment()) {
            return OutboundMessage.builder()
                    .destination(destination)
                    .attachment(source.getAttachment())
                    .caption(filteredText)
                    .build();
        }
        return OutboundMessage.builder()
                .destination(destination)
                .text(filteredText)
                .build();
    }
}
