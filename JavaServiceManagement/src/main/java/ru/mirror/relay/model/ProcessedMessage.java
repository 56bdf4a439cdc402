package ru.mirror.relay.model;

import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Read-only view of the relay's identity records.
 */
@Data
@Entity
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "processed")
public class ProcessedMessage {
    @EmbeddedId
    private ProcessedMessageId id;
    private LocalDateTime createdAt;
}
