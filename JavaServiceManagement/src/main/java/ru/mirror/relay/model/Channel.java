package ru.mirror.relay.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Entity
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "channels")
public class Channel {
    @Id
    @NotBlank(message = "SOURCE_ID_IS_REQUIRED")
    private String sourceId;
    private String name; // подпись для отображения, может отсутствовать
}
