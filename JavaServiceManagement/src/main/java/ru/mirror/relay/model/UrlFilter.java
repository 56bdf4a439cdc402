package ru.mirror.relay.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.mirror.relay.validation.ValidRegex;

@Data
@Entity
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "url_filters")
public class UrlFilter {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @NotBlank(message = "PATTERN_IS_REQUIRED")
    @ValidRegex
    private String pattern;
    @NotNull(message = "REPLACEMENT_IS_REQUIRED")
    private String replacement = ""; // "amz" - раскрыть ссылки вместо замены
    private int sortOrder;
}
