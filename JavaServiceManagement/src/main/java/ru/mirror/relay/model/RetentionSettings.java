package ru.mirror.relay.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RetentionSettings {
    @NotNull(message = "DAYS_IS_REQUIRED")
    private Integer days; // 0 и меньше - очистка отключена
    @NotBlank(message = "TIME_IS_REQUIRED")
    @Pattern(regexp = "^([01]?\\d|2[0-3]):[0-5]\\d$", message = "TIME_MUST_BE_HH_MM")
    private String time;
}
