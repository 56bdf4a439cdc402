package ru.mirror.relay.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.mirror.relay.validation.ValidRegex;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CodeSettings {
    @ValidRegex
    private String regex; // пусто - вернуть шаблон по умолчанию
}
