package ru.mirror.relay.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    private static final String BASIC_AUTH = "basicAuth";

    @Bean
    public OpenAPI relayManagementOpenAPI() {
        return new OpenAPI()
                .info(new Info().title("Менеджер ретранслятора")
                        .description("Фильтры ссылок, ленты-источники, настройки очистки и кодов, статистика, запросы только на чтение")
                        .version("1.0"))
                .components(new Components().addSecuritySchemes(BASIC_AUTH,
                        new SecurityScheme().type(SecurityScheme.Type.HTTP).scheme("basic")))
                .addSecurityItem(new SecurityRequirement().addList(BASIC_AUTH));
    }
}
