package ru.mirror.relay.impl.settings;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.jooq.SQLDialect;

@Getter
@Setter
@Builder
@ToString(exclude = "password")
public class DBSettings {
    private String jdbcUrl;
    private String user;
    private String password;
    private String driver;
    private SQLDialect dialect;
    private int maximumPoolSize;
}
