package wikidb.config;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.Map;

/**
 * Connection target read from the process environment. Values are taken as given; a malformed host or
 * port only fails once a connection is attempted.
 */
@Value
@Builder
public class DatabaseSettings {
    public static final String USER_VARIABLE = "DB_USER";
    public static final String PASSWORD_VARIABLE = "DB_PASSWORD";
    public static final String HOST_VARIABLE = "DB_HOST";
    public static final String PORT_VARIABLE = "DB_PORT";
    public static final String NAME_VARIABLE = "DB_NAME";

    public static final String DEFAULT_USER = "postgres";
    public static final String DEFAULT_PASSWORD = "postgres";
    public static final String DEFAULT_HOST = "localhost";
    public static final String DEFAULT_PORT = "5432";
    public static final String DEFAULT_NAME = "wikidb";

    private static final String CONNECTION_URL = "postgresql+asyncpg://%s:%s@%s:%s/%s";
    private static final String JDBC_URL = "jdbc:postgresql://%s:%s/%s";

    String user;

    @ToString.Exclude
    String password;

    String host;
    String port;
    String name;

    public static DatabaseSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static DatabaseSettings fromEnvironment(Map<String, String> environment) {
        return DatabaseSettings.builder()
            .user(environment.getOrDefault(USER_VARIABLE, DEFAULT_USER))
            .password(environment.getOrDefault(PASSWORD_VARIABLE, DEFAULT_PASSWORD))
            .host(environment.getOrDefault(HOST_VARIABLE, DEFAULT_HOST))
            .port(environment.getOrDefault(PORT_VARIABLE, DEFAULT_PORT))
            .name(environment.getOrDefault(NAME_VARIABLE, DEFAULT_NAME))
            .build();
    }

    public String connectionUrl() {
        return String.format(CONNECTION_URL, user, password, host, port, name);
    }

    /**
     * URL handed to the PostgreSQL JDBC driver. Credentials are passed to the pool separately.
     */
    public String jdbcUrl() {
        return String.format(JDBC_URL, host, port, name);
    }
}
