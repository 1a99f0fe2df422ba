package wikidb;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import wikidb.config.DatabaseSettings;
import wikidb.config.PoolSettings;

import javax.sql.DataSource;

@Slf4j
public class Engine implements AutoCloseable {
    static final String DRIVER_CLASS_NAME = "org.postgresql.Driver";
    static final String PRE_PING_QUERY = "SELECT 1";

    private final DataSource dataSource;
    private final PoolSettings poolSettings;

    public Engine(DataSource dataSource, PoolSettings poolSettings) {
        this.dataSource = dataSource;
        this.poolSettings = poolSettings;
    }

    public static Engine create(DatabaseSettings databaseSettings, PoolSettings poolSettings) {
        HikariDataSource dataSource = new HikariDataSource(hikariConfig(databaseSettings, poolSettings));

        log.info(
            "Opened connection pool {} for {} (size: {}, overflow: {}, pre-ping: {})",
            poolSettings.getPoolName(),
            databaseSettings,
            poolSettings.getPoolSize(),
            poolSettings.getMaxOverflow(),
            poolSettings.isPrePing()
        );

        return new Engine(dataSource, poolSettings);
    }

    public static HikariConfig hikariConfig(DatabaseSettings databaseSettings, PoolSettings poolSettings) {
        HikariConfig config = new HikariConfig();

        config.setJdbcUrl(databaseSettings.jdbcUrl());
        config.setUsername(databaseSettings.getUser());
        config.setPassword(databaseSettings.getPassword());
        config.setDriverClassName(DRIVER_CLASS_NAME);

        // minimumIdle below maximumPoolSize lets HikariCP retire the overflow once it goes idle
        config.setMaximumPoolSize(poolSettings.maxConnections());
        config.setMinimumIdle(poolSettings.getPoolSize());

        config.setConnectionTimeout(poolSettings.getConnectionTimeout().toMillis());
        config.setIdleTimeout(poolSettings.getIdleTimeout().toMillis());
        config.setMaxLifetime(poolSettings.getMaxLifetime().toMillis());
        config.setPoolName(poolSettings.getPoolName());

        if (poolSettings.isPrePing()) {
            config.setConnectionTestQuery(PRE_PING_QUERY);
        }

        // start even when the database is unreachable; the first checkout reports the failure
        config.setInitializationFailTimeout(-1);
        config.setAutoCommit(false);

        return config;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public PoolSettings getPoolSettings() {
        return poolSettings;
    }

    public boolean isEcho() {
        return poolSettings.isEcho();
    }

    public int maxConnections() {
        return poolSettings.maxConnections();
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource && !((HikariDataSource) dataSource).isClosed()) {
            ((HikariDataSource) dataSource).close();
            log.info("Closed connection pool {}", poolSettings.getPoolName());
        }
    }
}
