package wikidb;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import wikidb.config.DatabaseSettings;
import wikidb.config.PoolSettings;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Getter
public class Database implements AutoCloseable {
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final DatabaseSettings settings;
    private final Engine engine;
    private final SessionFactory sessionFactory;
    private final SessionProvider sessionProvider;

    @Getter(AccessLevel.NONE)
    private final ExecutorService executor;

    public Database(DatabaseSettings settings, Engine engine) {
        this.settings = settings;
        this.engine = engine;
        this.sessionFactory = new SessionFactory(engine);
        this.executor = Executors.newFixedThreadPool(engine.maxConnections(), sessionThreadFactory());
        this.sessionProvider = new SessionProvider(sessionFactory, executor);
    }

    public static Database fromEnvironment() {
        return create(DatabaseSettings.fromEnvironment(), PoolSettings.DEFAULTS);
    }

    public static Database create(DatabaseSettings settings, PoolSettings poolSettings) {
        return new Database(settings, Engine.create(settings, poolSettings));
    }

    private static ThreadFactory sessionThreadFactory() {
        AtomicInteger counter = new AtomicInteger();

        return runnable -> {
            Thread thread = new Thread(runnable, "wikidb-session-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        executor.shutdown();

        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Session executor did not stop within {}s, interrupting pending work", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            engine.close();
        }
    }
}
