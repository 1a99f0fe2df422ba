package wikidb;

import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;

import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Hands out one session per unit of work and closes it when the work ends, whether it returned or threw.
 * A failure while closing after a failed unit is attached to the unit's failure as suppressed.
 */
@RequiredArgsConstructor
public class SessionProvider {
    private final SessionFactory sessionFactory;
    private final Executor executor;

    public <T> T withSession(SessionWork<T> work) throws SQLException {
        try (Session session = sessionFactory.createSession()) {
            return work.execute(session);
        }
    }

    public <T> CompletableFuture<T> withSessionAsync(SessionWork<T> work) {
        return CompletableFuture.supplyAsync(() -> runScoped(work), executor);
    }

    @SneakyThrows
    private <T> T runScoped(SessionWork<T> work) {
        return withSession(work);
    }
}
