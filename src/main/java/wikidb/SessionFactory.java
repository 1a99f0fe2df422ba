package wikidb;

import lombok.RequiredArgsConstructor;

import javax.sql.DataSource;
import java.sql.SQLException;

@RequiredArgsConstructor
public class SessionFactory {
    private final DataSource dataSource;
    private final boolean echo;
    private final boolean expireOnCommit;

    public SessionFactory(Engine engine) {
        this(engine.getDataSource(), engine.isEcho(), false);
    }

    public Session createSession() throws SQLException {
        return new Session(dataSource.getConnection(), echo, expireOnCommit);
    }

    public boolean isExpireOnCommit() {
        return expireOnCommit;
    }
}
