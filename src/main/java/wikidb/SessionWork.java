package wikidb;

import java.sql.SQLException;

@FunctionalInterface
public interface SessionWork<T> {
    T execute(Session session) throws SQLException;
}
