package wikidb;

import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import wikidb.action.DeleteAction;
import wikidb.action.InsertAction;
import wikidb.action.OrmAction;
import wikidb.action.UpdateAction;
import wikidb.exception.SessionClosedException;
import wikidb.metadata.EntityKey;
import wikidb.metadata.TypeMetadata;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Collectors;

@Slf4j
public class Session implements AutoCloseable {
    private static final String FIND_ALL_QUERY = "SELECT * FROM %s";
    private static final String FIND_ONE_QUERY = "SELECT * FROM %s WHERE %s = ?";
    private static final String UPDATE_QUERY = "UPDATE %s SET %s WHERE %s = ?";
    private static final String INSERT_QUERY = "INSERT INTO %s (%s) VALUES (%s)";
    private static final String DELETE_QUERY = "DELETE FROM %s WHERE %s = ?";

    private final Map<Class<?>, TypeMetadata> types = new HashMap<>();
    private final Map<EntityKey, Object> cache = new HashMap<>();
    private final Map<EntityKey, Map<String, Object>> snapshot = new HashMap<>();
    private final List<OrmAction> actions = new ArrayList<>();
    private final Connection connection;
    private final boolean echo;
    private final boolean expireOnCommit;
    private boolean closed;

    Session(Connection connection, boolean echo, boolean expireOnCommit) throws SQLException {
        this.connection = connection;
        this.echo = echo;
        this.expireOnCommit = expireOnCommit;

        try {
            this.connection.setAutoCommit(false);
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
    }

    private <T> TypeMetadata<T> metadata(Class<T> type) {
        return types.computeIfAbsent(type, TypeMetadata::new);
    }

    private TypeMetadata<Object> metadataOf(Object entity) {
        return types.computeIfAbsent(entity.getClass(), TypeMetadata::new);
    }

    private void ensureOpen() {
        if (closed) {
            throw new SessionClosedException();
        }
    }

    private void logStatement(String sql, Object... params) {
        if (echo) {
            log.info("SQL: {} {}", sql, Arrays.toString(params));
        } else {
            log.debug("SQL: {} {}", sql, Arrays.toString(params));
        }
    }

    @SneakyThrows
    private void executeSelectQuery(Consumer<ResultSet> resultSetConsumer, String sql, Object... params) {
        logStatement(sql, params);

        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                preparedStatement.setObject(i + 1, params[i]);
            }

            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                while (resultSet.next()) {
                    resultSetConsumer.accept(resultSet);
                }
            }
        }
    }

    @SneakyThrows
    private void executeUpdateQuery(String sql, Object... params) {
        logStatement(sql, params);

        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                preparedStatement.setObject(i + 1, params[i]);
            }

            preparedStatement.executeUpdate();
        }
    }

    @SneakyThrows
    private <T> T parseResultSet(TypeMetadata<T> typeMetadata, ResultSet resultSet) {
        return typeMetadata.parse(resultSet);
    }

    private void updateEntity(EntityKey key, Object entity) {
        TypeMetadata<Object> typeMetadata = metadataOf(entity);

        Map<String, Object> columns = typeMetadata.getAllColumns(entity);
        List<String> params = new ArrayList<>();
        List<Object> values = new ArrayList<>();

        columns.forEach((s, o) -> {
            params.add(String.format("%s = ?", s));
            values.add(o);
        });

        values.add(key.getId());

        actions.add(new UpdateAction(
            String.format(
                UPDATE_QUERY,
                typeMetadata.getTableName(),
                String.join(", ", params),
                typeMetadata.getIdentityName()
            ),
            values.toArray()
        ));

        snapshot.put(key, columns);
    }

    public void persist(Object entity) {
        ensureOpen();
        TypeMetadata<Object> typeMetadata = metadataOf(entity);

        Map<String, Object> columns = new LinkedHashMap<>();
        Object id = typeMetadata.getIdValue(entity);

        if (id != null) {
            columns.put(typeMetadata.getIdentityName(), id);
        }

        columns.putAll(typeMetadata.getColumns(entity));

        actions.add(new InsertAction(
            String.format(
                INSERT_QUERY,
                typeMetadata.getTableName(),
                String.join(", ", columns.keySet()),
                columns.keySet().stream()
                    .map(f -> "?").collect(Collectors.joining(", "))
            ),
            columns.values().toArray()
        ));
    }

    public void remove(Object entity) {
        ensureOpen();
        TypeMetadata<Object> typeMetadata = metadataOf(entity);
        Object id = typeMetadata.getIdValue(entity);

        var key = new EntityKey(entity.getClass(), id);
        cache.remove(key);
        snapshot.remove(key);

        actions.add(new DeleteAction(
            String.format(DELETE_QUERY, typeMetadata.getTableName(), typeMetadata.getIdentityName()),
            new Object[]{id}
        ));
    }

    private <T> List<T> findAll(Class<T> type) {
        List<T> result = new ArrayList<>();
        TypeMetadata<T> typeMetadata = metadata(type);

        executeSelectQuery(
            rs -> result.add(parseResultSet(typeMetadata, rs)),
            String.format(FIND_ALL_QUERY, typeMetadata.getTableName())
        );

        return result;
    }

    private <T> Optional<T> findOne(Class<T> type, Object id) {
        List<T> result = new ArrayList<>();
        TypeMetadata<T> typeMetadata = metadata(type);

        executeSelectQuery(
            rs -> result.add(parseResultSet(typeMetadata, rs)),
            String.format(FIND_ONE_QUERY, typeMetadata.getTableName(), typeMetadata.getIdentityName()),
            id
        );

        return result.stream().findFirst();
    }

    private <T> Optional<T> getEntityFromCache(Class<T> type, Object id) {
        var cachedResult = cache.get(new EntityKey(type, id));

        return Optional.ofNullable(cachedResult)
            .map(type::cast);
    }

    // an instance already in the identity map wins over the freshly read row
    private <T> T cacheEntity(Class<T> type, T result) {
        var key = new EntityKey(type, metadata(type).getIdValue(result));
        var cached = cache.get(key);

        if (cached != null) {
            return type.cast(cached);
        }

        cache.put(key, result);
        snapshot.put(key, metadata(type).getAllColumns(result));

        return result;
    }

    private <T> List<T> cacheEntityList(Class<T> type, List<T> result) {
        return result.stream()
            .map(item -> cacheEntity(type, item))
            .collect(Collectors.toList());
    }

    private boolean hasChanges(Map.Entry<EntityKey, Object> entry) {
        Map<String, Object> currentValues = metadataOf(entry.getValue()).getAllColumns(entry.getValue());

        return !currentValues.equals(snapshot.get(entry.getKey()));
    }

    public <T> List<T> find(Class<T> type) {
        flush();

        return cacheEntityList(type, findAll(type));
    }

    /**
     * @return the entity, or {@code null} when no row matches
     */
    public <T> T find(Class<T> type, Object id) {
        flush();
        Object key = metadata(type).toIdValue(id);

        return getEntityFromCache(type, key)
            .or(() -> findOne(type, key).map(entity -> cacheEntity(type, entity)))
            .orElse(null);
    }

    public void flush() {
        ensureOpen();

        cache.entrySet().stream()
            .filter(this::hasChanges)
            .toList()
            .forEach(entry -> updateEntity(entry.getKey(), entry.getValue()));

        if (actions.isEmpty()) {
            return;
        }

        List<OrmAction> pending = new ArrayList<>(actions);
        actions.clear();

        pending.stream()
            .sorted(Comparator.comparingInt(OrmAction::getFlushOrder))
            .forEach(a -> executeUpdateQuery(a.getSql(), a.getParams()));
    }

    public void commit() throws SQLException {
        flush();
        connection.commit();

        if (expireOnCommit) {
            cache.clear();
            snapshot.clear();
        }
    }

    public void rollback() throws SQLException {
        ensureOpen();
        actions.clear();
        cache.clear();
        snapshot.clear();
        connection.rollback();
    }

    public boolean isOpen() {
        return !closed;
    }

    /**
     * Rolls back uncommitted work and returns the connection to the pool. Further calls do nothing.
     */
    @Override
    public void close() throws SQLException {
        if (closed) {
            return;
        }

        closed = true;
        actions.clear();
        cache.clear();
        snapshot.clear();

        try {
            connection.rollback();
        } finally {
            connection.close();
        }
    }
}
