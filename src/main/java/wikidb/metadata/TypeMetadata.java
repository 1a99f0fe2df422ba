package wikidb.metadata;

import wikidb.annotation.Column;
import wikidb.annotation.Id;
import wikidb.annotation.Table;
import wikidb.exception.EntityIdentityNotFound;
import wikidb.exception.EntityMappingException;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

public class TypeMetadata<T> {
    private final Class<T> type;
    private final Field[] columnFields;
    private final String identityName;
    private final Field identityField;
    private final String tableName;

    public TypeMetadata(Class<T> type) {
        this.type = type;
        Field[] fields = type.getDeclaredFields();
        this.identityField = getIdField(fields);
        this.identityName = getIdentityName(identityField);
        this.columnFields = Arrays.stream(fields)
            .filter(field -> field.getAnnotation(Column.class) != null)
            .toArray(Field[]::new);
        this.tableName = getTableName(type);

        identityField.setAccessible(true);
        for (Field field : columnFields) {
            field.setAccessible(true);
        }
    }

    private Field getIdField(Field[] fields) {
        return Arrays.stream(fields)
            .filter(field -> field.getAnnotation(Id.class) != null)
            .findFirst()
            .orElseThrow(() -> new EntityIdentityNotFound(
                String.format("Entity %s does not include @Id annotation", type.getSimpleName())
            ));
    }

    private static String getIdentityName(Field field) {
        String name = field.getAnnotation(Id.class).name();

        return name.isEmpty() ? field.getName() : name;
    }

    private static String getTableName(Class<?> type) {
        Table tableNameAnnotation = type.getAnnotation(Table.class);

        if (tableNameAnnotation != null && !tableNameAnnotation.name().isEmpty()) {
            return tableNameAnnotation.name();
        }

        return type.getSimpleName();
    }

    private static String getColumnName(Field field) {
        String name = field.getAnnotation(Column.class).name();

        return name.isEmpty() ? field.getName() : name;
    }

    /**
     * Non-null column values of the entity, sorted by column name. The identity column is not included.
     */
    public Map<String, Object> getColumns(Object entity) {
        Map<String, Object> result = new TreeMap<>();

        for (Field field : columnFields) {
            Object o = readField(field, entity);

            if (o == null) {
                continue;
            }

            result.put(getColumnName(field), o);
        }

        return result;
    }

    public Map<String, Object> getAllColumns(Object entity) {
        Map<String, Object> result = new TreeMap<>();

        for (Field field : columnFields) {
            result.put(getColumnName(field), readField(field, entity));
        }

        return result;
    }

    public String getIdentityName() {
        return identityName;
    }

    public String getTableName() {
        return tableName;
    }

    public Object getIdValue(Object entity) {
        return readField(identityField, entity);
    }

    /**
     * Converts a lookup key to the identity field's type so that {@code 1} and {@code 1L} name the same row.
     *
     * @throws IllegalArgumentException when the key cannot represent an identity of this entity
     */
    public Object toIdValue(Object id) {
        Class<?> idType = identityField.getType();

        if (id == null || idType.isInstance(id)) {
            return id;
        }

        if (id instanceof Number) {
            Number number = (Number) id;

            if (idType == Long.class || idType == long.class) {
                return number.longValue();
            }
            if (idType == Integer.class || idType == int.class) {
                return number.intValue();
            }
            if (idType == Short.class || idType == short.class) {
                return number.shortValue();
            }
        }

        throw new IllegalArgumentException(String.format(
            "Id %s of type %s does not match %s.%s of type %s",
            id, id.getClass().getSimpleName(), type.getSimpleName(), identityField.getName(), idType.getSimpleName()
        ));
    }

    public T parse(ResultSet resultSet) throws SQLException {
        T instance = newInstance();

        writeField(identityField, instance, resultSet.getObject(identityName, identityField.getType()));

        for (Field field : columnFields) {
            writeField(field, instance, resultSet.getObject(getColumnName(field), field.getType()));
        }

        return instance;
    }

    private T newInstance() {
        try {
            Constructor<T> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);

            return constructor.newInstance();
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException
                 | InvocationTargetException e) {
            throw new EntityMappingException(
                String.format("Entity %s needs an accessible no-argument constructor", type.getSimpleName()), e
            );
        }
    }

    private Object readField(Field field, Object entity) {
        try {
            return field.get(entity);
        } catch (IllegalAccessException e) {
            throw new EntityMappingException(
                String.format("Cannot read %s.%s", type.getSimpleName(), field.getName()), e
            );
        }
    }

    private void writeField(Field field, Object entity, Object value) {
        try {
            field.set(entity, value);
        } catch (IllegalAccessException e) {
            throw new EntityMappingException(
                String.format("Cannot write %s.%s", type.getSimpleName(), field.getName()), e
            );
        }
    }
}
