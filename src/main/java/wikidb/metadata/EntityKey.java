package wikidb.metadata;

import lombok.Value;

@Value
public class EntityKey {
    Class<?> type;
    Object id;
}
