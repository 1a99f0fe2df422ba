package wikidb.exception;

public class EntityMappingException extends RuntimeException {
    public EntityMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
