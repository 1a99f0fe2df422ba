package wikidb.exception;

public class SessionClosedException extends IllegalStateException {
    public SessionClosedException() {
        super("Session is closed");
    }
}
