package email.labeler.app.exception;

/** Classification cache read or write failed. Never swallowed. */
public class CacheStorageException extends RuntimeException {

    public CacheStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
