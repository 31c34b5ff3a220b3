package email.labeler.app.exception;

import email.labeler.app.remote.ErrorKind;
import lombok.Getter;

/**
 * A mail API call needed to start a run failed after retries.
 */
@Getter
public class RemoteCallException extends RuntimeException {
    private final ErrorKind errorKind;

    public RemoteCallException(String message, ErrorKind errorKind, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }
}
