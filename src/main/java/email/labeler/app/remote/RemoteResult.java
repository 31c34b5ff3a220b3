package email.labeler.app.remote;

import java.util.Objects;

/**
 * Outcome of a remote call: either a value or an {@link ErrorKind} with the last error seen.
 */
public final class RemoteResult<T> {
    private final T value;
    private final ErrorKind errorKind;
    private final Exception error;
    private final int attempts;

    private RemoteResult(T value, ErrorKind errorKind, Exception error, int attempts) {
        this.value = value;
        this.errorKind = errorKind;
        this.error = error;
        this.attempts = attempts;
    }

    public static <T> RemoteResult<T> success(T value, int attempts) {
        return new RemoteResult<>(value, null, null, attempts);
    }

    public static <T> RemoteResult<T> failure(ErrorKind errorKind, Exception error, int attempts) {
        return new RemoteResult<>(null, Objects.requireNonNull(errorKind), error, attempts);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value for failed remote call (" + errorKind + ")", error);
        }
        return value;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public Exception getError() {
        return error;
    }

    public int getAttempts() {
        return attempts;
    }

    public String describeError() {
        if (isSuccess()) {
            return "";
        }
        return errorKind + (error != null && error.getMessage() != null ? ": " + error.getMessage() : "");
    }
}
