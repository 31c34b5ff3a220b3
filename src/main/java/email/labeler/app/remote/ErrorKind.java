package email.labeler.app.remote;

/**
 * Failure classes of a remote mail API call. Drives retry and skip decisions.
 */
public enum ErrorKind {
    /** Rate limit, server error, connection reset or timeout. Retried with backoff. */
    TRANSIENT,
    /** Remote state changed during the call. Retried briefly, then the item is skipped. */
    CONFLICT,
    /** The message or label no longer exists. Skipped immediately. */
    NOT_FOUND,
    /** Anything else. Counted as a failure for the item. */
    UNEXPECTED
}
