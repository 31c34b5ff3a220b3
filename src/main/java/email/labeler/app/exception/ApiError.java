package email.labeler.app.exception;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ApiError {
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String INVALID_CONFIGURATION = "INVALID_CONFIGURATION";
    public static final String CACHE_UNAVAILABLE = "CACHE_UNAVAILABLE";
    public static final String RUN_IN_PROGRESS = "RUN_IN_PROGRESS";
    public static final String REMOTE_FAILURE = "REMOTE_FAILURE";

    String code;
    String message;
    @Builder.Default
    List<String> details = List.of();
    String path;
    Instant timestamp;
}
