package email.labeler.app.exception;

import java.util.List;

/**
 * Thrown when the category configuration is missing or invalid. Raised before any
 * classification starts.
 */
public class ConfigurationException extends RuntimeException {
    private final List<String> issues;

    public ConfigurationException(String message) {
        super(message);
        this.issues = List.of(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.issues = List.of(message);
    }

    public ConfigurationException(List<String> issues) {
        super("Invalid category configuration: " + String.join("; ", issues));
        this.issues = List.copyOf(issues);
    }

    public List<String> getIssues() {
        return issues;
    }
}
