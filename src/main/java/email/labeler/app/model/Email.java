package email.labeler.app.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * A fetched mail message. Never mutated after it is built.
 */
@Value
@Builder(toBuilder = true)
public class Email {
    String messageId;
    String threadId;
    String sender;
    @Builder.Default
    List<String> recipients = List.of();
    String subject;
    String snippet;
    String bodyText;
    @Builder.Default
    List<String> labelIds = List.of();
    Instant receivedAt;

    /**
     * Domain part of the sender address, lower-cased, or an empty string when the sender has no '@'.
     * "Shop &lt;offers@flipkart.com&gt;" yields "flipkart.com".
     */
    public String senderDomain() {
        if (sender == null) {
            return "";
        }
        int at = sender.lastIndexOf('@');
        if (at < 0) {
            return "";
        }
        String domain = sender.substring(at + 1).trim();
        int end = domain.indexOf('>');
        if (end >= 0) {
            domain = domain.substring(0, end);
        }
        return domain.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Text used for content analysis: the body when present, the snippet otherwise.
     */
    public String contentText() {
        if (bodyText != null && !bodyText.isBlank()) {
            return bodyText;
        }
        return snippet != null ? snippet : "";
    }
}
