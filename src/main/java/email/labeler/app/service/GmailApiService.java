package email.labeler.app.service;

import email.labeler.app.model.Email;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Mail client operations used by the pipeline.
 * Calls throw the client's exceptions unchanged; retry decisions are made by the caller.
 */
public interface GmailApiService {
    /** Maximum number of message ids accepted by one batch modify call. */
    int MAX_BATCH_MODIFY_IDS = 100;

    /**
     * Search message ids, paging through results.
     * @param query Gmail search query (e.g. "is:unread", "from:example.com")
     * @param maxResults maximum number of ids, or null for all matches
     * @return matching message ids
     * @throws Exception if API call fails
     */
    List<String> search(String query, Integer maxResults) throws Exception;

    /**
     * Get a single message.
     * @param messageId Gmail message ID
     * @param format fetch format
     * @return the message
     * @throws Exception if API call fails
     */
    Email getMessage(String messageId, MessageFormat format) throws Exception;

    /**
     * Lazily fetch several messages, one call per id, in the given order.
     * Not used by {@link ClassificationPipeline}, which calls {@link #getMessage} per id so every
     * fetch goes through its own retry and failure classification.
     * @param messageIds Gmail message IDs
     * @param format fetch format
     * @return stream of messages; a failing fetch surfaces as an exception while consuming the stream
     */
    default Stream<Email> getMessages(List<String> messageIds, MessageFormat format) {
        return messageIds.stream().map(id -> {
            try {
                return getMessage(id, format);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException("Failed to fetch message " + id, e);
            }
        });
    }

    /**
     * Get all labels.
     * @return label name to label ID
     * @throws Exception if API call fails
     */
    Map<String, String> getLabels() throws Exception;

    /**
     * Create a label.
     * @param name label name
     * @return created label ID
     * @throws Exception if API call fails
     */
    String createLabel(String name) throws Exception;

    /**
     * Add one label to one message.
     * @param messageId Gmail message ID
     * @param labelId Gmail label ID
     * @throws Exception if API call fails
     */
    void addLabel(String messageId, String labelId) throws Exception;

    /**
     * Add and remove labels on up to {@value #MAX_BATCH_MODIFY_IDS} messages in one call.
     * @param messageIds Gmail message IDs
     * @param addLabelIds label IDs to add
     * @param removeLabelIds label IDs to remove
     * @throws Exception if API call fails
     */
    void batchModify(List<String> messageIds, List<String> addLabelIds, List<String> removeLabelIds) throws Exception;
}
