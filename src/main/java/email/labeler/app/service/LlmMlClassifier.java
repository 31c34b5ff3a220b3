package email.labeler.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import email.labeler.app.model.CategoryConfigStore;
import email.labeler.app.model.Email;
import email.labeler.app.model.Prediction;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Base for predictors backed by a chat completion model. Subclasses only send the prompt;
 * prompt construction and answer parsing live here.
 */
@Slf4j
public abstract class LlmMlClassifier implements MlClassifier {
    private static final int MAX_CONTENT_CHARS = 2000;

    private final CategoryConfigStore configStore;
    private final ObjectMapper objectMapper;

    protected LlmMlClassifier(CategoryConfigStore configStore, ObjectMapper objectMapper) {
        this.configStore = configStore;
        this.objectMapper = objectMapper;
    }

    /**
     * Send the prompt and return the raw model answer.
     */
    protected abstract String complete(String prompt) throws Exception;

    protected abstract String providerName();

    @Override
    public Prediction predict(Email email) {
        if (!isAvailable()) {
            return Prediction.unavailable();
        }
        try {
            String answer = complete(buildPrompt(email));
            return parseAnswer(answer);
        } catch (Exception e) {
            log.warn("{} prediction failed for message {}: {}", providerName(), email.getMessageId(), e.getMessage());
            return Prediction.unavailable();
        }
    }

    String buildPrompt(Email email) {
        StringBuilder categoriesList = new StringBuilder();
        for (String name : configStore.getCategoryNames()) {
            categoriesList.append("- ").append(name).append('\n');
        }
        String content = email.contentText();
        if (content.length() > MAX_CONTENT_CHARS) {
            content = content.substring(0, MAX_CONTENT_CHARS) + "...";
        }
        return String.format(
            "Classify the following email into exactly one of these categories:\n\n%s\n" +
            "From: %s\nSubject: %s\n\n%s\n\n" +
            "Respond with ONLY a JSON object of the form {\"category\": \"<category name>\", \"confidence\": <0.0-1.0>}. " +
            "Use {\"category\": null, \"confidence\": 0.0} if no category fits.",
            categoriesList,
            email.getSender() != null ? email.getSender() : "",
            email.getSubject() != null ? email.getSubject() : "",
            content
        );
    }

    Prediction parseAnswer(String answer) throws Exception {
        if (answer == null || answer.isBlank()) {
            return Prediction.none();
        }
        String json = answer.trim();
        int start = json.indexOf('{');
        int end = json.lastIndexOf('}');
        if (start < 0 || end <= start) {
            log.debug("{} answer is not JSON: {}", providerName(), answer);
            return Prediction.none();
        }
        JsonNode node = objectMapper.readTree(json.substring(start, end + 1));
        String category = node.path("category").isTextual() ? node.path("category").asText().trim() : null;
        double confidence = Math.min(1.0, Math.max(0.0, node.path("confidence").asDouble(0.0)));

        List<String> known = configStore.getCategoryNames();
        if (category == null || !known.contains(category)) {
            if (category != null) {
                log.debug("{} suggested unknown category '{}'", providerName(), category);
            }
            return Prediction.none();
        }
        return Prediction.of(category, confidence);
    }
}
