package email.labeler.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import email.labeler.app.model.CategoryConfigStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini predictor, called over REST.
 */
@Slf4j
public class GeminiMlClassifier extends LlmMlClassifier {
    static final String GEMINI_API_URL = "https://generativelanguage.googleapis.com/v1beta/models/gemini-pro:generateContent";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public GeminiMlClassifier(RestTemplate restTemplate, String apiKey,
                              CategoryConfigStore configStore, ObjectMapper objectMapper) {
        super(configStore, objectMapper);
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;

        if (!isAvailable()) {
            log.warn("Gemini API key not configured. Set gemini.api.key in application.properties or environment variable.");
        }
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isEmpty() && !apiKey.startsWith("${");
    }

    @Override
    protected String providerName() {
        return "Gemini";
    }

    @Override
    protected String complete(String prompt) throws Exception {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> requestBody = new HashMap<>();
        Map<String, Object> contents = new HashMap<>();
        Map<String, Object> part = new HashMap<>();
        part.put("text", prompt);
        contents.put("parts", List.of(part));
        requestBody.put("contents", List.of(contents));

        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("maxOutputTokens", 60);
        generationConfig.put("temperature", 0.0f);
        requestBody.put("generationConfig", generationConfig);

        HttpEntity<Map<String, Object>> request = new HttpEntity<>(requestBody, headers);
        ResponseEntity<String> response = restTemplate.postForEntity(GEMINI_API_URL + "?key=" + apiKey, request, String.class);

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new IllegalStateException("Gemini API error: " + response.getStatusCode() + " - " + response.getBody());
        }
        JsonNode parts = objectMapper.readTree(response.getBody())
            .path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            throw new IllegalStateException("Unexpected Gemini API response format: " + response.getBody());
        }
        return parts.get(0).path("text").asText();
    }
}
