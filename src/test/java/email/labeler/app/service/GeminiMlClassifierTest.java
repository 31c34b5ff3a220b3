package email.labeler.app.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import email.labeler.app.model.CategoryConfig;
import email.labeler.app.model.CategoryConfigStore;
import email.labeler.app.model.Email;
import email.labeler.app.model.GlobalSettings;
import email.labeler.app.model.Prediction;
import email.labeler.app.model.ScoringWeights;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GeminiMlClassifierTest {

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private CategoryConfigStore store;
    private Email email;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        store = new CategoryConfigStore(
            List.of(CategoryConfig.builder().name("Travel & Transport").build()),
            GlobalSettings.defaults(), ScoringWeights.defaults());
        email = Email.builder()
            .messageId("msg-7")
            .sender("tickets@irctc.co.in")
            .subject("E-ticket for PNR 1234567890")
            .bodyText("Your journey details")
            .build();
    }

    @Test
    void predict_WithCandidateAnswer_ShouldParseCategory() {
        // Given
        GeminiMlClassifier classifier = new GeminiMlClassifier(restTemplate, "test-key", store, new ObjectMapper());
        String body = "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":"
            + "\"{\\\"category\\\": \\\"Travel & Transport\\\", \\\"confidence\\\": 0.65}\"}]}}]}";
        server.expect(requestTo(GeminiMlClassifier.GEMINI_API_URL + "?key=test-key"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.generationConfig.maxOutputTokens").value(60))
            .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        // When
        Prediction prediction = classifier.predict(email);

        // Then
        server.verify();
        assertEquals("Travel & Transport", prediction.getCategory());
        assertEquals(0.65, prediction.getConfidence(), 1e-9);
    }

    @Test
    void predict_WhenServerFails_ShouldReturnUnavailable() {
        // Given
        GeminiMlClassifier classifier = new GeminiMlClassifier(restTemplate, "test-key", store, new ObjectMapper());
        server.expect(requestTo(GeminiMlClassifier.GEMINI_API_URL + "?key=test-key"))
            .andRespond(withServerError());

        // When
        Prediction prediction = classifier.predict(email);

        // Then
        assertFalse(prediction.isAvailable());
    }

    @Test
    void predict_WithoutApiKey_ShouldNotCallApi() {
        // Given
        GeminiMlClassifier classifier = new GeminiMlClassifier(restTemplate, "", store, new ObjectMapper());

        // When
        Prediction prediction = classifier.predict(email);

        // Then
        server.verify();
        assertFalse(classifier.isAvailable());
        assertFalse(prediction.isAvailable());
    }
}
