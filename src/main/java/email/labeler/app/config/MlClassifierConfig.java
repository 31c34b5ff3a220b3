package email.labeler.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.theokanning.openai.service.OpenAiService;
import email.labeler.app.model.CategoryConfigStore;
import email.labeler.app.service.GeminiMlClassifier;
import email.labeler.app.service.MlClassifier;
import email.labeler.app.service.OpenAiMlClassifier;
import email.labeler.app.service.UnavailableMlClassifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Selects the ML provider. Set ml.provider=none, openai or gemini in application.properties.
 */
@Configuration
public class MlClassifierConfig {

    @Bean
    @ConditionalOnProperty(name = "ml.provider", havingValue = "none", matchIfMissing = true)
    public MlClassifier unavailableMlClassifier() {
        return new UnavailableMlClassifier();
    }

    @Bean
    @ConditionalOnProperty(name = "ml.provider", havingValue = "openai")
    public MlClassifier openAiMlClassifier(@Value("${openai.api.key:}") String apiKey,
                                           @Value("${openai.model:gpt-3.5-turbo}") String model,
                                           CategoryConfigStore configStore,
                                           ObjectMapper objectMapper) {
        OpenAiService openAiService = new OpenAiService(apiKey, Duration.ofSeconds(30));
        return new OpenAiMlClassifier(openAiService, model, configStore, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "ml.provider", havingValue = "gemini")
    public MlClassifier geminiMlClassifier(@Value("${gemini.api.key:}") String apiKey,
                                           CategoryConfigStore configStore,
                                           ObjectMapper objectMapper) {
        return new GeminiMlClassifier(new RestTemplate(), apiKey, configStore, objectMapper);
    }
}
