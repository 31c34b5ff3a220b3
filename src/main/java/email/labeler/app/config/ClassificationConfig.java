package email.labeler.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import email.labeler.app.model.CategoryConfigStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads the category configuration once at startup. An invalid configuration
 * fails the application context.
 */
@Configuration
public class ClassificationConfig {

    @Bean
    public CategoryConfigStore categoryConfigStore(
            ObjectMapper objectMapper,
            ResourceLoader resourceLoader,
            @Value("${categories.base-file:classpath:email_categories.json}") String baseFile,
            @Value("${categories.custom-file:file:./data/custom_email_rules.json}") String customFile) {
        CategoryConfigLoader loader = new CategoryConfigLoader(objectMapper);
        return loader.load(
            resourceLoader.getResource(baseFile),
            customFile.isBlank() ? null : resourceLoader.getResource(customFile));
    }
}
