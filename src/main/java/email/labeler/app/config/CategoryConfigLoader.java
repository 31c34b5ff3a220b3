package email.labeler.app.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import email.labeler.app.exception.ConfigurationException;
import email.labeler.app.model.CategoryConfig;
import email.labeler.app.model.CategoryConfigStore;
import email.labeler.app.model.GlobalSettings;
import email.labeler.app.model.ScoringWeights;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the category configuration: a base document plus an optional custom document
 * deep-merged on top of it (objects merged recursively, arrays appended, scalars replaced).
 */
@Slf4j
public class CategoryConfigLoader {
    private final ObjectMapper objectMapper;

    public CategoryConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CategoryConfigStore load(Resource baseFile, Resource customFile) {
        if (baseFile == null || !baseFile.exists()) {
            throw new ConfigurationException("Base category configuration not found: " + describe(baseFile));
        }
        ObjectNode merged = readObject(baseFile);
        log.info("Loaded base category configuration from {}", describe(baseFile));

        if (customFile != null && customFile.exists()) {
            merge(merged, readObject(customFile));
            log.info("Merged custom category rules from {}", describe(customFile));
        } else {
            log.info("No custom category rules found at {}", describe(customFile));
        }

        CategoryConfigStore store = parse(merged);
        List<String> issues = validate(store);
        if (!issues.isEmpty()) {
            throw new ConfigurationException(issues);
        }
        log.info("Parsed {} email categories (confidence threshold {})",
                store.getCategories().size(), store.getGlobalSettings().getConfidenceThreshold());
        return store;
    }

    CategoryConfigStore parse(JsonNode root) {
        List<CategoryConfig> categories = new ArrayList<>();
        JsonNode categoriesNode = root.path("categories");
        Iterator<Map.Entry<String, JsonNode>> fields = categoriesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            categories.add(parseCategory(entry.getKey(), entry.getValue()));
        }

        JsonNode settings = root.path("global_settings");
        GlobalSettings defaults = GlobalSettings.defaults();
        GlobalSettings globalSettings = GlobalSettings.builder()
            .confidenceThreshold(settings.path("confidence_threshold").asDouble(defaults.getConfidenceThreshold()))
            .maxCategoriesPerEmail(settings.path("max_categories_per_email").asInt(defaults.getMaxCategoriesPerEmail()))
            .enableContentAnalysis(settings.path("enable_content_analysis").asBoolean(defaults.isEnableContentAnalysis()))
            .caseSensitive(settings.path("case_sensitive").asBoolean(defaults.isCaseSensitive()))
            .language(settings.path("language").asText(defaults.getLanguage()))
            .build();

        JsonNode weights = root.path("scoring_weights");
        ScoringWeights w = ScoringWeights.defaults();
        ScoringWeights scoringWeights = ScoringWeights.builder()
            .domainHighConfidence(weights.path("domain_high_confidence").asDouble(w.getDomainHighConfidence()))
            .domainMediumConfidence(weights.path("domain_medium_confidence").asDouble(w.getDomainMediumConfidence()))
            .subjectHigh(weights.path("subject_high").asDouble(w.getSubjectHigh()))
            .subjectMedium(weights.path("subject_medium").asDouble(w.getSubjectMedium()))
            .contentHigh(weights.path("content_high").asDouble(w.getContentHigh()))
            .contentMedium(weights.path("content_medium").asDouble(w.getContentMedium()))
            .exclusionPenalty(weights.path("exclusion_penalty").asDouble(w.getExclusionPenalty()))
            .negativeKeywordPenalty(weights.path("negative_keyword_penalty").asDouble(w.getNegativeKeywordPenalty()))
            .priorityBonus(weights.path("priority_bonus").asDouble(w.getPriorityBonus()))
            .build();

        return new CategoryConfigStore(categories, globalSettings, scoringWeights);
    }

    List<String> validate(CategoryConfigStore store) {
        List<String> issues = new ArrayList<>();
        if (store.getCategories().isEmpty()) {
            issues.add("No email categories defined");
        }
        for (CategoryConfig category : store.getCategories()) {
            if (category.getPriority() < 1 || category.getPriority() > 10) {
                issues.add(String.format("Category '%s': priority must be 1-10", category.getName()));
            }
        }
        if (store.getGlobalSettings().getConfidenceThreshold() <= 0) {
            issues.add("confidence_threshold must be positive");
        }
        if (store.getGlobalSettings().getMaxCategoriesPerEmail() < 1) {
            issues.add("max_categories_per_email must be >= 1");
        }
        return issues;
    }

    static void merge(ObjectNode target, JsonNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode existing = target.get(entry.getKey());
            JsonNode incoming = entry.getValue();
            if (existing instanceof ObjectNode && incoming.isObject()) {
                merge((ObjectNode) existing, incoming);
            } else if (existing instanceof ArrayNode && incoming.isArray()) {
                ((ArrayNode) existing).addAll((ArrayNode) incoming);
            } else {
                target.set(entry.getKey(), incoming.deepCopy());
            }
        }
    }

    private CategoryConfig parseCategory(String name, JsonNode node) {
        JsonNode priority = node.path("priority");
        if (!priority.isMissingNode() && !priority.isIntegralNumber()) {
            throw new ConfigurationException(List.of(
                String.format("Category '%s': priority must be integer", name)));
        }
        JsonNode domains = node.path("domains");
        JsonNode keywords = node.path("keywords");
        return CategoryConfig.builder()
            .name(name)
            .priority(priority.asInt(5))
            .highConfidenceDomains(strings(domains.path("high_confidence")))
            .mediumConfidenceDomains(strings(domains.path("medium_confidence")))
            .subjectHighKeywords(strings(keywords.path("subject_high")))
            .subjectMediumKeywords(strings(keywords.path("subject_medium")))
            .contentHighKeywords(strings(keywords.path("content_high")))
            .contentMediumKeywords(strings(keywords.path("content_medium")))
            .exclusions(strings(node.path("exclusions")))
            .negativeKeywords(strings(node.path("negative_keywords")))
            .build();
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(value -> {
                if (value.isTextual() && !value.asText().isEmpty()) {
                    values.add(value.asText());
                }
            });
        }
        return List.copyOf(values);
    }

    private ObjectNode readObject(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            JsonNode node = objectMapper.readTree(in);
            if (node == null || !node.isObject()) {
                throw new ConfigurationException("Category configuration must be a JSON object: " + describe(resource));
            }
            return (ObjectNode) node;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read category configuration " + describe(resource), e);
        }
    }

    private static String describe(Resource resource) {
        return resource == null ? "<none>" : resource.getDescription();
    }
}
