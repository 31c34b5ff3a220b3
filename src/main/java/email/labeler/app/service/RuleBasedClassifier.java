package email.labeler.app.service;

import email.labeler.app.model.CategoryConfig;
import email.labeler.app.model.CategoryConfigStore;
import email.labeler.app.model.ClassificationMethod;
import email.labeler.app.model.ClassificationMode;
import email.labeler.app.model.ClassificationResult;
import email.labeler.app.model.Email;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores every configured category and keeps the best one. Categories are visited in
 * configuration order and a later category must score strictly higher to win, so on a
 * tie the category declared first is chosen.
 */
@Slf4j
@Service
public class RuleBasedClassifier implements ClassificationStrategy {
    private final CategoryConfigStore configStore;
    private final RuleScorer ruleScorer;

    public RuleBasedClassifier(CategoryConfigStore configStore, RuleScorer ruleScorer) {
        this.configStore = configStore;
        this.ruleScorer = ruleScorer;
    }

    @Override
    public ClassificationMode mode() {
        return ClassificationMode.RULE_BASED;
    }

    @Override
    public ClassificationResult classify(Email email) {
        Map<String, Double> scores = new LinkedHashMap<>();
        String bestCategory = null;
        double bestScore = Double.NEGATIVE_INFINITY;

        for (CategoryConfig category : configStore.getCategories()) {
            double score = ruleScorer.score(email, category,
                    configStore.getScoringWeights(), configStore.getGlobalSettings());
            scores.put(category.getName(), score);
            if (score > bestScore) {
                bestScore = score;
                bestCategory = category.getName();
            }
        }

        double threshold = configStore.getGlobalSettings().getConfidenceThreshold();
        if (bestCategory == null || bestScore < threshold) {
            log.debug("Rule score too low for message {}: best {} < threshold {}",
                    email.getMessageId(), bestScore, threshold);
            return ClassificationResult.unclassified(ClassificationMethod.RULE_BASED, scores);
        }

        log.debug("Rule-based classification of message {}: '{}' ({})",
                email.getMessageId(), bestCategory, bestScore);
        return ClassificationResult.builder()
            .category(bestCategory)
            .confidence(bestScore)
            .method(ClassificationMethod.RULE_BASED)
            .categoryScores(scores)
            .build();
    }
}
