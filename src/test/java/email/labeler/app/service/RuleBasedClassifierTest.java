package email.labeler.app.service;

import email.labeler.app.model.CategoryConfig;
import email.labeler.app.model.CategoryConfigStore;
import email.labeler.app.model.ClassificationMethod;
import email.labeler.app.model.ClassificationResult;
import email.labeler.app.model.Email;
import email.labeler.app.model.GlobalSettings;
import email.labeler.app.model.ScoringWeights;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleBasedClassifierTest {
    private static final double DELTA = 1e-9;

    private final RuleScorer ruleScorer = new RuleScorer();

    private static CategoryConfig shopping() {
        return CategoryConfig.builder()
            .name("Shopping & Orders")
            .priority(3)
            .highConfidenceDomains(List.of("flipkart.com"))
            .subjectHighKeywords(List.of("order", "shipped", "delivered"))
            .exclusions(List.of("unsubscribe", "sale"))
            .negativeKeywords(List.of("sale", "% off"))
            .build();
    }

    private static CategoryConfig promotions() {
        return CategoryConfig.builder()
            .name("Promotions & Marketing")
            .priority(5)
            .mediumConfidenceDomains(List.of("flipkart.com"))
            .subjectHighKeywords(List.of("sale", "big billion days"))
            .contentHighKeywords(List.of("unsubscribe"))
            .contentMediumKeywords(List.of("offer"))
            .build();
    }

    private RuleBasedClassifier classifier(double threshold, CategoryConfig... categories) {
        CategoryConfigStore store = new CategoryConfigStore(List.of(categories),
                GlobalSettings.builder().confidenceThreshold(threshold).build(), ScoringWeights.defaults());
        return new RuleBasedClassifier(store, ruleScorer);
    }

    @Test
    void classify_FlipkartSale_ShouldPickPromotionsOverShopping() {
        // Given
        RuleBasedClassifier classifier = classifier(2.5, shopping(), promotions());
        Email email = Email.builder()
            .messageId("msg-1")
            .sender("offers@flipkart.com")
            .subject("Big Billion Days Sale")
            .bodyText("Huge offers inside. Click to unsubscribe.")
            .build();

        // When
        ClassificationResult result = classifier.classify(email);

        // Then
        assertEquals("Promotions & Marketing", result.getCategory());
        assertEquals(4.65, result.getConfidence(), DELTA);
        assertEquals(ClassificationMethod.RULE_BASED, result.getMethod());
        assertEquals(-1.25, result.getCategoryScores().get("Shopping & Orders"), DELTA);
        assertEquals(List.of("Shopping & Orders", "Promotions & Marketing"),
                List.copyOf(result.getCategoryScores().keySet()));
    }

    @Test
    void classify_OrderShipped_ShouldPickShopping() {
        // Given
        RuleBasedClassifier classifier = classifier(2.5, shopping(), promotions());
        Email email = Email.builder()
            .messageId("msg-2")
            .sender("noreply@flipkart.com")
            .subject("Your order has been shipped")
            .bodyText("Track your package.")
            .build();

        // When
        ClassificationResult result = classifier.classify(email);

        // Then: 1.2 domain + 2.0 subject + 1.05 priority
        assertEquals("Shopping & Orders", result.getCategory());
        assertEquals(4.25, result.getConfidence(), DELTA);
    }

    @Test
    void classify_BestScoreBelowThreshold_ShouldReturnNoCategoryWithScores() {
        // Given
        RuleBasedClassifier classifier = classifier(2.5, shopping(), promotions());
        Email email = Email.builder()
            .messageId("msg-3")
            .sender("friend@example.org")
            .subject("Lunch tomorrow?")
            .bodyText("Let me know.")
            .build();

        // When
        ClassificationResult result = classifier.classify(email);

        // Then
        assertFalse(result.isClassified());
        assertEquals(0.0, result.getConfidence(), DELTA);
        assertEquals(ClassificationMethod.RULE_BASED, result.getMethod());
        assertEquals(2, result.getCategoryScores().size());
    }

    @Test
    void classify_ScoreEqualToThreshold_ShouldClassify() {
        // Given: priority 10 gives no bonus, one subject_high keyword scores exactly 1.0
        CategoryConfig exact = CategoryConfig.builder()
            .name("Exact")
            .priority(10)
            .subjectHighKeywords(List.of("report"))
            .build();
        RuleBasedClassifier classifier = classifier(1.0, exact);
        Email email = Email.builder().messageId("msg-4").sender("a@b.org").subject("Monthly report").build();

        // When
        ClassificationResult result = classifier.classify(email);

        // Then
        assertEquals("Exact", result.getCategory());
    }

    @Test
    void classify_TiedScores_ShouldPickCategoryDeclaredFirst() {
        // Given
        CategoryConfig first = CategoryConfig.builder()
            .name("First")
            .priority(5)
            .subjectHighKeywords(List.of("meeting"))
            .build();
        CategoryConfig second = CategoryConfig.builder()
            .name("Second")
            .priority(5)
            .subjectHighKeywords(List.of("meeting"))
            .build();
        Email email = Email.builder().messageId("msg-5").sender("x@y.org").subject("Team meeting").build();

        // When
        ClassificationResult forward = classifier(1.0, first, second).classify(email);
        ClassificationResult reversed = classifier(1.0, second, first).classify(email);

        // Then
        assertEquals("First", forward.getCategory());
        assertEquals("Second", reversed.getCategory());
        assertEquals(forward.getConfidence(), reversed.getConfidence(), DELTA);
    }
}
