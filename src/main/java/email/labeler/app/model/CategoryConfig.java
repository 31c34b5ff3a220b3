package email.labeler.app.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Matching rules for one category. Priority runs from 1 (most important) to 10.
 */
@Value
@Builder
public class CategoryConfig {
    String name;
    @Builder.Default
    int priority = 5;
    @Builder.Default
    List<String> highConfidenceDomains = List.of();
    @Builder.Default
    List<String> mediumConfidenceDomains = List.of();
    @Builder.Default
    List<String> subjectHighKeywords = List.of();
    @Builder.Default
    List<String> subjectMediumKeywords = List.of();
    @Builder.Default
    List<String> contentHighKeywords = List.of();
    @Builder.Default
    List<String> contentMediumKeywords = List.of();
    @Builder.Default
    List<String> exclusions = List.of();
    @Builder.Default
    List<String> negativeKeywords = List.of();
}
