package email.labeler.app.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScoringWeights {
    @Builder.Default
    double domainHighConfidence = 1.2;
    @Builder.Default
    double domainMediumConfidence = 0.8;
    @Builder.Default
    double subjectHigh = 1.0;
    @Builder.Default
    double subjectMedium = 0.6;
    @Builder.Default
    double contentHigh = 0.7;
    @Builder.Default
    double contentMedium = 0.4;
    @Builder.Default
    double exclusionPenalty = -2.0;
    @Builder.Default
    double negativeKeywordPenalty = -1.5;
    @Builder.Default
    double priorityBonus = 0.15;

    public static ScoringWeights defaults() {
        return ScoringWeights.builder().build();
    }
}
