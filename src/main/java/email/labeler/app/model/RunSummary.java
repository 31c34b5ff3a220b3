package email.labeler.app.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Outcome counts of one pipeline run. Per-message failures end up here instead of
 * aborting the run.
 */
@Value
@Builder
public class RunSummary {
    int total;
    int alreadyLabeled;
    int cacheHits;
    int fetched;
    int fetchSkipped;
    int classified;
    int unclassified;
    int errors;
    int labeled;
    int labelSkipped;
    int labelFailed;
    boolean interrupted;
    @Builder.Default
    Map<String, Integer> categoryDistribution = Map.of();
    double averageConfidence;
    double minConfidence;
    double maxConfidence;
}
