package email.labeler.app.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CacheStats {
    long totalProcessed;
    long classified;
    long labeled;
    long pendingLabels;
    @Builder.Default
    Map<String, Long> categoryDistribution = Map.of();
    @Builder.Default
    Map<String, Long> methodDistribution = Map.of();

    /** Share of processed messages that received a category, 0 when nothing was processed. */
    public double getClassificationRate() {
        return totalProcessed == 0 ? 0.0 : (double) classified / totalProcessed;
    }

    /** Share of classified messages whose label has been applied. */
    public double getLabelingRate() {
        return classified == 0 ? 0.0 : (double) labeled / classified;
    }
}
