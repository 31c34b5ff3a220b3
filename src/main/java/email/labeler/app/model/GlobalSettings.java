package email.labeler.app.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GlobalSettings {
    @Builder.Default
    double confidenceThreshold = 2.5;
    @Builder.Default
    int maxCategoriesPerEmail = 1;
    @Builder.Default
    boolean enableContentAnalysis = true;
    @Builder.Default
    boolean caseSensitive = false;
    @Builder.Default
    String language = "en";

    public static GlobalSettings defaults() {
        return GlobalSettings.builder().build();
    }
}
