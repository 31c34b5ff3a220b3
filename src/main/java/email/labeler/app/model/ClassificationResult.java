package email.labeler.app.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder(toBuilder = true)
public class ClassificationResult {
    String category;
    double confidence;
    ClassificationMethod method;
    @Builder.Default
    Map<String, Double> categoryScores = Map.of();

    public boolean isClassified() {
        return category != null;
    }

    public static ClassificationResult unclassified(ClassificationMethod method, Map<String, Double> categoryScores) {
        return ClassificationResult.builder()
            .confidence(0.0)
            .method(method)
            .categoryScores(categoryScores)
            .build();
    }
}
