package email.labeler.app.service;

import email.labeler.app.model.ClassificationMethod;
import email.labeler.app.model.ClassificationMode;
import email.labeler.app.model.ClassificationResult;
import email.labeler.app.model.Email;
import email.labeler.app.model.Prediction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Classification by the ML predictor alone. Predictions below {@code ml.min-confidence}
 * leave the message unclassified.
 */
@Slf4j
@Service
public class MlClassificationStrategy implements ClassificationStrategy {
    private final MlClassifier mlClassifier;
    private final double minConfidence;

    public MlClassificationStrategy(MlClassifier mlClassifier,
                                    @Value("${ml.min-confidence:0.3}") double minConfidence) {
        this.mlClassifier = mlClassifier;
        this.minConfidence = minConfidence;
    }

    @Override
    public ClassificationMode mode() {
        return ClassificationMode.ML;
    }

    @Override
    public ClassificationResult classify(Email email) {
        Prediction prediction = mlClassifier.predict(email);
        if (!prediction.isAvailable() || prediction.getCategory() == null || prediction.getConfidence() <= minConfidence) {
            log.debug("No ML classification for message {} (available={}, confidence={})",
                    email.getMessageId(), prediction.isAvailable(), prediction.getConfidence());
            return ClassificationResult.unclassified(ClassificationMethod.ML, Map.of());
        }
        return ClassificationResult.builder()
            .category(prediction.getCategory())
            .confidence(prediction.getConfidence())
            .method(ClassificationMethod.ML)
            .categoryScores(Map.of(prediction.getCategory(), prediction.getConfidence()))
            .build();
    }
}
