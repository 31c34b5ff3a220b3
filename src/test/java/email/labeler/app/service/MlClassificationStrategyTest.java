package email.labeler.app.service;

import email.labeler.app.model.ClassificationMethod;
import email.labeler.app.model.ClassificationResult;
import email.labeler.app.model.Email;
import email.labeler.app.model.Prediction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MlClassificationStrategyTest {

    @Mock
    private MlClassifier mlClassifier;

    private final Email email = Email.builder().messageId("msg-1").subject("Hi").build();

    @Test
    void classify_ConfidentPrediction_ShouldReturnMlResult() {
        // Given
        when(mlClassifier.predict(email)).thenReturn(Prediction.of("Work & Career", 0.55));
        MlClassificationStrategy strategy = new MlClassificationStrategy(mlClassifier, 0.3);

        // When
        ClassificationResult result = strategy.classify(email);

        // Then
        assertEquals("Work & Career", result.getCategory());
        assertEquals(ClassificationMethod.ML, result.getMethod());
        assertEquals(0.55, result.getConfidence(), 1e-9);
    }

    @Test
    void classify_PredictionAtMinimum_ShouldLeaveUnclassified() {
        // Given
        when(mlClassifier.predict(email)).thenReturn(Prediction.of("Work & Career", 0.3));
        MlClassificationStrategy strategy = new MlClassificationStrategy(mlClassifier, 0.3);

        // When
        ClassificationResult result = strategy.classify(email);

        // Then
        assertFalse(result.isClassified());
        assertEquals(ClassificationMethod.ML, result.getMethod());
    }

    @Test
    void classify_UnavailablePredictor_ShouldLeaveUnclassified() {
        // Given
        when(mlClassifier.predict(email)).thenReturn(Prediction.unavailable());
        MlClassificationStrategy strategy = new MlClassificationStrategy(mlClassifier, 0.3);

        // When
        ClassificationResult result = strategy.classify(email);

        // Then
        assertFalse(result.isClassified());
    }
}
