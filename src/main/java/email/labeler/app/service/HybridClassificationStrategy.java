package email.labeler.app.service;

import email.labeler.app.model.ClassificationMode;
import email.labeler.app.model.ClassificationResult;
import email.labeler.app.model.Email;
import email.labeler.app.model.Prediction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Rule decision and ML prediction fused through {@link HybridDecisionMaker}. A rule result
 * under the confidence threshold enters the cascade with confidence 0.
 */
@Slf4j
@Service
public class HybridClassificationStrategy implements ClassificationStrategy {
    private final RuleBasedClassifier ruleBasedClassifier;
    private final MlClassifier mlClassifier;
    private final HybridDecisionMaker decisionMaker;

    public HybridClassificationStrategy(RuleBasedClassifier ruleBasedClassifier,
                                        MlClassifier mlClassifier,
                                        HybridDecisionMaker decisionMaker) {
        this.ruleBasedClassifier = ruleBasedClassifier;
        this.mlClassifier = mlClassifier;
        this.decisionMaker = decisionMaker;
    }

    @Override
    public ClassificationMode mode() {
        return ClassificationMode.HYBRID;
    }

    @Override
    public ClassificationResult classify(Email email) {
        ClassificationResult ruleResult = ruleBasedClassifier.classify(email);
        Prediction rule = ruleResult.isClassified()
            ? Prediction.of(ruleResult.getCategory(), ruleResult.getConfidence())
            : Prediction.none();
        Prediction ml = mlClassifier.predict(email);

        ClassificationResult decision = decisionMaker.decide(rule, ml);
        log.debug("Hybrid decision for message {}: {} via {} (rule={}, ml={})",
                email.getMessageId(), decision.getCategory(), decision.getMethod().wireValue(),
                rule.getConfidence(), ml.getConfidence());
        return decision.toBuilder()
            .categoryScores(ruleResult.getCategoryScores())
            .build();
    }
}
