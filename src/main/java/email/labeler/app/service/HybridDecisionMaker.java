package email.labeler.app.service;

import email.labeler.app.model.ClassificationMethod;
import email.labeler.app.model.ClassificationResult;
import email.labeler.app.model.Prediction;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Fuses a rule prediction and an ML prediction. Branches are evaluated in order and the
 * first one that matches decides:
 * <ol>
 *     <li>ML &gt; 0.7: ML result ({@code ml_high_confidence})</li>
 *     <li>rule &gt; 0.8: rule result ({@code rule_based_high_confidence})</li>
 *     <li>rule &gt; 0.5 and ML &lt; 0.6: rule result ({@code rule_based_moderate})</li>
 *     <li>ML &gt; 0.4: ML result ({@code ml_moderate})</li>
 *     <li>rule &gt; 0.3: rule result at 0.8 of its confidence ({@code rule_based_fallback})</li>
 *     <li>otherwise no category ({@code none})</li>
 * </ol>
 */
@Component
public class HybridDecisionMaker {
    static final double ML_HIGH = 0.7;
    static final double RULE_HIGH = 0.8;
    static final double RULE_MODERATE = 0.5;
    static final double ML_MODERATE_CEILING = 0.6;
    static final double ML_MODERATE = 0.4;
    static final double RULE_FALLBACK = 0.3;
    static final double FALLBACK_DISCOUNT = 0.8;

    public ClassificationResult decide(Prediction rule, Prediction ml) {
        double ruleConfidence = rule.getConfidence();
        double mlConfidence = ml.isAvailable() ? ml.getConfidence() : 0.0;

        if (mlConfidence > ML_HIGH) {
            return result(ml.getCategory(), mlConfidence, ClassificationMethod.ML_HIGH_CONFIDENCE);
        } else if (ruleConfidence > RULE_HIGH) {
            return result(rule.getCategory(), ruleConfidence, ClassificationMethod.RULE_BASED_HIGH_CONFIDENCE);
        } else if (ruleConfidence > RULE_MODERATE && mlConfidence < ML_MODERATE_CEILING) {
            return result(rule.getCategory(), ruleConfidence, ClassificationMethod.RULE_BASED_MODERATE);
        } else if (mlConfidence > ML_MODERATE) {
            return result(ml.getCategory(), mlConfidence, ClassificationMethod.ML_MODERATE);
        } else if (ruleConfidence > RULE_FALLBACK) {
            return result(rule.getCategory(), ruleConfidence * FALLBACK_DISCOUNT, ClassificationMethod.RULE_BASED_FALLBACK);
        }
        return ClassificationResult.unclassified(ClassificationMethod.NONE, Map.of());
    }

    private static ClassificationResult result(String category, double confidence, ClassificationMethod method) {
        if (category == null) {
            return ClassificationResult.unclassified(method, Map.of());
        }
        return ClassificationResult.builder()
            .category(category)
            .confidence(confidence)
            .method(method)
            .build();
    }
}
