package email.labeler.app.model;

import java.util.Arrays;

/**
 * How a classification decision was reached. The wire value is what gets persisted
 * in the {@code classification_method} column.
 */
public enum ClassificationMethod {
    RULE_BASED("rule_based"),
    ML("ml"),
    ML_HIGH_CONFIDENCE("ml_high_confidence"),
    RULE_BASED_HIGH_CONFIDENCE("rule_based_high_confidence"),
    RULE_BASED_MODERATE("rule_based_moderate"),
    ML_MODERATE("ml_moderate"),
    RULE_BASED_FALLBACK("rule_based_fallback"),
    NONE("none");

    private final String wireValue;

    ClassificationMethod(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static ClassificationMethod fromWireValue(String value) {
        return Arrays.stream(values())
            .filter(method -> method.wireValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown classification method: " + value));
    }
}
