package email.labeler.app.model;

/**
 * Classification strategy requested for a run.
 */
public enum ClassificationMode {
    RULE_BASED,
    ML,
    HYBRID
}
