package email.labeler.app.model;

import lombok.Builder;
import lombok.Value;

/**
 * Counts of one label application pass. {@code interrupted} is set when a stop request
 * prevented later batches from starting.
 */
@Value
@Builder
public class LabelingOutcome {
    int labeled;
    int skipped;
    int failed;
    boolean interrupted;

    public static LabelingOutcome empty() {
        return LabelingOutcome.builder().build();
    }
}
