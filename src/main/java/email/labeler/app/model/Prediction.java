package email.labeler.app.model;

import lombok.Value;

/**
 * A single (category, confidence) signal. An unavailable prediction always carries
 * no category and zero confidence.
 */
@Value
public class Prediction {
    private static final Prediction UNAVAILABLE = new Prediction(null, 0.0, false);
    private static final Prediction EMPTY = new Prediction(null, 0.0, true);

    String category;
    double confidence;
    boolean available;

    public static Prediction of(String category, double confidence) {
        if (category == null) {
            return EMPTY;
        }
        return new Prediction(category, Math.max(0.0, confidence), true);
    }

    public static Prediction none() {
        return EMPTY;
    }

    public static Prediction unavailable() {
        return UNAVAILABLE;
    }
}
