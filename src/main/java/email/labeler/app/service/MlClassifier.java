package email.labeler.app.service;

import email.labeler.app.model.Email;
import email.labeler.app.model.Prediction;

/**
 * Machine-learned category predictor. Implementations never throw for a single message:
 * a model that is missing, unconfigured or failing answers {@link Prediction#unavailable()}.
 */
public interface MlClassifier {

    /**
     * Predict the category of a message.
     * @param email message to classify
     * @return category and confidence in [0, 1], or an unavailable prediction
     */
    Prediction predict(Email email);

    /**
     * @return whether a model is configured and loaded
     */
    boolean isAvailable();
}
