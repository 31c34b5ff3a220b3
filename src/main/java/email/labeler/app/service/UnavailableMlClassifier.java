package email.labeler.app.service;

import email.labeler.app.model.Email;
import email.labeler.app.model.Prediction;

/**
 * Used when no ML provider is configured.
 */
public class UnavailableMlClassifier implements MlClassifier {

    @Override
    public Prediction predict(Email email) {
        return Prediction.unavailable();
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
