package email.labeler.app.service;

import email.labeler.app.model.ClassificationMode;
import email.labeler.app.model.ClassificationResult;
import email.labeler.app.model.Email;

/**
 * One way of turning a message into a classification decision.
 */
public interface ClassificationStrategy {

    ClassificationMode mode();

    /**
     * @return a fresh result; never null, unclassified results carry a null category
     */
    ClassificationResult classify(Email email);
}
