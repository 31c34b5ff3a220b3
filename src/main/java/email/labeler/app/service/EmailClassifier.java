package email.labeler.app.service;

import email.labeler.app.exception.ConfigurationException;
import email.labeler.app.model.ClassificationMode;
import email.labeler.app.model.ClassificationResult;
import email.labeler.app.model.Email;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a message to the strategy registered for the requested mode.
 */
@Slf4j
@Service
public class EmailClassifier {
    private final Map<ClassificationMode, ClassificationStrategy> strategies = new EnumMap<>(ClassificationMode.class);

    public EmailClassifier(List<ClassificationStrategy> strategies) {
        for (ClassificationStrategy strategy : strategies) {
            ClassificationStrategy previous = this.strategies.put(strategy.mode(), strategy);
            if (previous != null) {
                throw new ConfigurationException("Duplicate classification strategy for mode " + strategy.mode());
            }
        }
        for (ClassificationMode mode : ClassificationMode.values()) {
            if (!this.strategies.containsKey(mode)) {
                throw new ConfigurationException("No classification strategy registered for mode " + mode);
            }
        }
        log.info("Email classifier initialized with modes {}", this.strategies.keySet());
    }

    public ClassificationResult classify(Email email, ClassificationMode mode) {
        return strategies.get(mode).classify(email);
    }
}
