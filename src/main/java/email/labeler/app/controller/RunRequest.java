package email.labeler.app.controller;

import email.labeler.app.model.ClassificationMode;
import lombok.Data;

import java.util.List;

/**
 * Body of a run request. Explicit {@code messageIds} take precedence over {@code query}.
 */
@Data
public class RunRequest {
    private List<String> messageIds;
    private String query;
    private Integer maxResults;
    private ClassificationMode mode = ClassificationMode.HYBRID;
    private boolean useCache = true;
    private boolean applyLabels = false;
    private Integer labelBatchSize;
}
