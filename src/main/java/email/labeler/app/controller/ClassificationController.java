package email.labeler.app.controller;

import email.labeler.app.model.RunSummary;
import email.labeler.app.service.ClassificationPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/classification")
public class ClassificationController {
    private final ClassificationPipeline pipeline;
    private final int defaultLabelBatchSize;

    public ClassificationController(ClassificationPipeline pipeline,
                                    @Value("${pipeline.label-batch-size:100}") int defaultLabelBatchSize) {
        this.pipeline = pipeline;
        this.defaultLabelBatchSize = defaultLabelBatchSize;
    }

    @PostMapping("/runs")
    public RunSummary run(@RequestBody RunRequest request) {
        if (request.getMode() == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        List<String> messageIds;
        if (request.getMessageIds() != null && !request.getMessageIds().isEmpty()) {
            messageIds = request.getMessageIds();
        } else if (request.getQuery() != null && !request.getQuery().isBlank()) {
            messageIds = pipeline.search(request.getQuery(), request.getMaxResults());
        } else {
            throw new IllegalArgumentException("Either messageIds or query is required");
        }

        int batchSize = request.getLabelBatchSize() != null ? request.getLabelBatchSize() : defaultLabelBatchSize;
        log.info("Classification run requested: {} messages, mode {}", messageIds.size(), request.getMode());
        return pipeline.run(messageIds, request.getMode(), request.isUseCache(), request.isApplyLabels(), batchSize);
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        boolean wasRunning = pipeline.isRunning();
        pipeline.requestStop();
        return ResponseEntity.accepted().body(Map.of("stopRequested", true, "running", wasRunning));
    }
}
