package email.labeler.app.controller;

import email.labeler.app.model.CacheStats;
import email.labeler.app.model.LabelingOutcome;
import email.labeler.app.service.ClassificationPipeline;
import email.labeler.app.service.EmailCacheService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;

@RestController
@RequestMapping("/api/cache")
public class CacheController {
    private final EmailCacheService cacheService;
    private final ClassificationPipeline pipeline;
    private final int defaultLabelBatchSize;
    private final Path exportDir;

    public CacheController(EmailCacheService cacheService,
                           ClassificationPipeline pipeline,
                           @Value("${pipeline.label-batch-size:100}") int defaultLabelBatchSize,
                           @Value("${cache.export-dir:./data/exports}") String exportDir) {
        this.cacheService = cacheService;
        this.pipeline = pipeline;
        this.defaultLabelBatchSize = defaultLabelBatchSize;
        this.exportDir = Path.of(exportDir).toAbsolutePath().normalize();
    }

    @GetMapping("/stats")
    public CacheStats stats() {
        return cacheService.stats();
    }

    @PostMapping("/apply-labels")
    public LabelingOutcome applyLabels(@RequestParam(required = false) Integer batchSize) {
        return pipeline.applyLabelsFromCache(batchSize != null ? batchSize : defaultLabelBatchSize);
    }

    /**
     * Exports the cache to a file inside {@code cache.export-dir}. Names that resolve outside it are rejected.
     */
    @PostMapping("/export")
    public Map<String, Object> export(@RequestParam String path) {
        Path target = resolveExportFile(path);
        int exported = cacheService.export(target);
        return Map.of("path", target.toString(), "exported", exported);
    }

    @DeleteMapping("/entries")
    public Map<String, Object> cleanup(@RequestParam int olderThanDays) {
        int deleted = pipeline.cleanupCache(olderThanDays);
        return Map.of("olderThanDays", olderThanDays, "deleted", deleted);
    }

    Path resolveExportFile(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Export file name must not be empty");
        }
        Path target;
        try {
            target = exportDir.resolve(name).normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid export file name: " + name, e);
        }
        if (!target.startsWith(exportDir) || target.equals(exportDir)) {
            throw new IllegalArgumentException("Export file must be inside " + exportDir + ": " + name);
        }
        return target;
    }
}
