package email.labeler.app.service;

import email.labeler.app.model.LabelingOutcome;
import email.labeler.app.remote.ErrorKind;
import email.labeler.app.remote.RemoteResult;
import email.labeler.app.remote.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Applies category labels in batches. A batch is marked labeled in the cache only after the
 * remote call for it succeeded; a failed batch falls back to one call per message.
 * Batches run one after another.
 */
@Slf4j
@Component
public class LabelApplier {
    private final GmailApiService gmailApiService;
    private final EmailCacheService cacheService;
    private final RetryPolicy retryPolicy;

    public LabelApplier(GmailApiService gmailApiService, EmailCacheService cacheService, RetryPolicy retryPolicy) {
        this.gmailApiService = gmailApiService;
        this.cacheService = cacheService;
        this.retryPolicy = retryPolicy;
    }

    /**
     * @param categoryByMessageId category to apply, per message id, in application order
     * @param batchSize           ids per batch call, clamped to 1..100
     * @param stopRequested       checked before every batch
     */
    public LabelingOutcome apply(Map<String, String> categoryByMessageId, int batchSize, BooleanSupplier stopRequested) {
        if (categoryByMessageId.isEmpty()) {
            return LabelingOutcome.empty();
        }
        int size = clampBatchSize(batchSize);

        Map<String, List<String>> idsByCategory = new LinkedHashMap<>();
        categoryByMessageId.forEach((messageId, category) ->
            idsByCategory.computeIfAbsent(category, key -> new ArrayList<>()).add(messageId));

        Map<String, String> labelIds = loadLabels();
        int labeled = 0;
        int skipped = 0;
        int failed = 0;
        boolean interrupted = false;

        for (Map.Entry<String, List<String>> entry : idsByCategory.entrySet()) {
            String category = entry.getKey();
            List<String> messageIds = entry.getValue();
            if (stopRequested.getAsBoolean()) {
                interrupted = true;
                break;
            }

            String labelId = resolveLabelId(category, labelIds);
            if (labelId == null) {
                log.error("No label available for category '{}', {} messages left unlabeled", category, messageIds.size());
                failed += messageIds.size();
                continue;
            }

            int batches = (messageIds.size() + size - 1) / size;
            for (int i = 0; i < messageIds.size(); i += size) {
                if (stopRequested.getAsBoolean()) {
                    log.info("Stop requested, leaving {} messages of '{}' for the next run", messageIds.size() - i, category);
                    interrupted = true;
                    break;
                }
                List<String> batch = List.copyOf(messageIds.subList(i, Math.min(i + size, messageIds.size())));
                log.info("Applying label '{}' batch {}/{} ({} messages)", category, i / size + 1, batches, batch.size());

                BatchResult result = applyBatch(batch, labelId);
                labeled += result.labeled;
                skipped += result.skipped;
                failed += result.failed;
            }
            if (interrupted) {
                break;
            }
        }

        log.info("Label application finished: {} labeled, {} skipped, {} failed{}",
                labeled, skipped, failed, interrupted ? " (interrupted)" : "");
        return LabelingOutcome.builder()
            .labeled(labeled)
            .skipped(skipped)
            .failed(failed)
            .interrupted(interrupted)
            .build();
    }

    static int clampBatchSize(int batchSize) {
        return Math.max(1, Math.min(batchSize, GmailApiService.MAX_BATCH_MODIFY_IDS));
    }

    private BatchResult applyBatch(List<String> batch, String labelId) {
        RemoteResult<Void> batchResult = retryPolicy.execute("batchModify(" + batch.size() + ")", () -> {
            gmailApiService.batchModify(batch, List.of(labelId), List.of());
            return null;
        });
        BatchResult result = new BatchResult();
        if (batchResult.isSuccess()) {
            cacheService.batchMarkLabeled(batch);
            result.labeled = batch.size();
            return result;
        }

        log.warn("Batch label call failed ({}), applying labels one by one", batchResult.describeError());
        List<String> succeeded = new ArrayList<>();
        for (String messageId : batch) {
            RemoteResult<Void> single = retryPolicy.execute("addLabel(" + messageId + ")", () -> {
                gmailApiService.addLabel(messageId, labelId);
                return null;
            });
            if (single.isSuccess()) {
                succeeded.add(messageId);
            } else if (single.getErrorKind() == ErrorKind.NOT_FOUND || single.getErrorKind() == ErrorKind.CONFLICT) {
                log.warn("Skipping message {}: {}", messageId, single.describeError());
                result.skipped++;
            } else {
                log.error("Failed to label message {}: {}", messageId, single.describeError());
                result.failed++;
            }
        }
        cacheService.batchMarkLabeled(succeeded);
        result.labeled = succeeded.size();
        return result;
    }

    private Map<String, String> loadLabels() {
        RemoteResult<Map<String, String>> labels = retryPolicy.execute("getLabels", gmailApiService::getLabels);
        if (!labels.isSuccess()) {
            log.warn("Could not list labels ({}), labels will be created on demand", labels.describeError());
            return new LinkedHashMap<>();
        }
        return new LinkedHashMap<>(labels.getValue());
    }

    private String resolveLabelId(String category, Map<String, String> labelIds) {
        String existing = labelIds.get(category);
        if (existing != null) {
            return existing;
        }
        RemoteResult<String> created = retryPolicy.execute("createLabel(" + category + ")",
                () -> gmailApiService.createLabel(category));
        if (created.isSuccess()) {
            labelIds.put(category, created.getValue());
            return created.getValue();
        }
        if (created.getErrorKind() == ErrorKind.CONFLICT) {
            // Created concurrently elsewhere; use the existing one
            labelIds.putAll(loadLabels());
            return labelIds.get(category);
        }
        log.error("Could not create label '{}': {}", category, created.describeError());
        return null;
    }

    private static class BatchResult {
        int labeled;
        int skipped;
        int failed;
    }
}
