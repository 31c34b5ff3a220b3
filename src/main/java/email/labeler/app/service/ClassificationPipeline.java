package email.labeler.app.service;

import email.labeler.app.entity.CachedEmail;
import email.labeler.app.exception.RemoteCallException;
import email.labeler.app.model.ClassificationMode;
import email.labeler.app.model.ClassificationResult;
import email.labeler.app.model.Email;
import email.labeler.app.model.LabelingOutcome;
import email.labeler.app.model.RunSummary;
import email.labeler.app.remote.ErrorKind;
import email.labeler.app.remote.RemoteResult;
import email.labeler.app.remote.RetryPolicy;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Batch classification and labeling run:
 * <ol>
 *   <li>messages already labeled are dropped,</li>
 *   <li>cached classifications are reused without fetching,</li>
 *   <li>the remaining messages are fetched and classified on the worker pool and stored in the cache,</li>
 *   <li>labels are applied batch by batch through {@link LabelApplier}.</li>
 * </ol>
 * Only one run executes at a time. {@link #requestStop()} stops new work from being submitted;
 * work already started finishes and is recorded.
 */
@Slf4j
@Service
public class ClassificationPipeline {
    private final GmailApiService gmailApiService;
    private final EmailClassifier emailClassifier;
    private final EmailCacheService cacheService;
    private final LabelApplier labelApplier;
    private final RetryPolicy retryPolicy;
    private final Executor executor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public ClassificationPipeline(GmailApiService gmailApiService,
                                  EmailClassifier emailClassifier,
                                  EmailCacheService cacheService,
                                  LabelApplier labelApplier,
                                  RetryPolicy retryPolicy,
                                  @Qualifier("classificationExecutor") Executor executor) {
        this.gmailApiService = gmailApiService;
        this.emailClassifier = emailClassifier;
        this.cacheService = cacheService;
        this.labelApplier = labelApplier;
        this.retryPolicy = retryPolicy;
        this.executor = executor;
    }

    private enum ItemStatus { CLASSIFIED, NOT_FOUND, FAILED, NOT_STARTED }

    private static final class ItemOutcome {
        final String messageId;
        final ItemStatus status;
        final ClassificationResult result;
        final boolean stored;

        ItemOutcome(String messageId, ItemStatus status, ClassificationResult result, boolean stored) {
            this.messageId = messageId;
            this.status = status;
            this.result = result;
            this.stored = stored;
        }
    }

    /**
     * Resolves a mail search query to message ids.
     *
     * @throws RemoteCallException when the search fails after retries
     */
    public List<String> search(String query, Integer maxResults) {
        RemoteResult<List<String>> result = retryPolicy.execute("search(" + query + ")",
                () -> gmailApiService.search(query, maxResults));
        if (!result.isSuccess()) {
            throw new RemoteCallException("Message search failed: " + result.describeError(),
                    result.getErrorKind(), result.getError());
        }
        return result.getValue();
    }

    public RunSummary run(List<String> messageIds, ClassificationMode mode, boolean useCache,
                          boolean applyLabels, int labelBatchSize) {
        return exclusive(() -> doRun(messageIds, mode, useCache, applyLabels, labelBatchSize));
    }

    /**
     * Labels every cached, classified and not yet labeled message. Nothing is fetched.
     */
    public LabelingOutcome applyLabelsFromCache(int labelBatchSize) {
        return exclusive(() -> {
            Map<String, String> pending = new LinkedHashMap<>();
            cacheService.getUnlabeledClassified()
                .forEach(cached -> pending.put(cached.getMessageId(), cached.getClassifiedCategory()));
            log.info("Applying labels to {} cached messages", pending.size());
            return labelApplier.apply(pending, labelBatchSize, stopRequested::get);
        });
    }

    /**
     * Deletes old labeled cache records. Rejected while a run or label application is active.
     */
    public int cleanupCache(int olderThanDays) {
        return exclusive(() -> cacheService.cleanupOlderThan(olderThanDays));
    }

    public void requestStop() {
        if (running.get()) {
            log.info("Stop requested; in-flight work will finish before the run ends");
        }
        stopRequested.set(true);
    }

    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    public void shutdown() {
        requestStop();
    }

    private <T> T exclusive(Supplier<T> work) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A classification run is already in progress");
        }
        stopRequested.set(false);
        try {
            return work.get();
        } finally {
            running.set(false);
        }
    }

    private RunSummary doRun(List<String> messageIds, ClassificationMode mode, boolean useCache,
                             boolean applyLabels, int labelBatchSize) {
        Set<String> ids = new LinkedHashSet<>(messageIds);
        log.info("Starting {} run over {} messages (useCache={}, applyLabels={})",
                mode, ids.size(), useCache, applyLabels);

        // A persisted label flag counts even when the in-memory index has not seen it
        Map<String, CachedEmail> records = useCache || applyLabels ? cacheService.findRecords(ids) : Map.of();
        int alreadyLabeled = 0;
        Map<String, ClassificationResult> cacheHits = new LinkedHashMap<>();
        List<String> toFetch = new ArrayList<>();
        for (String id : ids) {
            CachedEmail record = records.get(id);
            if (applyLabels && (cacheService.isLabeled(id) || (record != null && record.isLabelApplied()))) {
                alreadyLabeled++;
                continue;
            }
            if (useCache && record != null && record.getClassifiedCategory() != null) {
                cacheHits.put(id, EmailCacheService.toResult(record));
                continue;
            }
            toFetch.add(id);
        }
        log.info("Partitioned run: {} already labeled, {} cache hits, {} to fetch",
                alreadyLabeled, cacheHits.size(), toFetch.size());

        List<ItemOutcome> outcomes = classifyAll(toFetch, mode);
        boolean interrupted = outcomes.stream().anyMatch(o -> o.status == ItemStatus.NOT_STARTED);

        Map<String, String> toLabel = new LinkedHashMap<>();
        List<ClassificationResult> results = new ArrayList<>(cacheHits.values());
        cacheHits.forEach((id, result) -> toLabel.put(id, result.getCategory()));
        int fetched = 0;
        int fetchSkipped = 0;
        int errors = 0;
        for (ItemOutcome outcome : outcomes) {
            switch (outcome.status) {
                case CLASSIFIED:
                    fetched++;
                    results.add(outcome.result);
                    if (outcome.result.isClassified() && outcome.stored) {
                        toLabel.put(outcome.messageId, outcome.result.getCategory());
                    }
                    break;
                case NOT_FOUND:
                    fetchSkipped++;
                    break;
                case FAILED:
                    errors++;
                    break;
                default:
                    break;
            }
        }

        LabelingOutcome labeling = LabelingOutcome.empty();
        if (applyLabels && !stopRequested.get()) {
            labeling = labelApplier.apply(toLabel, labelBatchSize, stopRequested::get);
        } else if (applyLabels) {
            interrupted = true;
        }

        RunSummary summary = summarize(ids.size(), alreadyLabeled, cacheHits.size(), fetched, fetchSkipped,
                errors, results, labeling, interrupted || labeling.isInterrupted());
        log.info("Run finished: {} total, {} classified, {} unclassified, {} errors, {} labeled, {} label skipped, "
                        + "{} label failed{}", summary.getTotal(), summary.getClassified(), summary.getUnclassified(),
                summary.getErrors(), summary.getLabeled(), summary.getLabelSkipped(), summary.getLabelFailed(),
                summary.isInterrupted() ? " (interrupted)" : "");
        return summary;
    }

    private List<ItemOutcome> classifyAll(List<String> messageIds, ClassificationMode mode) {
        List<CompletableFuture<ItemOutcome>> futures = new ArrayList<>(messageIds.size());
        List<ItemOutcome> outcomes = new ArrayList<>(messageIds.size());
        for (String id : messageIds) {
            if (stopRequested.get()) {
                outcomes.add(new ItemOutcome(id, ItemStatus.NOT_STARTED, null, false));
                continue;
            }
            futures.add(CompletableFuture.supplyAsync(() -> processMessage(id, mode), executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            // Cache failures abort the run once every submitted task has settled
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
        futures.forEach(future -> outcomes.add(future.join()));
        return outcomes;
    }

    private ItemOutcome processMessage(String messageId, ClassificationMode mode) {
        if (stopRequested.get()) {
            return new ItemOutcome(messageId, ItemStatus.NOT_STARTED, null, false);
        }
        RemoteResult<Email> fetched = retryPolicy.execute("getMessage(" + messageId + ")",
                () -> gmailApiService.getMessage(messageId, MessageFormat.FULL));
        if (!fetched.isSuccess()) {
            if (fetched.getErrorKind() == ErrorKind.NOT_FOUND) {
                log.warn("Message {} no longer exists, skipped", messageId);
                return new ItemOutcome(messageId, ItemStatus.NOT_FOUND, null, false);
            }
            log.error("Failed to fetch message {}: {}", messageId, fetched.describeError());
            return new ItemOutcome(messageId, ItemStatus.FAILED, null, false);
        }

        Email email = fetched.getValue();
        ClassificationResult result;
        try {
            result = emailClassifier.classify(email, mode);
        } catch (RuntimeException e) {
            log.error("Classification failed for message {}: {}", messageId, e.getMessage(), e);
            return new ItemOutcome(messageId, ItemStatus.FAILED, null, false);
        }
        log.debug("Message {} classified as {} ({}, {})", messageId, result.getCategory(),
                result.getMethod().wireValue(), result.getConfidence());

        boolean stored = cacheService.store(email, result);
        return new ItemOutcome(messageId, ItemStatus.CLASSIFIED, result, stored);
    }

    private static RunSummary summarize(int total, int alreadyLabeled, int cacheHits, int fetched, int fetchSkipped,
                                        int errors, List<ClassificationResult> results, LabelingOutcome labeling,
                                        boolean interrupted) {
        Map<String, Integer> distribution = new TreeMap<>();
        DoubleSummaryStatistics confidence = new DoubleSummaryStatistics();
        int classified = 0;
        for (ClassificationResult result : results) {
            if (result.isClassified()) {
                classified++;
                distribution.merge(result.getCategory(), 1, Integer::sum);
                confidence.accept(result.getConfidence());
            }
        }
        return RunSummary.builder()
            .total(total)
            .alreadyLabeled(alreadyLabeled)
            .cacheHits(cacheHits)
            .fetched(fetched)
            .fetchSkipped(fetchSkipped)
            .classified(classified)
            .unclassified(results.size() - classified)
            .errors(errors)
            .labeled(labeling.getLabeled())
            .labelSkipped(labeling.getSkipped())
            .labelFailed(labeling.getFailed())
            .interrupted(interrupted)
            .categoryDistribution(distribution)
            .averageConfidence(classified > 0 ? confidence.getAverage() : 0.0)
            .minConfidence(classified > 0 ? confidence.getMin() : 0.0)
            .maxConfidence(classified > 0 ? confidence.getMax() : 0.0)
            .build();
    }
}
