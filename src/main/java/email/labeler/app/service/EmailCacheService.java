package email.labeler.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import email.labeler.app.entity.CachedEmail;
import email.labeler.app.exception.CacheStorageException;
import email.labeler.app.model.CacheStats;
import email.labeler.app.model.ClassificationMethod;
import email.labeler.app.model.ClassificationResult;
import email.labeler.app.model.Email;
import email.labeler.app.repository.CachedEmailRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Durable classification cache keyed by message id. Membership checks are answered from
 * in-memory id sets that are built by {@link #load()} and only changed after the
 * corresponding database transaction has committed.
 */
@Slf4j
@Service
public class EmailCacheService {
    private final CachedEmailRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    static final int LOOKUP_CHUNK_SIZE = 500;

    private volatile Set<String> processedIds = ConcurrentHashMap.newKeySet();
    private volatile Set<String> labeledIds = ConcurrentHashMap.newKeySet();

    public EmailCacheService(CachedEmailRepository repository,
                             PlatformTransactionManager transactionManager,
                             ObjectMapper objectMapper) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.objectMapper = objectMapper;
    }

    /**
     * Builds the id index from storage and swaps it in. Meant for startup, before any run writes.
     */
    @PostConstruct
    public void load() {
        Set<String> processed = ConcurrentHashMap.newKeySet();
        Set<String> labeled = ConcurrentHashMap.newKeySet();
        processed.addAll(read("load cache index", repository::findAllMessageIds));
        labeled.addAll(read("load cache index", repository::findLabeledMessageIds));
        processedIds = processed;
        labeledIds = labeled;
        log.info("Loaded classification cache: {} processed, {} labeled", processedIds.size(), labeledIds.size());
    }

    @PreDestroy
    public void close() {
        log.info("Closing classification cache ({} processed, {} labeled)", processedIds.size(), labeledIds.size());
        processedIds.clear();
        labeledIds.clear();
    }

    public boolean isProcessed(String messageId) {
        return processedIds.contains(messageId);
    }

    public boolean isLabeled(String messageId) {
        return labeledIds.contains(messageId);
    }

    /**
     * Cached decision for a message, present only when a category was assigned.
     */
    public Optional<ClassificationResult> getCachedClassification(String messageId) {
        if (!processedIds.contains(messageId)) {
            return Optional.empty();
        }
        return read("read cached classification " + messageId, () -> repository.findById(messageId))
            .filter(cached -> cached.getClassifiedCategory() != null)
            .map(EmailCacheService::toResult);
    }

    /**
     * Upserts the classification of a message. A record whose label was already applied is left
     * as it is and {@code false} is returned.
     */
    public boolean store(Email email, ClassificationResult result) {
        String rawData = serialize(email);
        Boolean stored = write("store " + email.getMessageId(), () -> {
            CachedEmail cached = repository.findById(email.getMessageId()).orElseGet(CachedEmail::new);
            if (cached.isLabelApplied()) {
                return false;
            }
            cached.setMessageId(email.getMessageId());
            cached.setThreadId(email.getThreadId());
            cached.setSubject(email.getSubject());
            cached.setSender(email.getSender());
            cached.setReceiver(String.join(", ", email.getRecipients()));
            cached.setDateReceived(email.getReceivedAt());
            cached.setSnippet(email.getSnippet());
            cached.setContentHash(contentHash(email));
            cached.setProcessedAt(Instant.now());
            cached.setClassificationMethod(result.getMethod() != null ? result.getMethod().wireValue() : null);
            cached.setClassifiedCategory(result.getCategory());
            cached.setClassificationConfidence(result.getConfidence());
            cached.setRawData(rawData);
            repository.save(cached);
            return true;
        });
        processedIds.add(email.getMessageId());
        if (!stored) {
            log.debug("Message {} already labeled, cached classification kept", email.getMessageId());
        }
        return stored;
    }

    public void markLabeled(String messageId) {
        batchMarkLabeled(List.of(messageId));
    }

    /**
     * Flags the given messages as labeled. Call only after the remote label call succeeded.
     * Ids without a cache record are ignored.
     *
     * @return number of records that changed from unlabeled to labeled
     */
    public int batchMarkLabeled(Collection<String> messageIds) {
        if (messageIds.isEmpty()) {
            return 0;
        }
        List<String> ids = List.copyOf(messageIds);
        Integer updated = write("mark " + ids.size() + " messages labeled",
                () -> repository.markLabeled(ids, Instant.now()));
        ids.stream().filter(processedIds::contains).forEach(labeledIds::add);
        log.debug("Marked {} of {} messages labeled", updated, ids.size());
        return updated;
    }

    /**
     * Persisted records for the given ids, loaded in chunks of {@value #LOOKUP_CHUNK_SIZE}.
     * Ids without a record are absent from the result.
     */
    public Map<String, CachedEmail> findRecords(Collection<String> messageIds) {
        List<String> ids = List.copyOf(new LinkedHashSet<>(messageIds));
        Map<String, CachedEmail> records = new HashMap<>();
        for (int i = 0; i < ids.size(); i += LOOKUP_CHUNK_SIZE) {
            List<String> chunk = ids.subList(i, Math.min(i + LOOKUP_CHUNK_SIZE, ids.size()));
            read("read " + chunk.size() + " cache records", () -> repository.findAllById(chunk))
                .forEach(record -> records.put(record.getMessageId(), record));
        }
        return records;
    }

    public List<CachedEmail> getUnlabeledClassified() {
        return read("read unlabeled classifications", repository::findUnlabeledClassified);
    }

    public CacheStats stats() {
        return read("compute cache stats", () -> CacheStats.builder()
            .totalProcessed(repository.count())
            .classified(repository.countByClassifiedCategoryIsNotNull())
            .labeled(repository.countByLabelAppliedTrue())
            .pendingLabels(repository.countByClassifiedCategoryIsNotNullAndLabelAppliedFalse())
            .categoryDistribution(toCountMap(repository.countByCategory()))
            .methodDistribution(toCountMap(repository.countByMethod()))
            .build());
    }

    /**
     * Writes every cache record to a JSON file, newest first.
     *
     * @return number of exported records
     */
    public int export(Path file) {
        List<CachedEmail> records = read("read cache for export", repository::findAllByOrderByProcessedAtDesc);
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (CachedEmail record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("message_id", record.getMessageId());
            row.put("subject", record.getSubject());
            row.put("sender", record.getSender());
            row.put("category", record.getClassifiedCategory());
            row.put("confidence", record.getClassificationConfidence());
            row.put("labeled", record.isLabelApplied());
            row.put("processed_at", record.getProcessedAt() != null ? record.getProcessedAt().toString() : null);
            rows.add(row);
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), rows);
        } catch (IOException e) {
            throw new CacheStorageException("Failed to export cache to " + file, e);
        }
        log.info("Exported {} cache records to {}", rows.size(), file);
        return rows.size();
    }

    /**
     * Deletes labeled records processed more than {@code days} days ago. Unlabeled records are kept.
     */
    public int cleanupOlderThan(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must not be negative: " + days);
        }
        Instant cutoff = Instant.now().minus(days, ChronoUnit.DAYS);
        List<String> deleted = write("clean up cache", () -> {
            List<String> ids = repository.findLabeledProcessedBefore(cutoff);
            for (int i = 0; i < ids.size(); i += LOOKUP_CHUNK_SIZE) {
                repository.deleteAllByIdInBatch(ids.subList(i, Math.min(i + LOOKUP_CHUNK_SIZE, ids.size())));
            }
            return ids;
        });
        deleted.forEach(id -> {
            labeledIds.remove(id);
            processedIds.remove(id);
        });
        log.info("Removed {} labeled cache records processed before {}", deleted.size(), cutoff);
        return deleted.size();
    }

    static String contentHash(Email email) {
        String content = String.join("|",
                nullToEmpty(email.getSubject()), email.contentText(), nullToEmpty(email.getSender()));
        return DigestUtils.md5DigestAsHex(content.getBytes(StandardCharsets.UTF_8));
    }

    static ClassificationResult toResult(CachedEmail cached) {
        return ClassificationResult.builder()
            .category(cached.getClassifiedCategory())
            .confidence(cached.getClassificationConfidence() != null ? cached.getClassificationConfidence() : 0.0)
            .method(cached.getClassificationMethod() != null
                    ? ClassificationMethod.fromWireValue(cached.getClassificationMethod())
                    : ClassificationMethod.NONE)
            .build();
    }

    private static Map<String, Long> toCountMap(List<Object[]> rows) {
        return rows.stream().collect(Collectors.toMap(
                row -> (String) row[0], row -> ((Number) row[1]).longValue(), (a, b) -> a, LinkedHashMap::new));
    }

    private String serialize(Email email) {
        try {
            return objectMapper.writeValueAsString(email);
        } catch (JsonProcessingException e) {
            throw new CacheStorageException("Failed to serialize message " + email.getMessageId(), e);
        }
    }

    private <T> T read(String operation, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            log.error("Cache storage failure during {}: {}", operation, e.getMessage());
            throw new CacheStorageException("Cache storage failure during " + operation, e);
        }
    }

    private <T> T write(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            log.error("Cache storage failure during {}: {}", operation, e.getMessage());
            throw new CacheStorageException("Cache storage failure during " + operation, e);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
