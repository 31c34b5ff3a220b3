package email.labeler.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import email.labeler.app.entity.CachedEmail;
import email.labeler.app.model.CacheStats;
import email.labeler.app.model.ClassificationMethod;
import email.labeler.app.model.ClassificationResult;
import email.labeler.app.model.Email;
import email.labeler.app.repository.CachedEmailRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import({EmailCacheService.class, EmailCacheServiceTest.JacksonTestConfig.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class EmailCacheServiceTest {

    @TestConfiguration
    static class JacksonTestConfig {
        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper().findAndRegisterModules();
        }
    }

    @Autowired
    private EmailCacheService cacheService;

    @Autowired
    private CachedEmailRepository repository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        cacheService.load();
    }

    private static Email email(String id) {
        return Email.builder()
            .messageId(id)
            .threadId("thread-" + id)
            .sender("Flipkart <offers@flipkart.com>")
            .recipients(List.of("me@example.com"))
            .subject("Big Billion Days Sale")
            .snippet("Huge offers inside")
            .bodyText("Huge offers inside. Click to unsubscribe.")
            .receivedAt(Instant.parse("2024-10-01T10:15:30Z"))
            .build();
    }

    private static ClassificationResult classified(String category, double confidence) {
        return ClassificationResult.builder()
            .category(category)
            .confidence(confidence)
            .method(ClassificationMethod.RULE_BASED)
            .build();
    }

    @Test
    void store_NewMessage_ShouldPersistRecordAndIndex() {
        // When
        boolean stored = cacheService.store(email("m1"), classified("Promotions & Marketing", 4.65));

        // Then
        assertTrue(stored);
        assertTrue(cacheService.isProcessed("m1"));
        assertFalse(cacheService.isLabeled("m1"));

        CachedEmail record = repository.findById("m1").orElseThrow();
        assertEquals("thread-m1", record.getThreadId());
        assertEquals("me@example.com", record.getReceiver());
        assertEquals("rule_based", record.getClassificationMethod());
        assertEquals(EmailCacheService.contentHash(email("m1")), record.getContentHash());
        assertEquals(32, record.getContentHash().length());
        assertTrue(record.getRawData().contains("\"messageId\":\"m1\""));
        assertNotNull(record.getProcessedAt());
        assertFalse(record.isLabelApplied());

        ClassificationResult cached = cacheService.getCachedClassification("m1").orElseThrow();
        assertEquals("Promotions & Marketing", cached.getCategory());
        assertEquals(4.65, cached.getConfidence(), 1e-9);
        assertEquals(ClassificationMethod.RULE_BASED, cached.getMethod());
    }

    @Test
    void getCachedClassification_UnclassifiedRecord_ShouldBeEmpty() {
        // Given
        cacheService.store(email("m2"), ClassificationResult.unclassified(ClassificationMethod.NONE, Map.of()));

        // When
        Optional<ClassificationResult> cached = cacheService.getCachedClassification("m2");

        // Then
        assertTrue(cacheService.isProcessed("m2"));
        assertTrue(cached.isEmpty());
        assertTrue(cacheService.getCachedClassification("unknown").isEmpty());
    }

    @Test
    void batchMarkLabeled_ShouldFlipLabelStateOnce() {
        // Given
        cacheService.store(email("m1"), classified("Promotions & Marketing", 4.65));
        cacheService.store(email("m2"), classified("Shopping & Orders", 3.1));

        // When
        int first = cacheService.batchMarkLabeled(List.of("m1", "m2", "not-cached"));
        Instant firstLabeledAt = repository.findById("m1").orElseThrow().getLabelAppliedAt();
        int second = cacheService.batchMarkLabeled(List.of("m1"));

        // Then
        assertEquals(2, first);
        assertEquals(0, second);
        assertTrue(cacheService.isLabeled("m1"));
        assertTrue(cacheService.isLabeled("m2"));
        assertFalse(cacheService.isLabeled("not-cached"));
        assertEquals(firstLabeledAt, repository.findById("m1").orElseThrow().getLabelAppliedAt());
    }

    @Test
    void store_AfterLabelApplied_ShouldKeepRecordUntouched() {
        // Given
        cacheService.store(email("m1"), classified("Promotions & Marketing", 4.65));
        cacheService.markLabeled("m1");

        // When
        boolean stored = cacheService.store(email("m1"), classified("Shopping & Orders", 9.0));

        // Then
        assertFalse(stored);
        CachedEmail record = repository.findById("m1").orElseThrow();
        assertTrue(record.isLabelApplied());
        assertEquals("Promotions & Marketing", record.getClassifiedCategory());
        assertTrue(cacheService.isLabeled("m1"));
    }

    @Test
    void store_Reclassification_ShouldOverwriteClassificationFields() {
        // Given
        cacheService.store(email("m1"), classified("Shopping & Orders", 2.6));

        // When
        cacheService.store(email("m1"), classified("Promotions & Marketing", 4.65));

        // Then
        assertEquals(1, repository.count());
        assertEquals("Promotions & Marketing", repository.findById("m1").orElseThrow().getClassifiedCategory());
    }

    @Test
    void load_ShouldRebuildIndexFromDatabase() {
        // Given
        cacheService.store(email("m1"), classified("Promotions & Marketing", 4.65));
        cacheService.store(email("m2"), classified("Shopping & Orders", 3.1));
        cacheService.markLabeled("m2");
        EmailCacheService reopened = new EmailCacheService(repository, transactionManager, objectMapper);

        // When
        reopened.load();

        // Then
        assertTrue(reopened.isProcessed("m1"));
        assertFalse(reopened.isLabeled("m1"));
        assertTrue(reopened.isLabeled("m2"));

        reopened.close();
        assertFalse(reopened.isProcessed("m1"));
    }

    @Test
    void getUnlabeledClassified_ShouldSkipLabeledAndUnclassified() {
        // Given
        cacheService.store(email("m1"), classified("Promotions & Marketing", 4.65));
        cacheService.store(email("m2"), classified("Shopping & Orders", 3.1));
        cacheService.store(email("m3"), ClassificationResult.unclassified(ClassificationMethod.NONE, Map.of()));
        cacheService.markLabeled("m2");

        // When
        List<CachedEmail> pending = cacheService.getUnlabeledClassified();

        // Then
        assertEquals(List.of("m1"), pending.stream().map(CachedEmail::getMessageId).toList());
    }

    @Test
    void stats_ShouldCountAndGroupRecords() {
        // Given
        cacheService.store(email("m1"), classified("Promotions & Marketing", 4.65));
        cacheService.store(email("m2"), classified("Promotions & Marketing", 3.0));
        cacheService.store(email("m3"), classified("Shopping & Orders", 3.1));
        cacheService.store(email("m4"), ClassificationResult.unclassified(ClassificationMethod.NONE, Map.of()));
        cacheService.markLabeled("m1");

        // When
        CacheStats stats = cacheService.stats();

        // Then
        assertEquals(4, stats.getTotalProcessed());
        assertEquals(3, stats.getClassified());
        assertEquals(1, stats.getLabeled());
        assertEquals(2, stats.getPendingLabels());
        assertEquals(Map.of("Promotions & Marketing", 2L, "Shopping & Orders", 1L), stats.getCategoryDistribution());
        assertEquals(Map.of("rule_based", 3L, "none", 1L), stats.getMethodDistribution());
        assertEquals(0.75, stats.getClassificationRate(), 1e-9);
    }

    @Test
    void export_ShouldWriteRecordsNewestFirst(@TempDir Path tempDir) throws Exception {
        // Given
        cacheService.store(email("old"), classified("Shopping & Orders", 3.1));
        cacheService.store(email("new"), classified("Promotions & Marketing", 4.65));
        setProcessedAt("old", Instant.now().minus(2, ChronoUnit.DAYS));
        Path file = tempDir.resolve("exports/cache.json");

        // When
        int exported = cacheService.export(file);

        // Then
        assertEquals(2, exported);
        JsonNode rows = objectMapper.readTree(file.toFile());
        assertEquals("new", rows.get(0).path("message_id").asText());
        assertEquals("old", rows.get(1).path("message_id").asText());
        assertEquals("Shopping & Orders", rows.get(1).path("category").asText());
        assertFalse(rows.get(0).path("labeled").asBoolean());
        assertTrue(rows.get(0).has("processed_at"));
    }

    @Test
    void cleanupOlderThan_ShouldOnlyRemoveOldLabeledRecords() {
        // Given
        cacheService.store(email("old-labeled"), classified("Shopping & Orders", 3.1));
        cacheService.store(email("old-pending"), classified("Shopping & Orders", 3.1));
        cacheService.store(email("recent-labeled"), classified("Shopping & Orders", 3.1));
        cacheService.batchMarkLabeled(List.of("old-labeled", "recent-labeled"));
        setProcessedAt("old-labeled", Instant.now().minus(40, ChronoUnit.DAYS));
        setProcessedAt("old-pending", Instant.now().minus(40, ChronoUnit.DAYS));

        // When
        int deleted = cacheService.cleanupOlderThan(30);

        // Then
        assertEquals(1, deleted);
        assertFalse(repository.existsById("old-labeled"));
        assertTrue(repository.existsById("old-pending"));
        assertTrue(repository.existsById("recent-labeled"));
        assertFalse(cacheService.isProcessed("old-labeled"));
        assertFalse(cacheService.isLabeled("old-labeled"));
    }

    @Test
    void store_SenderLongerThan255Characters_ShouldPersist() {
        // Given
        String sender = "\"" + "Quarterly Newsletter Team ".repeat(11) + "\" <newsletter@updates.example.com>";
        Email email = email("long-sender").toBuilder().sender(sender).build();

        // When
        boolean stored = cacheService.store(email, classified("Promotions & Marketing", 3.4));

        // Then
        assertTrue(sender.length() > 255);
        assertTrue(stored);
        assertEquals(sender, repository.findById("long-sender").orElseThrow().getSender());
    }

    @Test
    void findRecords_ManyIds_ShouldReturnOnlyStoredRecords() {
        // Given
        cacheService.store(email("m1"), classified("Shopping & Orders", 3.1));
        cacheService.store(email("m1200"), classified("Promotions & Marketing", 4.65));
        cacheService.batchMarkLabeled(List.of("m1200"));
        List<String> ids = IntStream.rangeClosed(1, 1200)
            .mapToObj(i -> "m" + i)
            .collect(Collectors.toList());

        // When
        Map<String, CachedEmail> records = cacheService.findRecords(ids);

        // Then
        assertEquals(Set.of("m1", "m1200"), records.keySet());
        assertFalse(records.get("m1").isLabelApplied());
        assertTrue(records.get("m1200").isLabelApplied());
    }

    @Test
    void cleanupOlderThan_ShouldLeaveIndexOfRemainingRecordsIntact() {
        // Given
        cacheService.store(email("old-labeled"), classified("Shopping & Orders", 3.1));
        cacheService.store(email("kept"), classified("Shopping & Orders", 3.1));
        cacheService.batchMarkLabeled(List.of("old-labeled", "kept"));
        setProcessedAt("old-labeled", Instant.now().minus(40, ChronoUnit.DAYS));

        // When
        cacheService.cleanupOlderThan(30);
        cacheService.store(email("after"), classified("Shopping & Orders", 3.1));

        // Then
        assertTrue(cacheService.isLabeled("kept"));
        assertTrue(cacheService.isProcessed("kept"));
        assertTrue(cacheService.isProcessed("after"));
        assertFalse(cacheService.isProcessed("old-labeled"));
    }

    @Test
    void cleanupOlderThan_NegativeDays_ShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> cacheService.cleanupOlderThan(-1));
    }

    private void setProcessedAt(String messageId, Instant processedAt) {
        CachedEmail record = repository.findById(messageId).orElseThrow();
        record.setProcessedAt(processedAt);
        repository.save(record);
    }
}
