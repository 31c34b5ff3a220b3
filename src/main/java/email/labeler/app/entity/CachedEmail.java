package email.labeler.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * One classified message. {@code labelApplied} only ever moves from false to true.
 */
@Entity
@Table(name = "emails", indexes = {
    @Index(name = "idx_message_id", columnList = "message_id"),
    @Index(name = "idx_classification", columnList = "classified_category"),
    @Index(name = "idx_label_applied", columnList = "label_applied"),
    @Index(name = "idx_processed_at", columnList = "processed_at")
})
@Data
public class CachedEmail {
    @Id
    @Column(name = "message_id")
    private String messageId;

    @Column(name = "thread_id")
    private String threadId;

    @Column(columnDefinition = "TEXT")
    private String subject;

    @Column(columnDefinition = "TEXT")
    private String sender;

    @Column(columnDefinition = "TEXT")
    private String receiver;

    @Column(name = "date_received")
    private Instant dateReceived;

    @Column(columnDefinition = "TEXT")
    private String snippet;

    @Column(name = "content_hash")
    private String contentHash;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "classification_method")
    private String classificationMethod;

    @Column(name = "classified_category")
    private String classifiedCategory;

    @Column(name = "classification_confidence")
    private Double classificationConfidence;

    @Column(name = "label_applied", nullable = false, columnDefinition = "BOOLEAN DEFAULT FALSE")
    private boolean labelApplied = false;

    @Column(name = "label_applied_at")
    private Instant labelAppliedAt;

    @Column(name = "raw_data", columnDefinition = "TEXT")
    private String rawData;
}
