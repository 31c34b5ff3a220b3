package email.labeler.app.repository;

import email.labeler.app.entity.CachedEmail;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface CachedEmailRepository extends JpaRepository<CachedEmail, String> {

    @Query("SELECT e.messageId FROM CachedEmail e")
    List<String> findAllMessageIds();

    @Query("SELECT e.messageId FROM CachedEmail e WHERE e.labelApplied = true")
    List<String> findLabeledMessageIds();

    @Query("SELECT e FROM CachedEmail e WHERE e.classifiedCategory IS NOT NULL AND e.labelApplied = false "
            + "ORDER BY e.processedAt ASC")
    List<CachedEmail> findUnlabeledClassified();

    // Only rows still unlabeled are touched, so label_applied_at keeps the first timestamp
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CachedEmail e SET e.labelApplied = true, e.labelAppliedAt = :labeledAt "
            + "WHERE e.messageId IN :ids AND e.labelApplied = false")
    int markLabeled(@Param("ids") Collection<String> ids, @Param("labeledAt") Instant labeledAt);

    long countByClassifiedCategoryIsNotNull();

    long countByLabelAppliedTrue();

    long countByClassifiedCategoryIsNotNullAndLabelAppliedFalse();

    @Query("SELECT e.classifiedCategory, COUNT(e) FROM CachedEmail e WHERE e.classifiedCategory IS NOT NULL "
            + "GROUP BY e.classifiedCategory ORDER BY COUNT(e) DESC")
    List<Object[]> countByCategory();

    @Query("SELECT e.classificationMethod, COUNT(e) FROM CachedEmail e WHERE e.classificationMethod IS NOT NULL "
            + "GROUP BY e.classificationMethod ORDER BY COUNT(e) DESC")
    List<Object[]> countByMethod();

    List<CachedEmail> findAllByOrderByProcessedAtDesc();

    @Query("SELECT e.messageId FROM CachedEmail e WHERE e.processedAt < :cutoff AND e.labelApplied = true")
    List<String> findLabeledProcessedBefore(@Param("cutoff") Instant cutoff);
}
