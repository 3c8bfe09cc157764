package com.eyelevel.invoiceprocessor.repository;

import com.eyelevel.invoiceprocessor.model.DocumentRecord;
import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.model.SourceType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.TestPropertySource;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties = {
        "spring.datasource.url=jdbc:h2:mem:invoices;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
class DocumentRecordRepositoryTest {

    private static final String ORG = "org-1";

    @Autowired
    private DocumentRecordRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void pollScanSkipsDeletedAndJoblessRecords() {
        final UUID live = persist(ProcessingStatus.ANALYZING, "job-1", 1, null);
        persist(ProcessingStatus.ANALYZING, "job-2", 1, LocalDateTime.now());
        persist(ProcessingStatus.ANALYZING, null, 1, null);
        persist(ProcessingStatus.PENDING_ANALYSIS, null, 0, null);

        assertThat(repository.findIdsAwaitingAnalysisResult(PageRequest.of(0, 10))).containsExactly(live);
    }

    @Test
    void staleScanHonoursCutoffAndSoftDelete() {
        final LocalDateTime cutoff = LocalDateTime.now().minusMinutes(10);
        final UUID stale = persist(ProcessingStatus.ANALYZING, "job-1", 1, null);
        final UUID fresh = persist(ProcessingStatus.ANALYZING, "job-2", 1, null);
        final UUID deleted = persist(ProcessingStatus.ANALYZING, "job-3", 1, LocalDateTime.now());
        touch(stale, LocalDateTime.now().minusMinutes(15));
        touch(deleted, LocalDateTime.now().minusMinutes(15));

        final List<UUID> found = repository.findStaleIds(ProcessingStatus.ANALYZING, cutoff);

        assertThat(found).containsExactly(stale).doesNotContain(fresh);
    }

    @Test
    void retryableFailedScanExcludesExhaustedRecords() {
        final LocalDateTime cutoff = LocalDateTime.now().minusMinutes(10);
        final UUID retryable = persist(ProcessingStatus.ANALYSIS_FAILED, null, 2, null);
        final UUID exhausted = persist(ProcessingStatus.ANALYSIS_FAILED, null, 3, null);
        touch(retryable, LocalDateTime.now().minusMinutes(30));
        touch(exhausted, LocalDateTime.now().minusMinutes(30));

        assertThat(repository.findRetryableFailedIds(cutoff, 3)).containsExactly(retryable);
    }

    @Test
    void bulkSoftDeleteAndRestoreAreScopedToTheOrganisation() {
        final UUID mine = persist(ProcessingStatus.ANALYSIS_COMPLETE, null, 1, null);
        final UUID foreign = persistFor("org-2", ProcessingStatus.ANALYSIS_COMPLETE);

        assertThat(repository.softDeleteAll(List.of(mine, foreign), ORG, LocalDateTime.now())).isEqualTo(1);
        entityManager.clear();
        assertThat(repository.findByIdAndOrganisationIdAndDeletedAtIsNull(mine, ORG)).isEmpty();
        assertThat(repository.findById(foreign)).get().extracting(DocumentRecord::isDeleted).isEqualTo(false);

        assertThat(repository.restoreAll(List.of(mine), ORG, LocalDateTime.now())).isEqualTo(1);
        entityManager.clear();
        assertThat(repository.findByIdAndOrganisationIdAndDeletedAtIsNull(mine, ORG)).isPresent();
    }

    private UUID persist(final ProcessingStatus status, final String jobId, final int attempts,
                         final LocalDateTime deletedAt) {
        final DocumentRecord record = entityManager.persistFlushFind(DocumentRecord.builder()
                                                                                   .organisationId(ORG)
                                                                                   .locationId("loc-1")
                                                                                   .sourceType(SourceType.UPLOAD)
                                                                                   .fileName("invoice.pdf")
                                                                                   .storageKey("documents/x")
                                                                                   .processingStatus(status)
                                                                                   .analysisJobId(jobId)
                                                                                   .attemptCount(attempts)
                                                                                   .deletedAt(deletedAt)
                                                                                   .build());
        return record.getId();
    }

    private UUID persistFor(final String organisationId, final ProcessingStatus status) {
        return entityManager.persistFlushFind(DocumentRecord.builder()
                                                            .organisationId(organisationId)
                                                            .locationId("loc-1")
                                                            .sourceType(SourceType.UPLOAD)
                                                            .fileName("invoice.pdf")
                                                            .processingStatus(status)
                                                            .build()).getId();
    }

    private void touch(final UUID id, final LocalDateTime updatedAt) {
        entityManager.getEntityManager()
                     .createQuery("UPDATE DocumentRecord d SET d.updatedAt = :updatedAt WHERE d.id = :id")
                     .setParameter("updatedAt", updatedAt)
                     .setParameter("id", id)
                     .executeUpdate();
        entityManager.clear();
    }
}
