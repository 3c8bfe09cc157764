package com.eyelevel.invoiceprocessor.repository;

import com.eyelevel.invoiceprocessor.model.AnalysisResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AnalysisResultRepository extends JpaRepository<AnalysisResult, Long> {

    List<AnalysisResult> findAllByDocumentRecordIdOrderByCreatedAtDesc(UUID documentRecordId);

    @Modifying
    @Query("DELETE FROM AnalysisResult r WHERE r.documentRecordId = :documentRecordId")
    int deleteAllByDocumentRecordId(@Param("documentRecordId") UUID documentRecordId);
}
