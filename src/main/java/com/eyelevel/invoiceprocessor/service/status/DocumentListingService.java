package com.eyelevel.invoiceprocessor.service.status;

import com.eyelevel.invoiceprocessor.dto.status.DocumentListFilter;
import com.eyelevel.invoiceprocessor.dto.status.DocumentStatusResponse;
import com.eyelevel.invoiceprocessor.model.DocumentRecord;
import com.eyelevel.invoiceprocessor.model.ReviewStatus;
import com.eyelevel.invoiceprocessor.repository.DocumentRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentListingService {

    static final int MAX_PAGE_SIZE = 100;

    private final DocumentRecordRepository documentRecordRepository;
    private final DocumentStatusService documentStatusService;

    /**
     * Lists a location's documents, newest first.
     *
     * @param page zero-based page index
     * @param size page size, capped at {@value #MAX_PAGE_SIZE}
     */
    @Transactional(readOnly = true)
    public Page<DocumentStatusResponse> list(final String organisationId, final String locationId,
                                             final DocumentListFilter filter, final int page, final int size) {
        final Pageable pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
                                                 Sort.by(Sort.Direction.DESC, "createdAt"));
        final DocumentListFilter effective = filter == null ? DocumentListFilter.ALL : filter;
        log.debug("Listing {} documents for organisation {}, location {} ({}).", effective, organisationId,
                  locationId, pageable);
        final Page<DocumentRecord> records = findPage(organisationId, locationId, effective, pageable);
        return records.map(documentStatusService::toResponse);
    }

    private Page<DocumentRecord> findPage(final String organisationId, final String locationId,
                                          final DocumentListFilter filter, final Pageable pageable) {
        switch (filter) {
            case PENDING:
                return documentRecordRepository.findByOrganisationIdAndLocationIdAndReviewStatusAndDeletedAtIsNull(
                        organisationId, locationId, ReviewStatus.NEEDS_REVIEW, pageable);
            case REVIEWED:
                return documentRecordRepository.findByOrganisationIdAndLocationIdAndReviewStatusAndDeletedAtIsNull(
                        organisationId, locationId, ReviewStatus.VERIFIED, pageable);
            case DELETED:
                return documentRecordRepository.findByOrganisationIdAndLocationIdAndDeletedAtIsNotNull(
                        organisationId, locationId, pageable);
            default:
                return documentRecordRepository.findByOrganisationIdAndLocationIdAndDeletedAtIsNull(
                        organisationId, locationId, pageable);
        }
    }

    @Transactional(readOnly = true)
    public long countNeedingReview(final String organisationId, final String locationId) {
        return documentRecordRepository.countByOrganisationIdAndLocationIdAndReviewStatusAndDeletedAtIsNull(
                organisationId, locationId, ReviewStatus.NEEDS_REVIEW);
    }
}
