package com.eyelevel.invoiceprocessor.dto.lifecycle;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

/**
 * @param requested  Number of distinct ids in the request.
 * @param affected   Number of records actually changed.
 * @param skippedIds Ids that were not found in the organisation or already in the target state.
 */
@Schema(description = "Outcome of a bulk delete or restore.")
public record BulkOperationResponse(
        int requested,
        int affected,
        List<UUID> skippedIds
) {
}
