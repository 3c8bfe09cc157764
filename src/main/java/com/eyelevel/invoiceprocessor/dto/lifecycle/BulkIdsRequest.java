package com.eyelevel.invoiceprocessor.dto.lifecycle;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

@Schema(description = "Document ids for a bulk operation.")
public record BulkIdsRequest(
        @NotEmpty(message = "At least one id is required.")
        List<@NotNull UUID> ids
) {
}
