package com.eyelevel.invoiceprocessor.dto.batch;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

@Schema(description = "Documents to refresh against the analysis provider; at most 20 ids.")
public record BatchRefreshRequest(
        @NotEmpty(message = "At least one id is required.")
        List<@NotNull UUID> ids
) {
}
