package com.eyelevel.invoiceprocessor.dto.lifecycle;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.AssertTrue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Human confirmation of an extracted invoice. Either supplierId or supplierName is required.")
public class VerifyRequest {

    @Schema(description = "Existing supplier in the organisation.", nullable = true)
    private UUID supplierId;

    @Schema(description = "Supplier name to resolve or create when no supplierId is given.", example = "Acme Foods Ltd",
            nullable = true)
    private String supplierName;

    @Schema(description = "Line items to keep; all others are deleted. Omit to keep every item.", nullable = true)
    private List<Long> selectedLineItemIds;

    @Schema(description = "Corrected invoice total.", example = "1250.00", nullable = true)
    private BigDecimal total;

    @Schema(description = "Corrected invoice date.", example = "2024-03-15", nullable = true)
    private LocalDate invoiceDate;

    @Schema(description = "Remember aliasName as an alternative spelling of the supplier.")
    private boolean createAlias;

    @Schema(description = "Alias to record when createAlias is set.", nullable = true)
    private String aliasName;

    @JsonIgnore
    @AssertTrue(message = "'aliasName' is required when 'createAlias' is set.")
    public boolean isAliasNamePresentWhenRequested() {
        return !createAlias || StringUtils.hasText(aliasName);
    }
}
