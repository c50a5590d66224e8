package com.fintech.settlement.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Settlement total copied from a provider statement export.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatementImportRequest {

    @NotBlank
    private String provider;

    @NotNull
    private LocalDate settlementDate;

    /**
     * Minor units; may be negative when refunds exceeded collections.
     */
    @NotNull
    private Long reportedTotal;

    private String sourceReference;
}
