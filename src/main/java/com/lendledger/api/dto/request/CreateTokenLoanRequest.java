package com.lendledger.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a loan denominated in a whitelisted token, backed by native collateral. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTokenLoanRequest {

    @NotNull(message = "Principal is required")
    @Positive(message = "Principal must be positive")
    private Long principal;

    @PositiveOrZero(message = "Interest rate must not be negative")
    private Integer interestRateBps;

    @NotNull(message = "Max acceptable rate is required")
    @PositiveOrZero(message = "Max acceptable rate must not be negative")
    private Integer maxAcceptableRateBps;

    @NotNull(message = "Duration is required")
    @Positive(message = "Duration must be positive")
    private Long durationBlocks;

    @NotBlank(message = "Loan token reference is required")
    private String loanTokenRef;

    @NotNull(message = "Collateral amount is required")
    @Positive(message = "Collateral amount must be positive")
    private Long collateralAmount;
}
