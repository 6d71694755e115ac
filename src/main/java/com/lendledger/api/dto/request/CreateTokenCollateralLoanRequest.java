package com.lendledger.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a native loan backed by a whitelisted token. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTokenCollateralLoanRequest {

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

    @NotBlank(message = "Token reference is required")
    private String tokenRef;

    @NotNull(message = "Collateral amount is required")
    @Positive(message = "Collateral amount must be positive")
    private Long collateralAmount;
}
