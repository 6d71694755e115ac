package com.lendledger.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a native loan against native collateral.
 *
 * <p>{@code interestRateBps} of 0 (or absent) accepts the dynamic rate; any positive value
 * must lie within the platform's dynamic rate bounds. Creation is rejected if the applied
 * rate exceeds {@code maxAcceptableRateBps}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateLoanRequest {

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

    @NotNull(message = "Collateral amount is required")
    @Positive(message = "Collateral amount must be positive")
    private Long collateralAmount;
}
