package com.lendledger.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a native loan backed by one collectible item, valued at its collection floor price. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateNftCollateralLoanRequest {

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

    @NotBlank(message = "Collection reference is required")
    private String collectionRef;

    @NotNull(message = "Item id is required")
    @PositiveOrZero(message = "Item id must not be negative")
    private Long itemId;
}
