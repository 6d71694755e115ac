package com.lendledger.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** All five parameters are required; partial updates are not supported. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DynamicRateParamsRequest {

    @NotNull(message = "Base rate is required")
    private Integer baseRateBps;

    @NotNull(message = "Utilization multiplier is required")
    private Integer utilizationMultiplier;

    @NotNull(message = "Risk multiplier is required")
    private Integer riskMultiplier;

    @NotNull(message = "Max rate is required")
    private Integer maxRateBps;

    @NotNull(message = "Min rate is required")
    private Integer minRateBps;
}
