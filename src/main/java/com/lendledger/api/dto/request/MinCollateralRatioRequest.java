package com.lendledger.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MinCollateralRatioRequest {

    @NotNull(message = "Ratio is required")
    private Long ratioBps;
}
