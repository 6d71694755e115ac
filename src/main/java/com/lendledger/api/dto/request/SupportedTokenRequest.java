package com.lendledger.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Range checks for decimals and risk score happen in the admin service so they map to ledger error codes. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SupportedTokenRequest {

    @NotBlank(message = "Token reference is required")
    private String tokenRef;

    @NotNull(message = "Decimals are required")
    private Integer decimals;

    @NotNull(message = "Risk score is required")
    private Integer riskScore;
}
