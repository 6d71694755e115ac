package com.lendledger.api.dto.response;

import com.lendledger.domain.enums.AssetKind;
import com.lendledger.domain.enums.LoanStatus;
import com.lendledger.domain.enums.RiskTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flat view of a loan for API clients. Asset references are split into kind and
 * reference columns; heights are block heights, rates and ratios are basis points.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanResponse {

    private long id;
    private String borrower;
    private String lender;
    private LoanStatus status;

    private long principal;
    private AssetKind loanAssetKind;
    private String loanAssetRef;

    private AssetKind collateralKind;
    private String collateralRef;
    private long collateralAmount;
    private Long collateralItemId;

    private int interestRateBps;
    private int dynamicRateBps;
    private RiskTier riskTier;
    private long collateralRatioBps;

    private long durationBlocks;
    private long createdAt;
    private Long fundedAt;
    private Long repaidAt;
    private Long dueAt;
}
