package com.lendledger.loan;

import com.lendledger.domain.enums.RiskTier;
import lombok.Builder;
import lombok.Value;

/** Rate a borrower would be offered right now, with the inputs that produced it. */
@Value
@Builder
public class DynamicRateQuote {

    int rateBps;
    RiskTier riskTier;
    long utilizationRateBps;
    long collateralRatioBps;
}
