package com.lendledger.domain.model;

import lombok.Builder;
import lombok.Value;

/** Point-in-time platform summary returned by the platform stats query. */
@Value
@Builder
public class PlatformStats {

    long totalLoans;
    long pendingLoans;
    long activeLoans;
    long repaidLoans;
    long liquidatedLoans;

    /** Principal funded in the native asset. */
    long totalVolume;

    /** Platform fees routed to the owner on native repayments. */
    long totalFeesCollected;

    int platformFeeBps;
    long minCollateralRatioBps;
    long maxDurationBlocks;
    int baseRateBps;
    int utilizationMultiplier;
    int riskMultiplier;
    int minDynamicRateBps;
    int maxDynamicRateBps;
}
