package com.lendledger.admin;

import lombok.Builder;
import lombok.Value;

/** Full set of dynamic rate parameters, applied atomically by the admin service. */
@Value
@Builder
public class DynamicRateParams {

    int baseRateBps;
    int utilizationMultiplier;
    int riskMultiplier;
    int maxRateBps;
    int minRateBps;
}
