package com.lendledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Whitelisted collectible collection. The floor price is the value credited to any single
 * item of the collection when it is pledged as collateral.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SupportedCollection {

    private String reference;
    private boolean enabled;
    private long floorPrice;
    private int riskScore;
}
