package com.lendledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Running supply/demand totals for one asset. All fields stay non-negative:
 * {@link com.lendledger.utilization.UtilizationTracker} floor-clamps decrements at zero.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AssetUtilization {

    private long totalSupplied;
    private long totalBorrowed;
    private long activeLoanCount;

    public static AssetUtilization empty() {
        return new AssetUtilization();
    }
}
