package com.lendledger.utilization;

import com.lendledger.core.BpsMath;
import com.lendledger.domain.model.AssetUtilization;
import com.lendledger.domain.vo.AssetRef;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-asset supply/demand accounting backing the utilization component of the dynamic rate.
 *
 * <p>Lifecycle mapping:
 * <ul>
 *   <li>create: borrowed += principal, activeLoans += 1 (demand)</li>
 *   <li>fund: supplied += principal (supply)</li>
 *   <li>repay / liquidate: borrowed -= principal, activeLoans -= 1</li>
 * </ul>
 *
 * <p>Subtractions are floor-clamped at zero instead of failing. A clamp means the counters
 * drifted from the loan book; it is logged at WARN and the ledger keeps serving. This
 * favours availability over strict exactness and is intentional. Additions cap at
 * {@link Long#MAX_VALUE} for the same reason, so recording a transition never throws.
 */
@Component
public class UtilizationTracker {

    private static final Logger log = LoggerFactory.getLogger(UtilizationTracker.class);

    public static final long BPS_SCALE = BpsMath.BPS_SCALE;

    private final Map<AssetRef, AssetUtilization> utilization = new ConcurrentHashMap<>();

    /**
     * Returns borrowed * 10000 / supplied for the asset, or 0 when nothing has been supplied.
     * Demand can far exceed supply, so the rate is capped at {@link Long#MAX_VALUE}.
     */
    public long utilizationRate(AssetRef asset) {
        AssetUtilization current = utilization.get(asset);
        if (current == null || current.getTotalSupplied() == 0) {
            return 0;
        }
        return BpsMath.mulDivCapped(current.getTotalBorrowed(), BPS_SCALE, current.getTotalSupplied());
    }

    /**
     * Applies deltas to the asset's counters. Deltas are magnitudes; {@code isAddition}
     * selects the direction for all three.
     */
    public void update(
            AssetRef asset, long suppliedDelta, long borrowedDelta, long loanCountDelta, boolean isAddition) {
        if (suppliedDelta < 0 || borrowedDelta < 0 || loanCountDelta < 0) {
            throw new IllegalArgumentException("Utilization deltas are magnitudes and must not be negative");
        }
        AssetUtilization current = utilization.computeIfAbsent(asset, a -> AssetUtilization.empty());
        if (isAddition) {
            current.setTotalSupplied(BpsMath.cappedAdd(current.getTotalSupplied(), suppliedDelta));
            current.setTotalBorrowed(BpsMath.cappedAdd(current.getTotalBorrowed(), borrowedDelta));
            current.setActiveLoanCount(BpsMath.cappedAdd(current.getActiveLoanCount(), loanCountDelta));
        } else {
            current.setTotalSupplied(
                    clampedSubtract(asset, "totalSupplied", current.getTotalSupplied(), suppliedDelta));
            current.setTotalBorrowed(
                    clampedSubtract(asset, "totalBorrowed", current.getTotalBorrowed(), borrowedDelta));
            current.setActiveLoanCount(
                    clampedSubtract(asset, "activeLoanCount", current.getActiveLoanCount(), loanCountDelta));
        }
    }

    public void recordDemand(AssetRef asset, long principal) {
        update(asset, 0, principal, 1, true);
    }

    public void recordSupply(AssetRef asset, long principal) {
        update(asset, principal, 0, 0, true);
    }

    public void recordClosure(AssetRef asset, long principal) {
        update(asset, 0, principal, 1, false);
    }

    /** Returns a detached copy of the asset's counters (zeros if never touched). */
    public AssetUtilization get(AssetRef asset) {
        AssetUtilization current = utilization.get(asset);
        return current == null ? AssetUtilization.empty() : current.toBuilder().build();
    }

    private long clampedSubtract(AssetRef asset, String field, long current, long delta) {
        if (delta > current) {
            log.warn("Utilization {} for {} clamped at zero: {} - {}", field, asset, current, delta);
            return 0;
        }
        return current - delta;
    }
}
