package com.lendledger.risk;

import com.lendledger.domain.enums.RiskTier;
import com.lendledger.domain.model.UserStats;
import com.lendledger.domain.vo.AssetRef;
import com.lendledger.stats.UserStatsStore;
import org.springframework.stereotype.Service;

/**
 * Derives a borrower's risk tier from their lending history.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>no loans created yet: MEDIUM (new-user default)</li>
 *   <li>more than two defaults: VERY_HIGH</li>
 *   <li>any default: HIGH</li>
 *   <li>reputation of 10 or more: SAFE</li>
 *   <li>reputation of 5 or more: LOW</li>
 *   <li>otherwise: MEDIUM</li>
 * </ol>
 *
 * <p>The collateral asset is accepted so callers already pass it, but it does not
 * influence the tier yet. Collateral quality reaches the rate only through the
 * collateral-ratio discount in {@link com.lendledger.rate.InterestRateEngine}.
 */
@Service
public class RiskScorer {

    static final int SAFE_REPUTATION = 10;
    static final int LOW_REPUTATION = 5;
    static final int VERY_HIGH_DEFAULTS = 2;

    private final UserStatsStore userStatsStore;

    public RiskScorer(UserStatsStore userStatsStore) {
        this.userStatsStore = userStatsStore;
    }

    public RiskTier score(String user, AssetRef collateralAsset) {
        return score(userStatsStore.get(user));
    }

    RiskTier score(UserStats stats) {
        if (stats.getLoansCreated() == 0) {
            return RiskTier.MEDIUM;
        }
        if (stats.getDefaultCount() > VERY_HIGH_DEFAULTS) {
            return RiskTier.VERY_HIGH;
        }
        if (stats.getDefaultCount() > 0) {
            return RiskTier.HIGH;
        }
        if (stats.getReputationScore() >= SAFE_REPUTATION) {
            return RiskTier.SAFE;
        }
        if (stats.getReputationScore() >= LOW_REPUTATION) {
            return RiskTier.LOW;
        }
        return RiskTier.MEDIUM;
    }
}
