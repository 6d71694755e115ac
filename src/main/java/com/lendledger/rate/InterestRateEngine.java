package com.lendledger.rate;

import com.lendledger.core.BpsMath;
import com.lendledger.domain.enums.RiskTier;
import com.lendledger.domain.model.LedgerParameters;
import com.lendledger.domain.vo.AssetRef;
import com.lendledger.utilization.UtilizationTracker;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Prices loans and accrues interest, all in integer basis points.
 *
 * <p><b>Dynamic rate</b>: base + utilization adjustment + risk adjustment + collateral
 * discount, clamped to [minDynamicRate, maxDynamicRate]:
 * <ul>
 *   <li>utilization adj = utilizationRate(asset) * utilizationMultiplier / 10000</li>
 *   <li>risk adj = tier weight (1..5) * riskMultiplier</li>
 *   <li>collateral discount = -50 when the collateral ratio is at least 200%</li>
 * </ul>
 *
 * <p><b>Proportional interest</b>: the rate is a per-term rate applied linearly over
 * elapsed blocks. Every division truncates toward zero in the order documented on
 * {@link #proportionalInterest}, matching the legacy fixed-point accounting; no rounding
 * correction is applied.
 */
@Service
public class InterestRateEngine {

    private static final Logger log = LoggerFactory.getLogger(InterestRateEngine.class);

    public static final long BPS_SCALE = BpsMath.BPS_SCALE;

    private static final BigDecimal SCALE = BigDecimal.valueOf(BPS_SCALE);

    /** Collateral ratio (x10000) at which the over-collateralization discount applies. */
    public static final long DISCOUNT_COLLATERAL_RATIO_BPS = 20_000L;

    public static final int COLLATERAL_DISCOUNT_BPS = 50;

    /** Rates outside this band accrue nothing. */
    public static final int MIN_ACCRUAL_RATE_BPS = 100;

    public static final int MAX_ACCRUAL_RATE_BPS = 10_000;

    private final UtilizationTracker utilizationTracker;
    private final LedgerParameters ledgerParameters;

    public InterestRateEngine(UtilizationTracker utilizationTracker, LedgerParameters ledgerParameters) {
        this.utilizationTracker = utilizationTracker;
        this.ledgerParameters = ledgerParameters;
    }

    /** Dynamic rate using the configured base rate. */
    public int computeDynamicRate(AssetRef asset, RiskTier riskTier, long collateralRatioBps) {
        return computeRate(ledgerParameters.getBaseRateBps(), asset, riskTier, collateralRatioBps);
    }

    public int computeRate(int baseRateBps, AssetRef asset, RiskTier riskTier, long collateralRatioBps) {
        long utilizationRate = utilizationTracker.utilizationRate(asset);
        // Past the max rate the utilization term no longer changes the clamped result
        long utilizationAdj = Math.min(
                BpsMath.mulDivCapped(utilizationRate, ledgerParameters.getUtilizationMultiplier(), BPS_SCALE),
                ledgerParameters.getMaxDynamicRateBps());
        long riskAdj = (long) riskTier.getWeight() * ledgerParameters.getRiskMultiplier();
        long collateralAdj = collateralRatioBps >= DISCOUNT_COLLATERAL_RATIO_BPS ? -COLLATERAL_DISCOUNT_BPS : 0;

        long raw = baseRateBps + utilizationAdj + riskAdj + collateralAdj;
        int rate = (int) clamp(raw, ledgerParameters.getMinDynamicRateBps(), ledgerParameters.getMaxDynamicRateBps());

        log.debug(
                "Dynamic rate for {}: base={} util={} (rate {}) risk={} ({}) collateral={} raw={} -> {}",
                asset,
                baseRateBps,
                utilizationAdj,
                utilizationRate,
                riskAdj,
                riskTier,
                collateralAdj,
                raw,
                rate);
        return rate;
    }

    public boolean isWithinBounds(int rateBps) {
        return rateBps >= ledgerParameters.getMinDynamicRateBps() && rateBps <= ledgerParameters.getMaxDynamicRateBps();
    }

    /**
     * Interest owed after {@code elapsed} blocks of a {@code duration}-block loan.
     *
     * <pre>
     * annualInterest = principal * rateBps / 10000
     * timeFactor     = elapsed * 10000 / duration
     * interest       = annualInterest * timeFactor / 10000
     * </pre>
     *
     * <p>Returns 0 (fails closed) when principal is 0, the rate is outside [100, 10000] bps,
     * or duration is 0; callers validate those inputs on their own. Elapsed past duration
     * keeps accruing linearly. Negative elapsed counts as 0. Intermediate products are
     * unbounded; only the interest itself has to fit a long.
     *
     * @throws ArithmeticException if the interest does not fit a long
     */
    public static long proportionalInterest(long principal, int rateBps, long elapsed, long duration) {
        if (principal <= 0 || rateBps < MIN_ACCRUAL_RATE_BPS || rateBps > MAX_ACCRUAL_RATE_BPS || duration <= 0) {
            return 0;
        }
        long effectiveElapsed = Math.max(0, elapsed);
        BigDecimal annualInterest = BigDecimal.valueOf(BpsMath.mulDiv(principal, rateBps, BPS_SCALE));
        BigDecimal timeFactor = BigDecimal.valueOf(effectiveElapsed)
                .multiply(SCALE)
                .divide(BigDecimal.valueOf(duration), 0, RoundingMode.DOWN);
        return annualInterest
                .multiply(timeFactor)
                .divide(SCALE, 0, RoundingMode.DOWN)
                .longValueExact();
    }

    private static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }
}
