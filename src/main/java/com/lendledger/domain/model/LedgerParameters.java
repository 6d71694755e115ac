package com.lendledger.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Scalar ledger configuration.
 *
 * <p>Loaded from application.properties ({@code lendledger.*}) on startup by
 * {@link com.lendledger.config.LedgerConfig}. The fee, collateral ratio and dynamic rate
 * fields can be changed at runtime through
 * {@link com.lendledger.admin.PlatformAdminService}, which enforces their bounds.
 */
@Data
@Builder
public class LedgerParameters {

    /** Identity allowed to run admin operations and receiving platform fees. */
    private String owner;

    /** Account holding native collateral while loans are open. */
    private String custodyAccount;

    // ==================== Loan Terms ====================

    /** Fee taken from each native repayment, in bps of the total repaid. */
    private int platformFeeBps;

    /** Longest loan duration accepted, in blocks. */
    private long maxDurationBlocks;

    /** Minimum collateral/principal ratio at creation, scaled x10000. */
    private long minCollateralRatioBps;

    // ==================== Dynamic Rate ====================

    private int baseRateBps;

    /** Weight applied to utilization (bps of the utilization rate). */
    private int utilizationMultiplier;

    /** Bps added per risk tier step. */
    private int riskMultiplier;

    private int minDynamicRateBps;
    private int maxDynamicRateBps;
}
