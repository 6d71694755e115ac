package com.lendledger.domain.model;

import com.lendledger.domain.enums.LoanStatus;
import com.lendledger.domain.enums.RiskTier;
import com.lendledger.domain.vo.AssetRef;
import com.lendledger.domain.vo.CollateralSpec;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A single-borrower, single-lender, single-collateral loan record.
 *
 * <p>Terms (principal, assets, collateral, rate, duration) and the pricing snapshot
 * (risk tier, dynamic rate, collateral ratio) are fixed at creation. Only the lifecycle
 * fields change, and each through exactly one transition method:
 * <ul>
 *   <li>{@link #markFunded}: PENDING -> ACTIVE, sets lender and fundedAt</li>
 *   <li>{@link #markRepaid}: ACTIVE -> REPAID, sets repaidAt</li>
 *   <li>{@link #markLiquidated}: ACTIVE -> LIQUIDATED</li>
 * </ul>
 *
 * <p>Records are never deleted; terminal loans stay in the store as history.
 * Instances are owned by {@link com.lendledger.loan.LoanStore} and mutated only by
 * {@link com.lendledger.loan.LoanRegistry}.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class Loan {

    private final long id;
    private final String borrower;
    private final long principal;
    private final AssetRef loanAsset;
    private final CollateralSpec collateral;

    /** Rate applied to this loan, in basis points. */
    private final int interestRateBps;

    /** Rate the engine derived at creation, kept for audit even when an explicit rate was chosen. */
    private final int dynamicRateBps;

    private final RiskTier riskTier;
    private final long collateralRatioBps;
    private final long durationBlocks;
    private final long createdAt;

    private String lender;
    private Long fundedAt;
    private Long repaidAt;

    @Builder.Default
    private LoanStatus status = LoanStatus.PENDING;

    public void markFunded(String lender, long fundedAt) {
        transitionTo(LoanStatus.ACTIVE);
        this.lender = lender;
        this.fundedAt = fundedAt;
    }

    public void markRepaid(long repaidAt) {
        transitionTo(LoanStatus.REPAID);
        this.repaidAt = repaidAt;
    }

    public void markLiquidated() {
        transitionTo(LoanStatus.LIQUIDATED);
    }

    /** Block height at which the lender may liquidate, or null while unfunded. */
    public Long getDueAt() {
        return fundedAt == null ? null : fundedAt + durationBlocks;
    }

    public boolean isOverdueAt(long height) {
        return status == LoanStatus.ACTIVE && fundedAt != null && height >= fundedAt + durationBlocks;
    }

    private void transitionTo(LoanStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Loan " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }
}
