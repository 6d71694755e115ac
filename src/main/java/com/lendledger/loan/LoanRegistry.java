package com.lendledger.loan;

import com.lendledger.asset.AssetRegistry;
import com.lendledger.clock.LedgerClock;
import com.lendledger.core.BpsMath;
import com.lendledger.core.LedgerExecutor;
import com.lendledger.domain.enums.AssetKind;
import com.lendledger.domain.enums.LoanStatus;
import com.lendledger.domain.enums.RiskTier;
import com.lendledger.domain.model.AssetUtilization;
import com.lendledger.domain.model.LedgerParameters;
import com.lendledger.domain.model.Loan;
import com.lendledger.domain.model.PlatformStats;
import com.lendledger.domain.model.SupportedCollection;
import com.lendledger.domain.model.UserStats;
import com.lendledger.domain.vo.AssetRef;
import com.lendledger.domain.vo.CollateralSpec;
import com.lendledger.event.EventPublisherHelper;
import com.lendledger.exception.ErrorCode;
import com.lendledger.exception.LedgerException;
import com.lendledger.exception.ResourceNotFoundException;
import com.lendledger.exception.UnauthorizedException;
import com.lendledger.rate.InterestRateEngine;
import com.lendledger.risk.RiskScorer;
import com.lendledger.settlement.ExternalAssetHook;
import com.lendledger.settlement.SettlementExecutor;
import com.lendledger.settlement.TransferLeg;
import com.lendledger.stats.UserStatsStore;
import com.lendledger.utilization.UtilizationTracker;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The loan lifecycle state machine: PENDING -> ACTIVE -> REPAID | LIQUIDATED.
 *
 * <p>Every operation follows the same three phases inside {@link LedgerExecutor}:
 * <ol>
 *   <li><b>Validate:</b> every precondition is checked first; the first failure throws a
 *       {@link LedgerException} with the matching {@link ErrorCode}.</li>
 *   <li><b>Settle:</b> native transfers run through {@link SettlementExecutor}, which
 *       reverses completed legs if a later one fails. Non-native movements go through
 *       the {@link ExternalAssetHook} as the settlement's external step, so a failing hook
 *       also reverses the native legs.</li>
 *   <li><b>Commit:</b> loan record, utilization counters and user stats are written,
 *       then a {@link com.lendledger.event.LoanEvent} is published.</li>
 * </ol>
 * Nothing in the commit phase can fail on valid state: every amount it writes is computed
 * during validation and the stores cap their running totals instead of throwing. An
 * aborted operation therefore leaves the ledger untouched.
 *
 * <p>Funding has two entry points, {@link #fundLoan} for native loans and
 * {@link #fundTokenLoan} for token loans, so the transfer semantics a lender signs up for
 * are explicit at the call site.
 */
@Service
public class LoanRegistry {

    private static final Logger log = LoggerFactory.getLogger(LoanRegistry.class);

    private static final long BPS_SCALE = BpsMath.BPS_SCALE;

    private final LoanStore loanStore;
    private final UserStatsStore userStatsStore;
    private final UtilizationTracker utilizationTracker;
    private final AssetRegistry assetRegistry;
    private final RiskScorer riskScorer;
    private final InterestRateEngine interestRateEngine;
    private final SettlementExecutor settlementExecutor;
    private final ExternalAssetHook externalAssetHook;
    private final LedgerClock ledgerClock;
    private final LedgerParameters ledgerParameters;
    private final LedgerExecutor ledgerExecutor;
    private final EventPublisherHelper eventPublisherHelper;

    public LoanRegistry(
            LoanStore loanStore,
            UserStatsStore userStatsStore,
            UtilizationTracker utilizationTracker,
            AssetRegistry assetRegistry,
            RiskScorer riskScorer,
            InterestRateEngine interestRateEngine,
            SettlementExecutor settlementExecutor,
            ExternalAssetHook externalAssetHook,
            LedgerClock ledgerClock,
            LedgerParameters ledgerParameters,
            LedgerExecutor ledgerExecutor,
            EventPublisherHelper eventPublisherHelper) {
        this.loanStore = loanStore;
        this.userStatsStore = userStatsStore;
        this.utilizationTracker = utilizationTracker;
        this.assetRegistry = assetRegistry;
        this.riskScorer = riskScorer;
        this.interestRateEngine = interestRateEngine;
        this.settlementExecutor = settlementExecutor;
        this.externalAssetHook = externalAssetHook;
        this.ledgerClock = ledgerClock;
        this.ledgerParameters = ledgerParameters;
        this.ledgerExecutor = ledgerExecutor;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ========================
    // CREATION
    // ========================

    /** Native loan against native collateral. */
    public long createLoan(String borrower, LoanTerms terms, long collateralAmount) {
        return ledgerExecutor.execute(
                "createLoan",
                () -> create(
                        borrower, terms, AssetRef.nativeAsset(), CollateralSpec.nativeCollateral(collateralAmount)));
    }

    /** Native loan against a registered fungible token. */
    public long createLoanWithTokenCollateral(
            String borrower, LoanTerms terms, String tokenRef, long collateralAmount) {
        return ledgerExecutor.execute(
                "createLoanWithTokenCollateral",
                () -> create(
                        borrower, terms, AssetRef.nativeAsset(), CollateralSpec.token(tokenRef, collateralAmount)));
    }

    /** Native loan against one item of a registered collection, valued at the collection floor price. */
    public long createLoanWithNftCollateral(String borrower, LoanTerms terms, String collectionRef, Long itemId) {
        return ledgerExecutor.execute(
                "createLoanWithNftCollateral",
                () -> create(
                        borrower,
                        terms,
                        AssetRef.nativeAsset(),
                        new CollateralSpec(AssetRef.collection(collectionRef), 0L, itemId)));
    }

    /** Loan denominated in a registered token, against native collateral. */
    public long createTokenLoan(String borrower, LoanTerms terms, String loanTokenRef, long collateralAmount) {
        return ledgerExecutor.execute(
                "createTokenLoan",
                () -> create(
                        borrower,
                        terms,
                        AssetRef.token(loanTokenRef),
                        CollateralSpec.nativeCollateral(collateralAmount)));
    }

    private long create(String borrower, LoanTerms terms, AssetRef loanAsset, CollateralSpec requested) {
        requireCaller(borrower);
        long height = ledgerClock.currentHeight();

        // Validate
        if (terms.getPrincipal() <= 0) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "Principal must be positive: " + terms.getPrincipal());
        }
        validateCollateralShape(requested);
        if (terms.getDurationBlocks() <= 0 || terms.getDurationBlocks() > ledgerParameters.getMaxDurationBlocks()) {
            throw new LedgerException(
                    ErrorCode.INVALID_DURATION,
                    "Duration must be in (0, " + ledgerParameters.getMaxDurationBlocks() + "]: "
                            + terms.getDurationBlocks());
        }
        assetRegistry.requireUsable(loanAsset);
        CollateralSpec collateral = assessCollateral(requested);

        long collateralRatioBps = scaledRatio(collateral.getAmount(), terms.getPrincipal());
        if (collateralRatioBps < ledgerParameters.getMinCollateralRatioBps()) {
            throw new LedgerException(
                    ErrorCode.INSUFFICIENT_COLLATERAL,
                    "Collateral ratio " + collateralRatioBps + " below minimum "
                            + ledgerParameters.getMinCollateralRatioBps(),
                    Map.of(
                            "collateralRatioBps", collateralRatioBps,
                            "minCollateralRatioBps", ledgerParameters.getMinCollateralRatioBps()));
        }

        RiskTier riskTier = riskScorer.score(borrower, collateral.getAsset());
        int dynamicRate = interestRateEngine.computeDynamicRate(loanAsset, riskTier, collateralRatioBps);
        int appliedRate = resolveRate(terms, dynamicRate);

        long loanId = loanStore.nextId();

        // Settle
        if (collateral.getKind() == AssetKind.NATIVE) {
            settlementExecutor.settle(
                    loanId,
                    "CREATE",
                    List.of(TransferLeg.of(
                            "collateral-deposit",
                            collateral.getAmount(),
                            borrower,
                            ledgerParameters.getCustodyAccount())));
        } else {
            settlementExecutor.settle(
                    loanId, "CREATE", List.of(), () -> externalAssetHook.lockCollateral(loanId, borrower, collateral));
        }

        // Commit
        Loan loan = Loan.builder()
                .id(loanId)
                .borrower(borrower)
                .principal(terms.getPrincipal())
                .loanAsset(loanAsset)
                .collateral(collateral)
                .interestRateBps(appliedRate)
                .dynamicRateBps(dynamicRate)
                .riskTier(riskTier)
                .collateralRatioBps(collateralRatioBps)
                .durationBlocks(terms.getDurationBlocks())
                .createdAt(height)
                .status(LoanStatus.PENDING)
                .build();
        loanStore.save(loan);
        utilizationTracker.recordDemand(loanAsset, terms.getPrincipal());
        userStatsStore.recordLoanCreated(borrower);

        log.info(
                "Loan {} created: borrower={} principal={} {} collateral={} ratio={} rate={} (dynamic {}, tier {})",
                loanId,
                borrower,
                terms.getPrincipal(),
                loanAsset,
                collateral.getAsset(),
                collateralRatioBps,
                appliedRate,
                dynamicRate,
                riskTier);
        eventPublisherHelper.publishLoanCreated(this, loan, height);
        return loanId;
    }

    private void validateCollateralShape(CollateralSpec collateral) {
        switch (collateral.getKind()) {
            case NATIVE -> {
                if (collateral.getAsset().getReference() != null || collateral.getItemId() != null) {
                    throw new LedgerException(
                            ErrorCode.INVALID_COLLATERAL_TYPE, "Native collateral takes neither reference nor item id");
                }
                requirePositiveCollateral(collateral);
            }
            case TOKEN -> {
                if (collateral.getItemId() != null) {
                    throw new LedgerException(
                            ErrorCode.INVALID_COLLATERAL_TYPE, "Token collateral does not take an item id");
                }
                requirePositiveCollateral(collateral);
            }
            case COLLECTIBLE -> {
                if (collateral.getItemId() == null || collateral.getItemId() < 0) {
                    throw new LedgerException(
                            ErrorCode.INVALID_COLLATERAL_TYPE, "Collectible collateral requires an item id");
                }
            }
        }
    }

    private void requirePositiveCollateral(CollateralSpec collateral) {
        if (collateral.getAmount() <= 0) {
            throw new LedgerException(
                    ErrorCode.INVALID_AMOUNT, "Collateral amount must be positive: " + collateral.getAmount());
        }
    }

    /** Resolves the collateral's value; collectibles are worth their collection's floor price. */
    private CollateralSpec assessCollateral(CollateralSpec collateral) {
        return switch (collateral.getKind()) {
            case NATIVE, TOKEN -> {
                assetRegistry.requireUsable(collateral.getAsset());
                yield collateral;
            }
            case COLLECTIBLE -> {
                SupportedCollection collection =
                        assetRegistry.requireEnabledCollection(collateral.getAsset().getReference());
                yield collateral.withAmount(collection.getFloorPrice());
            }
        };
    }

    private int resolveRate(LoanTerms terms, int dynamicRate) {
        int appliedRate = dynamicRate;
        if (terms.getRequestedRateBps() > 0) {
            if (!interestRateEngine.isWithinBounds(terms.getRequestedRateBps())) {
                throw new LedgerException(
                        ErrorCode.INVALID_INTEREST,
                        "Requested rate " + terms.getRequestedRateBps() + " outside ["
                                + ledgerParameters.getMinDynamicRateBps() + ", "
                                + ledgerParameters.getMaxDynamicRateBps() + "]");
            }
            appliedRate = terms.getRequestedRateBps();
        } else if (terms.getRequestedRateBps() < 0) {
            throw new LedgerException(
                    ErrorCode.INVALID_INTEREST, "Requested rate must not be negative: " + terms.getRequestedRateBps());
        }
        if (appliedRate > terms.getMaxAcceptableRateBps()) {
            throw new LedgerException(
                    ErrorCode.RATE_REJECTED,
                    "Rate " + appliedRate + " exceeds maximum acceptable rate " + terms.getMaxAcceptableRateBps(),
                    Map.of("rateBps", appliedRate, "maxAcceptableRateBps", terms.getMaxAcceptableRateBps()));
        }
        return appliedRate;
    }

    // ========================
    // FUNDING
    // ========================

    /** Funds a native loan: principal moves from lender to borrower. */
    public void fundLoan(String lender, long loanId) {
        ledgerExecutor.run("fundLoan", () -> fund(lender, loanId, AssetKind.NATIVE));
    }

    /** Funds a token loan. The token movement goes through the external asset hook. */
    public void fundTokenLoan(String lender, long loanId) {
        ledgerExecutor.run("fundTokenLoan", () -> fund(lender, loanId, AssetKind.TOKEN));
    }

    private void fund(String lender, long loanId, AssetKind entryKind) {
        requireCaller(lender);
        long height = ledgerClock.currentHeight();
        Loan loan = requireLoan(loanId);

        if (loan.getStatus() != LoanStatus.PENDING) {
            throw new LedgerException(ErrorCode.ALREADY_FUNDED, "Loan " + loanId + " is already " + loan.getStatus());
        }
        if (lender.equals(loan.getBorrower())) {
            throw new UnauthorizedException("Borrower cannot fund their own loan " + loanId);
        }
        if (loan.getLoanAsset().getKind() != entryKind) {
            throw new LedgerException(
                    ErrorCode.UNSUPPORTED_ASSET,
                    "Loan " + loanId + " is denominated in " + loan.getLoanAsset() + ", not " + entryKind);
        }

        boolean nativeLoan = loan.getLoanAsset().isNative();
        if (nativeLoan) {
            settlementExecutor.settle(
                    loanId,
                    "FUND",
                    List.of(TransferLeg.of("principal-disbursement", loan.getPrincipal(), lender, loan.getBorrower())));
        } else {
            settlementExecutor.settle(
                    loanId,
                    "FUND",
                    List.of(),
                    () -> externalAssetHook.transferLoanAsset(
                            loanId, loan.getLoanAsset(), loan.getPrincipal(), lender, loan.getBorrower()));
        }

        loan.markFunded(lender, height);
        utilizationTracker.recordSupply(loan.getLoanAsset(), loan.getPrincipal());
        userStatsStore.recordLoanFunded(lender, loan.getPrincipal(), nativeLoan);
        if (nativeLoan) {
            loanStore.recordVolume(loan.getPrincipal());
        }

        log.info("Loan {} funded by {} at height {}, due at {}", loanId, lender, height, loan.getDueAt());
        eventPublisherHelper.publishLoanFunded(this, loan, height);
    }

    // ========================
    // REPAYMENT
    // ========================

    /**
     * Repays an active loan with proportional interest. Native loans pay the lender
     * total minus the platform fee and route the fee to the owner; native collateral
     * returns from custody to the borrower in the same settlement.
     *
     * @return the repayment breakdown; {@link RepaymentResult#getTotalRepayment()} is principal + interest
     */
    public RepaymentResult repayLoan(String borrower, long loanId) {
        return ledgerExecutor.execute("repayLoan", () -> repay(borrower, loanId));
    }

    private RepaymentResult repay(String borrower, long loanId) {
        requireCaller(borrower);
        long height = ledgerClock.currentHeight();
        Loan loan = requireLoan(loanId);

        if (!borrower.equals(loan.getBorrower())) {
            throw new UnauthorizedException("Only the borrower can repay loan " + loanId);
        }
        requireActive(loan);

        long elapsed = height - loan.getFundedAt();
        long interest;
        long total;
        long fee;
        try {
            interest = InterestRateEngine.proportionalInterest(
                    loan.getPrincipal(), loan.getInterestRateBps(), elapsed, loan.getDurationBlocks());
            total = Math.addExact(loan.getPrincipal(), interest);
            fee = BpsMath.mulDiv(total, ledgerParameters.getPlatformFeeBps(), BPS_SCALE);
        } catch (ArithmeticException e) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "Repayment amount overflows for loan " + loanId, e);
        }
        long lenderPayout = total - fee;

        List<TransferLeg> legs = new ArrayList<>();
        boolean nativeLoan = loan.getLoanAsset().isNative();
        if (nativeLoan) {
            legs.add(TransferLeg.of("repayment-to-lender", lenderPayout, borrower, loan.getLender()));
            legs.add(TransferLeg.of("platform-fee", fee, borrower, ledgerParameters.getOwner()));
        }
        CollateralSpec collateral = loan.getCollateral();
        if (collateral.getKind() == AssetKind.NATIVE) {
            legs.add(TransferLeg.of(
                    "collateral-return", collateral.getAmount(), ledgerParameters.getCustodyAccount(), borrower));
        }
        // Token loans only take native collateral, so at most one hook call applies
        settlementExecutor.settle(loanId, "REPAY", legs, () -> {
            if (!nativeLoan) {
                externalAssetHook.transferLoanAsset(loanId, loan.getLoanAsset(), total, borrower, loan.getLender());
            }
            if (collateral.getKind() != AssetKind.NATIVE) {
                externalAssetHook.releaseCollateral(loanId, borrower, collateral);
            }
        });

        utilizationTracker.recordClosure(loan.getLoanAsset(), loan.getPrincipal());
        loan.markRepaid(height);
        userStatsStore.recordRepayment(borrower, loan.getPrincipal());
        if (nativeLoan) {
            loanStore.recordFee(fee);
        }

        log.info(
                "Loan {} repaid by {}: principal={} interest={} total={} fee={} elapsed={}",
                loanId,
                borrower,
                loan.getPrincipal(),
                interest,
                total,
                fee,
                elapsed);
        eventPublisherHelper.publishLoanRepaid(this, loan, total, height);

        return RepaymentResult.builder()
                .loanId(loanId)
                .principal(loan.getPrincipal())
                .interest(interest)
                .totalRepayment(total)
                .platformFee(fee)
                .lenderPayout(lenderPayout)
                .elapsedBlocks(elapsed)
                .repaidAt(height)
                .build();
    }

    // ========================
    // LIQUIDATION
    // ========================

    /**
     * Lets the lender seize the collateral of an overdue loan. No repayment happens; the
     * collateral is the lender's only recovery.
     */
    public void liquidateLoan(String lender, long loanId) {
        ledgerExecutor.run("liquidateLoan", () -> liquidate(lender, loanId));
    }

    private void liquidate(String lender, long loanId) {
        requireCaller(lender);
        long height = ledgerClock.currentHeight();
        Loan loan = requireLoan(loanId);

        requireActive(loan);
        if (!lender.equals(loan.getLender())) {
            throw new UnauthorizedException("Only the lender can liquidate loan " + loanId);
        }
        if (!loan.isOverdueAt(height)) {
            throw new LedgerException(
                    ErrorCode.LOAN_NOT_OVERDUE,
                    "Loan " + loanId + " is not overdue until height " + loan.getDueAt(),
                    Map.of("dueAt", loan.getDueAt(), "currentHeight", height));
        }

        CollateralSpec collateral = loan.getCollateral();
        if (collateral.getKind() == AssetKind.NATIVE) {
            settlementExecutor.settle(
                    loanId,
                    "LIQUIDATE",
                    List.of(TransferLeg.of(
                            "collateral-seizure",
                            collateral.getAmount(),
                            ledgerParameters.getCustodyAccount(),
                            lender)));
        } else {
            settlementExecutor.settle(
                    loanId,
                    "LIQUIDATE",
                    List.of(),
                    () -> externalAssetHook.seizeCollateral(loanId, lender, collateral));
        }

        utilizationTracker.recordClosure(loan.getLoanAsset(), loan.getPrincipal());
        userStatsStore.recordDefault(loan.getBorrower());
        loan.markLiquidated();

        log.warn(
                "Loan {} liquidated by {} at height {} (due {}): borrower {} defaulted, collateral {} seized",
                loanId,
                lender,
                height,
                loan.getDueAt(),
                loan.getBorrower(),
                collateral.getAmount());
        eventPublisherHelper.publishLoanLiquidated(this, loan, height);
    }

    // ========================
    // QUERIES
    // ========================

    /**
     * Returns a snapshot of the loan.
     *
     * @throws ResourceNotFoundException if the id is outside [1, counter]
     */
    public Loan getLoan(long loanId) {
        return ledgerExecutor.execute("getLoan", () -> requireLoan(loanId).toBuilder().build());
    }

    /** True only for an active loan at or past its due height; false for any invalid or unfunded id. */
    public boolean isLoanOverdue(long loanId) {
        return ledgerExecutor.execute("isLoanOverdue", () -> loanStore
                .find(loanId)
                .map(loan -> loan.isOverdueAt(ledgerClock.currentHeight()))
                .orElse(false));
    }

    public UserStats getUserStats(String user) {
        return ledgerExecutor.execute("getUserStats", () -> userStatsStore.get(user));
    }

    public AssetUtilization getAssetUtilization(AssetRef asset) {
        return ledgerExecutor.execute("getAssetUtilization", () -> utilizationTracker.get(asset));
    }

    /** Rate {@code user} would be offered for a loan in {@code loanAsset} at the given collateral ratio. */
    public DynamicRateQuote getDynamicRate(
            String user, AssetRef loanAsset, AssetRef collateralAsset, long collateralRatioBps) {
        if (collateralRatioBps < 0) {
            throw new LedgerException(
                    ErrorCode.INVALID_AMOUNT, "Collateral ratio must not be negative: " + collateralRatioBps);
        }
        return ledgerExecutor.execute("getDynamicRate", () -> {
            RiskTier riskTier = riskScorer.score(user, collateralAsset);
            return DynamicRateQuote.builder()
                    .rateBps(interestRateEngine.computeDynamicRate(loanAsset, riskTier, collateralRatioBps))
                    .riskTier(riskTier)
                    .utilizationRateBps(utilizationTracker.utilizationRate(loanAsset))
                    .collateralRatioBps(collateralRatioBps)
                    .build();
        });
    }

    public PlatformStats getPlatformStats() {
        return ledgerExecutor.execute("getPlatformStats", () -> {
            Map<LoanStatus, Long> counts = loanStore.countByStatus();
            return PlatformStats.builder()
                    .totalLoans(loanStore.getCounter())
                    .pendingLoans(counts.get(LoanStatus.PENDING))
                    .activeLoans(counts.get(LoanStatus.ACTIVE))
                    .repaidLoans(counts.get(LoanStatus.REPAID))
                    .liquidatedLoans(counts.get(LoanStatus.LIQUIDATED))
                    .totalVolume(loanStore.getTotalVolume())
                    .totalFeesCollected(loanStore.getTotalFeesCollected())
                    .platformFeeBps(ledgerParameters.getPlatformFeeBps())
                    .minCollateralRatioBps(ledgerParameters.getMinCollateralRatioBps())
                    .maxDurationBlocks(ledgerParameters.getMaxDurationBlocks())
                    .baseRateBps(ledgerParameters.getBaseRateBps())
                    .utilizationMultiplier(ledgerParameters.getUtilizationMultiplier())
                    .riskMultiplier(ledgerParameters.getRiskMultiplier())
                    .minDynamicRateBps(ledgerParameters.getMinDynamicRateBps())
                    .maxDynamicRateBps(ledgerParameters.getMaxDynamicRateBps())
                    .build();
        });
    }

    // ========================
    // INTERNALS
    // ========================

    private Loan requireLoan(long loanId) {
        return loanStore.find(loanId).orElseThrow(() -> new ResourceNotFoundException("Loan", loanId));
    }

    private void requireActive(Loan loan) {
        switch (loan.getStatus()) {
            case ACTIVE -> {
                // transition allowed
            }
            case PENDING -> throw new LedgerException(
                    ErrorCode.LOAN_NOT_FUNDED, "Loan " + loan.getId() + " has not been funded");
            case REPAID, LIQUIDATED -> throw new LedgerException(
                    ErrorCode.LOAN_NOT_ACTIVE, "Loan " + loan.getId() + " is " + loan.getStatus());
        }
    }

    private void requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw new UnauthorizedException("Caller identity is required");
        }
    }

    /** value * 10000 / principal; a ratio beyond a long is reported as {@link Long#MAX_VALUE}. */
    private static long scaledRatio(long value, long principal) {
        return BpsMath.mulDivCapped(value, BPS_SCALE, principal);
    }
}
