package com.lendledger.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lendledger.admin.PlatformAdminService;
import com.lendledger.asset.AssetRegistry;
import com.lendledger.clock.LedgerClock;
import com.lendledger.core.LedgerExecutor;
import com.lendledger.domain.enums.LoanStatus;
import com.lendledger.domain.model.LedgerParameters;
import com.lendledger.domain.model.Loan;
import com.lendledger.domain.model.PlatformStats;
import com.lendledger.domain.model.UserStats;
import com.lendledger.event.EventPublisherHelper;
import com.lendledger.event.LoanEvent;
import com.lendledger.exception.ErrorCode;
import com.lendledger.exception.LedgerException;
import com.lendledger.loan.LoanRegistry;
import com.lendledger.loan.LoanStore;
import com.lendledger.loan.LoanTerms;
import com.lendledger.loan.RepaymentResult;
import com.lendledger.observability.LedgerMetricsService;
import com.lendledger.rate.InterestRateEngine;
import com.lendledger.risk.RiskScorer;
import com.lendledger.settlement.InMemoryTransferService;
import com.lendledger.settlement.LoggingExternalAssetHook;
import com.lendledger.settlement.SettlementExecutor;
import com.lendledger.stats.UserStatsStore;
import com.lendledger.utilization.UtilizationTracker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Cross-service test of the loan lifecycle. Wires the real registry, admin service,
 * in-memory custody and metrics together; only the block height is driven by the test.
 * Verifies balances, stats and platform totals end to end: credit -> create -> fund ->
 * repay or liquidate.
 */
class LoanLifecycleIntegrationTest {

    private static final String OWNER = "platform-owner";
    private static final String CUSTODY = "ledger-custody";
    private static final String ALICE = "alice";
    private static final String BOB = "bob";

    private static final long PRINCIPAL = 1_000_000_000L;
    private static final long COLLATERAL = 1_500_000_000L;
    private static final long DURATION = 5256;

    private final AtomicLong height = new AtomicLong(1000);

    private InMemoryTransferService transferService;
    private PlatformAdminService platformAdminService;
    private LoanRegistry loanRegistry;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        LedgerParameters ledgerParameters = LedgerParameters.builder()
                .owner(OWNER)
                .custodyAccount(CUSTODY)
                .platformFeeBps(250)
                .maxDurationBlocks(52_560)
                .minCollateralRatioBps(15_000)
                .baseRateBps(500)
                .utilizationMultiplier(200)
                .riskMultiplier(100)
                .minDynamicRateBps(100)
                .maxDynamicRateBps(2000)
                .build();
        transferService = new InMemoryTransferService();
        LoanStore loanStore = new LoanStore();
        UserStatsStore userStatsStore = new UserStatsStore();
        UtilizationTracker utilizationTracker = new UtilizationTracker();
        AssetRegistry assetRegistry = new AssetRegistry();
        LedgerExecutor ledgerExecutor = new LedgerExecutor();
        LedgerClock ledgerClock = height::get;

        meterRegistry = new SimpleMeterRegistry();
        LedgerMetricsService metricsService = new LedgerMetricsService(meterRegistry, loanStore);
        EventPublisherHelper eventPublisherHelper =
                new EventPublisherHelper(event -> metricsService.onLoanEvent((LoanEvent) event));

        platformAdminService =
                new PlatformAdminService(assetRegistry, ledgerParameters, ledgerExecutor, transferService);
        loanRegistry = new LoanRegistry(
                loanStore,
                userStatsStore,
                utilizationTracker,
                assetRegistry,
                new RiskScorer(userStatsStore),
                new InterestRateEngine(utilizationTracker, ledgerParameters),
                new SettlementExecutor(transferService),
                new LoggingExternalAssetHook(),
                ledgerClock,
                ledgerParameters,
                ledgerExecutor,
                eventPublisherHelper);
    }

    private static LoanTerms termsAt(int rateBps) {
        return LoanTerms.builder()
                .principal(PRINCIPAL)
                .requestedRateBps(rateBps)
                .maxAcceptableRateBps(2000)
                .durationBlocks(DURATION)
                .build();
    }

    @Test
    @DisplayName("Loan is created, funded and repaid at full term with fee routed to the owner")
    void createFundRepay() {
        platformAdminService.creditAccount(OWNER, ALICE, COLLATERAL + 100_000_000L);
        platformAdminService.creditAccount(OWNER, BOB, PRINCIPAL);

        long loanId = loanRegistry.createLoan(ALICE, termsAt(800), COLLATERAL);
        assertThat(transferService.balanceOf(CUSTODY)).isEqualTo(COLLATERAL);

        height.set(2000);
        loanRegistry.fundLoan(BOB, loanId);
        assertThat(transferService.balanceOf(BOB)).isZero();
        assertThat(loanRegistry.getLoan(loanId).getDueAt()).isEqualTo(2000 + DURATION);

        height.set(2000 + DURATION);
        RepaymentResult result = loanRegistry.repayLoan(ALICE, loanId);

        // 1e9 at 800 bps over the full term, fee 250 bps of principal + interest
        assertThat(result.getInterest()).isEqualTo(80_000_000L);
        assertThat(result.getTotalRepayment()).isEqualTo(1_080_000_000L);
        assertThat(result.getPlatformFee()).isEqualTo(27_000_000L);
        assertThat(transferService.balanceOf(BOB)).isEqualTo(1_053_000_000L);
        assertThat(transferService.balanceOf(OWNER)).isEqualTo(27_000_000L);
        assertThat(transferService.balanceOf(CUSTODY)).isZero();
        assertThat(transferService.balanceOf(ALICE)).isEqualTo(COLLATERAL + 20_000_000L);

        Loan loan = loanRegistry.getLoan(loanId);
        assertThat(loan.getStatus()).isEqualTo(LoanStatus.REPAID);
        assertThat(loan.getRepaidAt()).isEqualTo(2000 + DURATION);

        PlatformStats stats = loanRegistry.getPlatformStats();
        assertThat(stats.getTotalLoans()).isEqualTo(1);
        assertThat(stats.getRepaidLoans()).isEqualTo(1);
        assertThat(stats.getTotalVolume()).isEqualTo(PRINCIPAL);
        assertThat(stats.getTotalFeesCollected()).isEqualTo(27_000_000L);

        assertThat(meterRegistry.counter("loans.created").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("loans.repaid").count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("loans.active").gauge().value()).isZero();
    }

    @Test
    @DisplayName("Overdue loan is liquidated and the borrower's default raises their risk")
    void createFundLiquidate() {
        platformAdminService.creditAccount(OWNER, ALICE, COLLATERAL);
        platformAdminService.creditAccount(OWNER, BOB, PRINCIPAL);

        long loanId = loanRegistry.createLoan(ALICE, termsAt(800), COLLATERAL);
        loanRegistry.fundLoan(BOB, loanId);
        assertThat(meterRegistry.get("loans.active").gauge().value()).isEqualTo(1.0);

        height.addAndGet(DURATION - 1);
        assertThatThrownBy(() -> loanRegistry.liquidateLoan(BOB, loanId))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getErrorCode())
                .isEqualTo(ErrorCode.LOAN_NOT_OVERDUE);

        height.incrementAndGet();
        assertThat(loanRegistry.isLoanOverdue(loanId)).isTrue();
        loanRegistry.liquidateLoan(BOB, loanId);

        assertThat(transferService.balanceOf(BOB)).isEqualTo(COLLATERAL);
        assertThat(transferService.balanceOf(ALICE)).isEqualTo(PRINCIPAL);
        assertThat(loanRegistry.getLoan(loanId).getStatus()).isEqualTo(LoanStatus.LIQUIDATED);

        UserStats aliceStats = loanRegistry.getUserStats(ALICE);
        assertThat(aliceStats.getDefaultCount()).isEqualTo(1);
        assertThat(loanRegistry.getPlatformStats().getLiquidatedLoans()).isEqualTo(1);
        assertThat(meterRegistry.counter("loans.liquidated").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Failed funding leaves balances and loan state untouched")
    void underfundedLenderRollsBack() {
        platformAdminService.creditAccount(OWNER, ALICE, COLLATERAL);
        platformAdminService.creditAccount(OWNER, BOB, PRINCIPAL - 1);

        long loanId = loanRegistry.createLoan(ALICE, termsAt(800), COLLATERAL);

        assertThatThrownBy(() -> loanRegistry.fundLoan(BOB, loanId))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getErrorCode())
                .isEqualTo(ErrorCode.TRANSFER_FAILED);

        assertThat(transferService.balanceOf(BOB)).isEqualTo(PRINCIPAL - 1);
        assertThat(loanRegistry.getLoan(loanId).getStatus()).isEqualTo(LoanStatus.PENDING);
        assertThat(loanRegistry.getPlatformStats().getTotalVolume()).isZero();
        assertThat(meterRegistry.counter("loans.funded").count()).isZero();
    }
}
