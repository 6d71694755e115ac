package com.lendledger.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lendledger.domain.enums.LoanStatus;
import com.lendledger.domain.enums.RiskTier;
import com.lendledger.domain.model.Loan;
import com.lendledger.domain.vo.AssetRef;
import com.lendledger.domain.vo.CollateralSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for Loan lifecycle transitions and due-height arithmetic. */
class LoanTest {

    private static Loan pendingLoan() {
        return Loan.builder()
                .id(1L)
                .borrower("alice")
                .principal(1000)
                .loanAsset(AssetRef.nativeAsset())
                .collateral(CollateralSpec.nativeCollateral(1500))
                .interestRateBps(800)
                .dynamicRateBps(800)
                .riskTier(RiskTier.MEDIUM)
                .collateralRatioBps(15_000)
                .durationBlocks(100)
                .createdAt(5)
                .build();
    }

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("New loan is PENDING with no lender")
        void newLoanPending() {
            Loan loan = pendingLoan();

            assertThat(loan.getStatus()).isEqualTo(LoanStatus.PENDING);
            assertThat(loan.getLender()).isNull();
            assertThat(loan.getDueAt()).isNull();
        }

        @Test
        @DisplayName("Funding sets lender and fundedAt")
        void funding() {
            Loan loan = pendingLoan();

            loan.markFunded("bob", 10);

            assertThat(loan.getStatus()).isEqualTo(LoanStatus.ACTIVE);
            assertThat(loan.getLender()).isEqualTo("bob");
            assertThat(loan.getFundedAt()).isEqualTo(10L);
            assertThat(loan.getDueAt()).isEqualTo(110L);
        }

        @Test
        @DisplayName("Repaying a pending loan is illegal")
        void repayPendingIllegal() {
            assertThatThrownBy(() -> pendingLoan().markRepaid(10)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Terminal loans accept no further transitions")
        void terminalIsFinal() {
            Loan loan = pendingLoan();
            loan.markFunded("bob", 10);
            loan.markRepaid(50);

            assertThat(loan.getRepaidAt()).isEqualTo(50L);
            assertThatThrownBy(loan::markLiquidated).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> loan.markFunded("carol", 60)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Status graph only allows forward moves")
        void statusGraph() {
            assertThat(LoanStatus.PENDING.canTransitionTo(LoanStatus.ACTIVE)).isTrue();
            assertThat(LoanStatus.PENDING.canTransitionTo(LoanStatus.REPAID)).isFalse();
            assertThat(LoanStatus.ACTIVE.canTransitionTo(LoanStatus.LIQUIDATED)).isTrue();
            assertThat(LoanStatus.ACTIVE.canTransitionTo(LoanStatus.PENDING)).isFalse();
            assertThat(LoanStatus.LIQUIDATED.isTerminal()).isTrue();
        }
    }

    @Nested
    @DisplayName("Overdue")
    class Overdue {

        @Test
        @DisplayName("Overdue exactly at fundedAt + duration")
        void overdueAtDueHeight() {
            Loan loan = pendingLoan();
            loan.markFunded("bob", 10);

            assertThat(loan.isOverdueAt(109)).isFalse();
            assertThat(loan.isOverdueAt(110)).isTrue();
        }

        @Test
        @DisplayName("Pending and repaid loans are never overdue")
        void onlyActiveCanBeOverdue() {
            Loan loan = pendingLoan();
            assertThat(loan.isOverdueAt(1_000_000)).isFalse();

            loan.markFunded("bob", 10);
            loan.markRepaid(20);
            assertThat(loan.isOverdueAt(1_000_000)).isFalse();
        }
    }
}
