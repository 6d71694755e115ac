package com.lendledger.domain.enums;

/**
 * Lifecycle status of a loan. Transitions only move forward:
 * PENDING -> ACTIVE -> REPAID or LIQUIDATED. Terminal states are permanent records.
 */
public enum LoanStatus {
    PENDING,
    ACTIVE,
    REPAID,
    LIQUIDATED;

    public boolean isTerminal() {
        return this == REPAID || this == LIQUIDATED;
    }

    /** Whether {@code next} is the single legal successor of this status. */
    public boolean canTransitionTo(LoanStatus next) {
        return switch (this) {
            case PENDING -> next == ACTIVE;
            case ACTIVE -> next == REPAID || next == LIQUIDATED;
            case REPAID, LIQUIDATED -> false;
        };
    }
}
