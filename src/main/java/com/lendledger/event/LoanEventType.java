package com.lendledger.event;

/** Committed lifecycle transition carried by a {@link LoanEvent}. */
public enum LoanEventType {
    CREATED,
    FUNDED,
    REPAID,
    LIQUIDATED
}
