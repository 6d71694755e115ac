package com.lendledger.loan;

import lombok.Builder;
import lombok.Value;

/**
 * Borrower-chosen terms shared by every loan creation entry point.
 *
 * <p>{@code requestedRateBps} of 0 asks for the dynamic rate. {@code maxAcceptableRateBps}
 * caps whichever rate ends up applied; the request is rejected rather than priced above it.
 */
@Value
@Builder(toBuilder = true)
public class LoanTerms {

    long principal;
    int requestedRateBps;
    int maxAcceptableRateBps;
    long durationBlocks;
}
