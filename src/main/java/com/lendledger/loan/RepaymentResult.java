package com.lendledger.loan;

import lombok.Builder;
import lombok.Value;

/** Breakdown of a committed repayment. {@code totalRepayment} = principal + interest. */
@Value
@Builder
public class RepaymentResult {

    long loanId;
    long principal;
    long interest;
    long totalRepayment;
    long platformFee;
    long lenderPayout;
    long elapsedBlocks;
    long repaidAt;
}
