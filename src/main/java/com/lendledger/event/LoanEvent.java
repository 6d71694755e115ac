package com.lendledger.event;

import com.lendledger.domain.enums.LoanStatus;
import com.lendledger.domain.vo.AssetRef;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a loan transition has been committed. Carries an immutable snapshot of
 * the fields listeners need, not the live loan record.
 *
 * <p>{@code amount} depends on the type: principal for CREATED and FUNDED, total
 * repayment for REPAID, seized collateral amount for LIQUIDATED.
 */
public class LoanEvent extends ApplicationEvent {

    private final LoanEventType eventType;
    private final long loanId;
    private final String borrower;
    private final String lender;
    private final AssetRef loanAsset;
    private final LoanStatus status;
    private final long amount;
    private final long height;

    public LoanEvent(
            Object source,
            LoanEventType eventType,
            long loanId,
            String borrower,
            String lender,
            AssetRef loanAsset,
            LoanStatus status,
            long amount,
            long height) {
        super(source);
        this.eventType = eventType;
        this.loanId = loanId;
        this.borrower = borrower;
        this.lender = lender;
        this.loanAsset = loanAsset;
        this.status = status;
        this.amount = amount;
        this.height = height;
    }

    public LoanEventType getEventType() {
        return eventType;
    }

    public long getLoanId() {
        return loanId;
    }

    public String getBorrower() {
        return borrower;
    }

    /** Null for CREATED events. */
    public String getLender() {
        return lender;
    }

    public AssetRef getLoanAsset() {
        return loanAsset;
    }

    public LoanStatus getStatus() {
        return status;
    }

    public long getAmount() {
        return amount;
    }

    public long getHeight() {
        return height;
    }

    @Override
    public String toString() {
        return "LoanEvent{" + eventType + ", loan=" + loanId + ", amount=" + amount + ", height=" + height + "}";
    }
}
