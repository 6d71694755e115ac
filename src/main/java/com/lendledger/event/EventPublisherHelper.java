package com.lendledger.event;

import com.lendledger.domain.model.Loan;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for ledger events.
 *
 * <p>Called by the loan registry only after a transition has been committed, so a
 * listener never observes a rolled-back operation. Delivery is synchronous.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishLoanCreated(Object source, Loan loan, long height) {
        publish(source, LoanEventType.CREATED, loan, loan.getPrincipal(), height);
    }

    public void publishLoanFunded(Object source, Loan loan, long height) {
        publish(source, LoanEventType.FUNDED, loan, loan.getPrincipal(), height);
    }

    public void publishLoanRepaid(Object source, Loan loan, long totalRepayment, long height) {
        publish(source, LoanEventType.REPAID, loan, totalRepayment, height);
    }

    public void publishLoanLiquidated(Object source, Loan loan, long height) {
        publish(source, LoanEventType.LIQUIDATED, loan, loan.getCollateral().getAmount(), height);
    }

    private void publish(Object source, LoanEventType type, Loan loan, long amount, long height) {
        applicationEventPublisher.publishEvent(new LoanEvent(
                source,
                type,
                loan.getId(),
                loan.getBorrower(),
                loan.getLender(),
                loan.getLoanAsset(),
                loan.getStatus(),
                amount,
                height));
    }
}
