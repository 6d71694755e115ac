package com.lendledger.settlement;

import com.lendledger.exception.BaseException;
import com.lendledger.exception.ErrorCode;
import com.lendledger.exception.LedgerException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Executes the native transfers of one ledger operation as a unit.
 *
 * <p>Legs run sequentially in the given order. Zero-amount legs are skipped. If a leg
 * fails (false return or exception), every leg already completed is reversed in
 * reverse order and a {@link LedgerException} with {@link ErrorCode#TRANSFER_FAILED}
 * is thrown. Callers run settlement before touching any ledger store, so a failed
 * settlement leaves the ledger exactly as it was.
 *
 * <p>Non-native movements run as an external step after the native legs. If that step
 * throws, the native legs are reversed the same way, so an operation either moves
 * everything or nothing.
 *
 * <p>A reversal can itself fail (for example if the counterparty spent the funds in
 * between). That case is logged at ERROR with the stranded leg for manual repair; the
 * original failure is still what the caller sees.
 */
@Component
public class SettlementExecutor {

    private static final Logger log = LoggerFactory.getLogger(SettlementExecutor.class);

    private final TransferService transferService;

    public SettlementExecutor(TransferService transferService) {
        this.transferService = transferService;
    }

    /**
     * @param loanId    loan the settlement belongs to, for logging and error details
     * @param operation operation name (CREATE, FUND, REPAY, LIQUIDATE)
     * @param legs      transfers to run, in order
     * @throws LedgerException with TRANSFER_FAILED if any leg fails
     */
    public void settle(long loanId, String operation, List<TransferLeg> legs) {
        settle(loanId, operation, legs, () -> {});
    }

    /**
     * Runs {@code legs}, then {@code externalStep}.
     *
     * @throws LedgerException with TRANSFER_FAILED if a leg fails or the external step throws;
     *     a {@link BaseException} thrown by the step is rethrown unchanged after the reversal
     */
    public void settle(long loanId, String operation, List<TransferLeg> legs, Runnable externalStep) {
        Deque<TransferLeg> completed = runLegs(loanId, operation, legs);

        try {
            externalStep.run();
        } catch (RuntimeException e) {
            log.error(
                    "Loan {} {}: external asset movement failed ({}), reversing {} completed leg(s)",
                    loanId,
                    operation,
                    e.getMessage(),
                    completed.size(),
                    e);
            reverse(loanId, operation, completed);
            if (e instanceof BaseException ledgerFailure) {
                throw ledgerFailure;
            }
            throw new LedgerException(
                    ErrorCode.TRANSFER_FAILED,
                    "External asset movement failed for loan " + loanId + " during " + operation + ": "
                            + e.getMessage(),
                    e);
        }

        if (!completed.isEmpty()) {
            log.debug("Loan {} {}: settled {} leg(s)", loanId, operation, completed.size());
        }
    }

    private Deque<TransferLeg> runLegs(long loanId, String operation, List<TransferLeg> legs) {
        Deque<TransferLeg> completed = new ArrayDeque<>();

        for (TransferLeg leg : legs) {
            if (leg.getAmount() == 0) {
                continue;
            }
            if (!execute(leg)) {
                log.error(
                        "Loan {} {}: leg {} failed ({} from {} to {}), reversing {} completed leg(s)",
                        loanId,
                        operation,
                        leg.getPurpose(),
                        leg.getAmount(),
                        leg.getFrom(),
                        leg.getTo(),
                        completed.size());
                reverse(loanId, operation, completed);
                throw new LedgerException(
                        ErrorCode.TRANSFER_FAILED,
                        "Transfer failed for loan " + loanId + " during " + operation + ": " + leg.getPurpose(),
                        Map.of(
                                "loanId", loanId,
                                "leg", leg.getPurpose(),
                                "amount", leg.getAmount(),
                                "from", leg.getFrom(),
                                "to", leg.getTo()));
            }
            completed.push(leg);
        }
        return completed;
    }

    private void reverse(long loanId, String operation, Deque<TransferLeg> completed) {
        while (!completed.isEmpty()) {
            TransferLeg reversal = completed.pop().reversed();
            if (!execute(reversal)) {
                log.error(
                        "Loan {} {}: REVERSAL FAILED for {} ({} from {} to {}), manual repair required",
                        loanId,
                        operation,
                        reversal.getPurpose(),
                        reversal.getAmount(),
                        reversal.getFrom(),
                        reversal.getTo());
            }
        }
    }

    private boolean execute(TransferLeg leg) {
        try {
            return transferService.transfer(leg.getAmount(), leg.getFrom(), leg.getTo());
        } catch (RuntimeException e) {
            log.error("Transfer service threw on {}: {}", leg.getPurpose(), e.getMessage(), e);
            return false;
        }
    }
}
