package com.lendledger.observability;

import com.lendledger.event.LoanEvent;
import com.lendledger.event.LoanEventType;
import com.lendledger.loan.LoanStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the loan book:
 * <ul>
 *   <li><b>loans.created / loans.funded / loans.repaid / loans.liquidated</b> (counters),
 *       incremented from committed {@link LoanEvent}s</li>
 *   <li><b>loans.principal</b> (counter, tagged by event type): principal moved through
 *       funding</li>
 *   <li><b>loans.active</b> (gauge): ACTIVE loans in the store, evaluated at scrape time</li>
 * </ul>
 */
@Service
public class LedgerMetricsService {

    private final Map<LoanEventType, Counter> transitionCounters = new EnumMap<>(LoanEventType.class);
    private final Counter fundedPrincipalCounter;

    public LedgerMetricsService(MeterRegistry meterRegistry, LoanStore loanStore) {
        for (LoanEventType type : LoanEventType.values()) {
            transitionCounters.put(
                    type,
                    Counter.builder("loans." + type.name().toLowerCase())
                            .description("Loans that reached the " + type + " transition")
                            .register(meterRegistry));
        }

        this.fundedPrincipalCounter = Counter.builder("loans.principal")
                .description("Principal disbursed by funded loans")
                .tag("event", "funded")
                .register(meterRegistry);

        meterRegistry.gauge("loans.active", loanStore, LoanStore::countActive);
    }

    @EventListener
    @Order(20)
    public void onLoanEvent(LoanEvent event) {
        transitionCounters.get(event.getEventType()).increment();
        if (event.getEventType() == LoanEventType.FUNDED) {
            fundedPrincipalCounter.increment(event.getAmount());
        }
    }
}
