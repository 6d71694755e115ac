package com.lendledger.loan;

import com.lendledger.core.BpsMath;
import com.lendledger.domain.enums.LoanStatus;
import com.lendledger.domain.model.Loan;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Owned loan book: records keyed by id, the id counter, and the platform-wide native
 * volume and fee totals.
 *
 * <p>Ids are assigned densely from 1; {@link #getCounter()} is the highest id issued, so
 * any id in [1, counter] resolves. Loans are never removed. The volume and fee totals
 * cap at {@link Long#MAX_VALUE}.
 */
@Component
public class LoanStore {

    private final Map<Long, Loan> loans = new ConcurrentHashMap<>();

    private long counter;
    private long totalVolume;
    private long totalFeesCollected;

    /** The id the next saved loan must carry. */
    public long nextId() {
        return counter + 1;
    }

    public void save(Loan loan) {
        if (loan.getId() != nextId()) {
            throw new IllegalStateException("Loan id " + loan.getId() + " out of sequence, expected " + nextId());
        }
        loans.put(loan.getId(), loan);
        counter = loan.getId();
    }

    public Optional<Loan> find(long id) {
        if (id < 1 || id > counter) {
            return Optional.empty();
        }
        return Optional.ofNullable(loans.get(id));
    }

    public long getCounter() {
        return counter;
    }

    public Map<LoanStatus, Long> countByStatus() {
        Map<LoanStatus, Long> counts = new EnumMap<>(LoanStatus.class);
        for (LoanStatus status : LoanStatus.values()) {
            counts.put(status, 0L);
        }
        loans.values().forEach(loan -> counts.merge(loan.getStatus(), 1L, Long::sum));
        return counts;
    }

    public long countActive() {
        return loans.values().stream()
                .filter(loan -> loan.getStatus() == LoanStatus.ACTIVE)
                .count();
    }

    public void recordVolume(long principal) {
        totalVolume = BpsMath.cappedAdd(totalVolume, principal);
    }

    public void recordFee(long fee) {
        totalFeesCollected = BpsMath.cappedAdd(totalFeesCollected, fee);
    }

    public long getTotalVolume() {
        return totalVolume;
    }

    public long getTotalFeesCollected() {
        return totalFeesCollected;
    }
}
