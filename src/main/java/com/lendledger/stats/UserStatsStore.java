package com.lendledger.stats;

import static com.lendledger.core.BpsMath.cappedAdd;

import com.lendledger.domain.model.UserStats;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Per-user lending counters keyed by caller identity.
 *
 * <p>Records are created lazily on first write and never removed. Reads of an unknown
 * user return an all-zero snapshot without creating an entry. Only
 * {@link com.lendledger.loan.LoanRegistry} writes here, each method matching one
 * lifecycle event. Counters cap at {@link Long#MAX_VALUE}, so no record method throws.
 */
@Component
public class UserStatsStore {

    private final Map<String, UserStats> stats = new ConcurrentHashMap<>();

    /** Returns a detached copy of the user's counters (zeros if the user is unknown). */
    public UserStats get(String user) {
        UserStats current = stats.get(user);
        return current == null ? UserStats.empty() : current.toBuilder().build();
    }

    public void recordLoanCreated(String borrower) {
        UserStats userStats = getOrCreate(borrower);
        userStats.setLoansCreated(cappedAdd(userStats.getLoansCreated(), 1));
        userStats.setReputationScore(cappedAdd(userStats.getReputationScore(), 1));
    }

    /**
     * @param countVolume whether the principal counts toward total lent (native loans only)
     */
    public void recordLoanFunded(String lender, long principal, boolean countVolume) {
        UserStats userStats = getOrCreate(lender);
        userStats.setLoansFunded(cappedAdd(userStats.getLoansFunded(), 1));
        userStats.setReputationScore(cappedAdd(userStats.getReputationScore(), 1));
        if (countVolume) {
            userStats.setTotalLent(cappedAdd(userStats.getTotalLent(), principal));
        }
    }

    public void recordRepayment(String borrower, long principal) {
        UserStats userStats = getOrCreate(borrower);
        userStats.setTotalBorrowed(cappedAdd(userStats.getTotalBorrowed(), principal));
    }

    public void recordDefault(String borrower) {
        UserStats userStats = getOrCreate(borrower);
        userStats.setDefaultCount(cappedAdd(userStats.getDefaultCount(), 1));
    }

    public int size() {
        return stats.size();
    }

    private UserStats getOrCreate(String user) {
        return stats.computeIfAbsent(user, u -> UserStats.empty());
    }
}
