package com.lendledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-user lending history. Created lazily with all-zero counters by
 * {@link com.lendledger.stats.UserStatsStore} and never deleted.
 *
 * <p>Reputation only grows (one point per loan created or funded); defaults are only
 * recorded by liquidation and permanently raise the borrower's risk tier.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserStats {

    private long loansCreated;
    private long loansFunded;
    private long totalBorrowed;
    private long totalLent;
    private long reputationScore;
    private long defaultCount;

    public static UserStats empty() {
        return new UserStats();
    }
}
