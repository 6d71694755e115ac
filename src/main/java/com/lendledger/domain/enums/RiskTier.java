package com.lendledger.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Borrower risk tier derived from lending history. The ordinal weight (1..5) is multiplied
 * by the risk multiplier when deriving a dynamic rate.
 */
@Getter
@RequiredArgsConstructor
public enum RiskTier {
    SAFE(1),
    LOW(2),
    MEDIUM(3),
    HIGH(4),
    VERY_HIGH(5);

    private final int weight;
}
