package com.lendledger.core;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Basis-point arithmetic over ledger amounts.
 *
 * <p>Products are formed in {@link BigDecimal}, so an intermediate never overflows; only
 * the final quotient has to fit a long. Every quotient truncates toward zero. Operands are
 * non-negative amounts, rates and counters.
 */
public final class BpsMath {

    public static final long BPS_SCALE = 10_000L;

    private static final BigDecimal MAX_LONG = BigDecimal.valueOf(Long.MAX_VALUE);

    private BpsMath() {}

    /**
     * {@code a * b / divisor}, truncated.
     *
     * @throws ArithmeticException if the quotient does not fit a long
     */
    public static long mulDiv(long a, long b, long divisor) {
        return quotient(a, b, divisor).longValueExact();
    }

    /** {@code a * b / divisor}, truncated and capped at {@link Long#MAX_VALUE}. */
    public static long mulDivCapped(long a, long b, long divisor) {
        BigDecimal quotient = quotient(a, b, divisor);
        return quotient.compareTo(MAX_LONG) > 0 ? Long.MAX_VALUE : quotient.longValue();
    }

    /** {@code a + b}, capped at {@link Long#MAX_VALUE}. */
    public static long cappedAdd(long a, long b) {
        return b > Long.MAX_VALUE - a ? Long.MAX_VALUE : a + b;
    }

    private static BigDecimal quotient(long a, long b, long divisor) {
        return BigDecimal.valueOf(a)
                .multiply(BigDecimal.valueOf(b))
                .divide(BigDecimal.valueOf(divisor), 0, RoundingMode.DOWN);
    }
}
