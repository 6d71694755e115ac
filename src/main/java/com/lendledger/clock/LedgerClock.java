package com.lendledger.clock;

/**
 * Monotonic block-height source. Ledger operations read it once and use that single value
 * for every timestamp they write.
 */
public interface LedgerClock {

    long currentHeight();
}
