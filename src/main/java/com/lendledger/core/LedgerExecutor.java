package com.lendledger.core;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs ledger operations one at a time.
 *
 * <p>Every public operation of the loan registry and the admin service executes inside
 * {@link #execute}, so one operation owns the whole ledger (loans, user stats, utilization,
 * asset registry, parameters) from its first read to its last write. The lock is fair so
 * HTTP callers are served in arrival order. Reentrant so a read issued from inside an
 * operation does not deadlock.
 */
@Component
public class LedgerExecutor {

    private static final Logger log = LoggerFactory.getLogger(LedgerExecutor.class);

    private final ReentrantLock ledgerLock = new ReentrantLock(true);

    public <T> T execute(String operation, Supplier<T> action) {
        ledgerLock.lock();
        try {
            log.debug("Ledger operation started: {}", operation);
            return action.get();
        } finally {
            ledgerLock.unlock();
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread() {
        return ledgerLock.isHeldByCurrentThread();
    }
}
