package com.lendledger.settlement;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Balance-book transfer service used when no external custody is wired in.
 *
 * <p>Accounts start at zero and are funded through {@link #credit}. A transfer fails
 * without effect when the source balance is short or the receiver's balance would overflow.
 */
public class InMemoryTransferService implements TransferService {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTransferService.class);

    private final Map<String, Long> balances = new ConcurrentHashMap<>();

    @Override
    public synchronized boolean transfer(long amount, String from, String to) {
        if (amount <= 0 || from == null || to == null) {
            return false;
        }
        long available = balanceOf(from);
        if (available < amount) {
            log.warn("Transfer of {} from {} to {} rejected: balance {}", amount, from, to, available);
            return false;
        }
        if (!from.equals(to) && balanceOf(to) > Long.MAX_VALUE - amount) {
            log.warn("Transfer of {} from {} to {} rejected: receiver balance would overflow", amount, from, to);
            return false;
        }
        balances.put(from, available - amount);
        balances.merge(to, amount, Long::sum);
        log.debug("Transferred {} from {} to {}", amount, from, to);
        return true;
    }

    public synchronized void credit(String account, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Credit amount must be positive: " + amount);
        }
        balances.merge(account, amount, Math::addExact);
        log.info("Credited {} to {}", amount, account);
    }

    public long balanceOf(String account) {
        return balances.getOrDefault(account, 0L);
    }
}
