package com.lendledger.clock;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives block height from wall-clock time: one block per {@code blockIntervalSeconds}
 * since the configured genesis instant.
 *
 * <p>The height never goes backwards. If the wall clock is stepped back (NTP correction,
 * VM resume) the last observed height is returned until real time catches up.
 */
public class SystemBlockClock implements LedgerClock {

    private static final Logger log = LoggerFactory.getLogger(SystemBlockClock.class);

    private final Clock clock;
    private final Instant genesis;
    private final long blockIntervalSeconds;
    private final AtomicLong lastHeight = new AtomicLong();

    /**
     * @throws IllegalArgumentException if {@code blockIntervalSeconds} is not positive; raised
     *     at startup from configuration, before any ledger operation runs
     */
    public SystemBlockClock(Clock clock, Instant genesis, long blockIntervalSeconds) {
        if (blockIntervalSeconds <= 0) {
            throw new IllegalArgumentException("blockIntervalSeconds must be positive: " + blockIntervalSeconds);
        }
        this.clock = clock;
        this.genesis = genesis;
        this.blockIntervalSeconds = blockIntervalSeconds;
    }

    @Override
    public long currentHeight() {
        long elapsedSeconds = clock.instant().getEpochSecond() - genesis.getEpochSecond();
        long observed = Math.max(0, elapsedSeconds / blockIntervalSeconds);
        long height = lastHeight.accumulateAndGet(observed, Math::max);
        if (height > observed) {
            log.debug("Wall clock behind last observed height ({} < {}), holding height", observed, height);
        }
        return height;
    }
}
