package com.tablesync.realtime;

import com.tablesync.config.RealtimeProperties;
import java.util.Random;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Computes reconnect delays: exponential from the base delay, capped at the max delay, plus
 * uniform jitter so reconnecting clients do not hit the backend in lockstep.
 *
 * <p>With defaults: attempt 0 waits 1s, attempt 1 waits 2s, 2 waits 4s, ... capped at 30s,
 * each plus [0, 1000) ms of jitter.
 */
@Component
public class BackoffCalculator {

    /** Past this exponent the base delay overflows anything sensible; the cap applies anyway. */
    private static final int MAX_EXPONENT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final long maxJitterMs;
    private final Random random;

    @Autowired
    public BackoffCalculator(RealtimeProperties realtimeProperties) {
        this(realtimeProperties, new Random());
    }

    public BackoffCalculator(RealtimeProperties realtimeProperties, Random random) {
        RealtimeProperties.Backoff backoff = realtimeProperties.getBackoff();
        this.baseDelayMs = backoff.getBaseDelay().toMillis();
        this.maxDelayMs = backoff.getMaxDelay().toMillis();
        this.maxJitterMs = backoff.getMaxJitter().toMillis();
        this.random = random;
    }

    /**
     * Delay in milliseconds before reconnect attempt {@code attempt} (0-based).
     * Negative attempts are treated as 0.
     */
    public long delay(int attempt) {
        long jitter = maxJitterMs > 0 ? random.nextLong(maxJitterMs) : 0;
        return baseDelay(attempt) + jitter;
    }

    /** The delay without jitter: {@code min(base * 2^attempt, maxDelay)}. */
    public long baseDelay(int attempt) {
        int exponent = Math.min(Math.max(attempt, 0), MAX_EXPONENT);
        return Math.min(baseDelayMs * (1L << exponent), maxDelayMs);
    }

    /** Exclusive upper bound of {@link #delay(int)}. */
    public long maxPossibleDelay() {
        return maxDelayMs + maxJitterMs;
    }
}
