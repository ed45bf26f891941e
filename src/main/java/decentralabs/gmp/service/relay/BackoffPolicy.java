package decentralabs.gmp.service.relay;

import java.time.Duration;

/**
 * Exponential retry delay: {@code initial * 2^(failures - 1)}, capped at {@code max}.
 * There is no attempt limit.
 */
public class BackoffPolicy {

    private static final int MAX_SHIFT = 30;

    private final Duration initial;
    private final Duration max;

    public BackoffPolicy(Duration initial, Duration max) {
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("Initial backoff must be positive");
        }
        this.initial = initial;
        this.max = max.compareTo(initial) < 0 ? initial : max;
    }

    public Duration delayFor(int consecutiveFailures) {
        if (consecutiveFailures <= 1) {
            return initial;
        }
        int shift = Math.min(consecutiveFailures - 1, MAX_SHIFT);
        long millis = initial.toMillis();
        if (millis > (max.toMillis() >> shift)) {
            return max;
        }
        Duration delay = Duration.ofMillis(millis << shift);
        return delay.compareTo(max) > 0 ? max : delay;
    }

    public Duration getInitial() {
        return initial;
    }

    public Duration getMax() {
        return max;
    }
}
