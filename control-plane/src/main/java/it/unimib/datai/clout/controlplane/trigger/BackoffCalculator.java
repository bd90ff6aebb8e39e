package it.unimib.datai.clout.controlplane.trigger;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter.
 *
 * <pre>
 * delay  = min(base * 2^(attempt-1) + jitter, max)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 */
public class BackoffCalculator {
    private static final int MAX_SHIFT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    public BackoffCalculator(Duration baseDelay, Duration maxDelay, double jitterFactor) {
        this(baseDelay.toMillis(), maxDelay.toMillis(), jitterFactor);
    }

    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                    "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * Delay before the retry that follows failed attempt number {@code attempt} (1-based).
     */
    public Duration calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        int shift = Math.min(attempt - 1, MAX_SHIFT);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);
        long jitter = (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());
        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }
}
