package io.cerberus.sdk;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff applied to every call made through {@link CerberusClient}.
 *
 * <p>
 * Retries stop once {@code maxElapsedTime} has passed since the first attempt; there is no attempt counter.
 * The default window only covers a restarting node or a dropped connection.
 * </p>
 *
 * @param initialInterval delay before the second attempt
 * @param multiplier      growth factor applied to the delay after every failed attempt, must be {@code >= 1}
 * @param maxInterval     upper bound of a single delay
 * @param maxElapsedTime  time after which the last failure is surfaced instead of retried
 */
public record RetryPolicy(Duration initialInterval, double multiplier, Duration maxInterval, Duration maxElapsedTime) {

    public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofMillis(100);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofMillis(600);
    public static final Duration DEFAULT_MAX_ELAPSED_TIME = Duration.ofMillis(600);

    public RetryPolicy {
        Objects.requireNonNull(initialInterval, "initialInterval");
        Objects.requireNonNull(maxInterval, "maxInterval");
        Objects.requireNonNull(maxElapsedTime, "maxElapsedTime");
        if (initialInterval.isNegative()) {
            throw new IllegalArgumentException("initialInterval cannot be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (maxInterval.compareTo(initialInterval) < 0) {
            throw new IllegalArgumentException("maxInterval must be >= initialInterval");
        }
        if (maxElapsedTime.isNegative()) {
            throw new IllegalArgumentException("maxElapsedTime cannot be negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_INITIAL_INTERVAL, DEFAULT_MULTIPLIER, DEFAULT_MAX_INTERVAL, DEFAULT_MAX_ELAPSED_TIME);
    }

    /**
     * A policy that sends every request exactly once.
     */
    public static RetryPolicy none() {
        return new RetryPolicy(Duration.ZERO, 1.0, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param attempt 1-based number of the attempt that just failed
     */
    public Duration delayAfter(int attempt) {
        if (attempt < 1) {
            return Duration.ZERO;
        }
        double millis = initialInterval.toMillis() * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(millis, (double) maxInterval.toMillis());
        return Duration.ofMillis(capped);
    }
}
