// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.identity;

import ai.nodetrust.ValidationException;

import java.time.Duration;

/**
 * A bounded number of attempts, with exponentially increasing delay between them, capped at a maximum delay.
 */
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;

    public RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        if (maxAttempts < 1) throw new ValidationException("Max attempts must be positive, but was " + maxAttempts);
        if (initialDelay.isNegative()) throw new ValidationException("Initial delay must be non-negative, but was " + initialDelay);
        if (maxDelay.compareTo(initialDelay) < 0)
            throw new ValidationException("Max delay " + maxDelay + " must be at least the initial delay " + initialDelay);
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
    }

    public int maxAttempts() { return maxAttempts; }

    /** Returns the delay to wait after the given failed attempt, where the first attempt is 1 */
    public Duration delayAfter(int attempt) {
        if (attempt < 1) throw new IllegalArgumentException("Attempt must be positive, but was " + attempt);
        Duration delay = initialDelay;
        for (int i = 1; i < attempt && delay.compareTo(maxDelay) < 0; i++)
            delay = delay.multipliedBy(2);
        return delay.compareTo(maxDelay) < 0 ? delay : maxDelay;
    }

    @Override
    public String toString() {
        return "retry policy of " + maxAttempts + " attempts, backing off from " + initialDelay + " to " + maxDelay;
    }

}
