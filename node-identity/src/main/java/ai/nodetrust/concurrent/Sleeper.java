// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.concurrent;

import java.time.Duration;

/**
 * An abstraction used for mocking {@link Thread#sleep(long)} in unit tests.
 *
 * @author bjorncs
 */
public interface Sleeper {

    /** Sleeps for the given duration, restoring the interrupt flag and throwing if interrupted. */
    default void sleep(Duration duration) throws UncheckedInterruptedException {
        try {
            sleepChecked(duration.toMillis());
        } catch (InterruptedException e) {
            throw new UncheckedInterruptedException(e, true);
        }
    }

    void sleepChecked(long millis) throws InterruptedException;

    Sleeper DEFAULT = Thread::sleep;

}
