// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.concurrent;

/**
 * Wraps an {@link InterruptedException} with an unchecked exception.
 *
 * @author bjorncs
 */
public class UncheckedInterruptedException extends RuntimeException {

    public UncheckedInterruptedException(String message, InterruptedException cause, boolean restoreInterruptFlag) {
        super(message, cause);
        if (restoreInterruptFlag) Thread.currentThread().interrupt();
    }

    public UncheckedInterruptedException(InterruptedException cause, boolean restoreInterruptFlag) {
        this(cause.toString(), cause, restoreInterruptFlag);
    }

    @Override public InterruptedException getCause() { return (InterruptedException) super.getCause(); }
}
