// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.time;

/**
 * Unchecked alternative for {@link java.util.concurrent.TimeoutException}.
 *
 * @author bjorncs
 */
public class UncheckedTimeoutException extends RuntimeException {

    public UncheckedTimeoutException(String message) { super(message); }

    public UncheckedTimeoutException(String message, Throwable cause) { super(message, cause); }

}
