// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.registry;

/**
 * The registry could not be reached or did not answer in time.
 */
public class TransientException extends NodeRegistryException {

    public TransientException(String message) { super(message); }

    public TransientException(String message, Throwable cause) { super(message, cause); }

    @Override
    public boolean isRetryable() { return true; }

}
