// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.registry;

/**
 * Base class of failures talking to the node registry.
 */
public abstract class NodeRegistryException extends RuntimeException {

    protected NodeRegistryException(String message) { super(message); }

    protected NodeRegistryException(String message, Throwable cause) { super(message, cause); }

    /** Returns whether the same call may succeed if retried, possibly after a fresh read */
    public abstract boolean isRetryable();

}
