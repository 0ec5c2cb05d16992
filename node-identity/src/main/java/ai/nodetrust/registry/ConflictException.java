// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.registry;

/**
 * The node was modified concurrently: the resource version a write was based on is no longer current.
 * The caller should read the node again and retry.
 */
public class ConflictException extends NodeRegistryException {

    public ConflictException(String message) { super(message); }

    public ConflictException(String message, Throwable cause) { super(message, cause); }

    @Override
    public boolean isRetryable() { return true; }

}
