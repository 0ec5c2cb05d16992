// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.registry;

/**
 * The referenced node does not exist. Never retryable, and never to be confused with an identity mismatch.
 */
public class NodeNotFoundException extends NodeRegistryException {

    private final String nodeName;

    public NodeNotFoundException(String nodeName) {
        super("nodes \"" + nodeName + "\" not found");
        this.nodeName = nodeName;
    }

    public NodeNotFoundException(String nodeName, Throwable cause) {
        super("nodes \"" + nodeName + "\" not found", cause);
        this.nodeName = nodeName;
    }

    public String nodeName() { return nodeName; }

    @Override
    public boolean isRetryable() { return false; }

}
