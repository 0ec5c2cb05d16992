// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.csr;

/**
 * The node named by a certificate request could not be read. This is a failure to evaluate the request,
 * not a negative decision: the cause tells whether the node is missing or the registry failed.
 */
public class NodeLookupException extends RuntimeException {

    private final String nodeName;

    public NodeLookupException(String nodeName, Throwable cause) {
        super("failed to get node " + nodeName + ": " + cause.getMessage(), cause);
        this.nodeName = nodeName;
    }

    public String nodeName() { return nodeName; }

}
