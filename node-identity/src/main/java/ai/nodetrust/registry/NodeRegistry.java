// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.registry;

import io.fabric8.kubernetes.api.model.Node;

import java.time.Duration;

/**
 * The cluster registry of node objects.
 * Implementations must be safe for concurrent use; every call works on a point-in-time snapshot.
 */
public interface NodeRegistry {

    /**
     * Returns the current node with the given name.
     *
     * @throws NodeNotFoundException if there is no such node
     * @throws TransientException if the registry failed to answer, or did not answer within the timeout
     */
    Node get(String name, Duration timeout);

    /**
     * Applies the given label changes to the node, provided the node is still at the given resource version.
     *
     * @return the node after the change
     * @throws NodeNotFoundException if there is no such node
     * @throws ConflictException if the node has been modified since the given resource version
     * @throws TransientException if the registry failed to answer
     */
    Node patchLabels(String name, String resourceVersion, LabelPatch patch);

}
