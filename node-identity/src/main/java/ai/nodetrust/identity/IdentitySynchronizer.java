// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.identity;

import ai.nodetrust.registry.LabelPatch;
import ai.nodetrust.registry.NodeRegistry;
import ai.nodetrust.registry.Nodes;
import io.fabric8.kubernetes.api.model.Node;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes the identity of a node to its {@link ManagedLabels managed labels}.
 *
 * <p>The change is computed against the given node snapshot and sent as a minimal patch on the managed
 * labels only, conditional on the snapshot's resource version. When the labels already match, nothing
 * is sent. This does not retry: a {@link ai.nodetrust.registry.ConflictException} means the caller must
 * read the node again, see {@link NodeIdentityReconciler}.</p>
 */
public class IdentitySynchronizer {

    private static final Logger log = Logger.getLogger(IdentitySynchronizer.class.getName());

    private final NodeRegistry registry;

    public IdentitySynchronizer(NodeRegistry registry) {
        this.registry = registry;
    }

    /**
     * Ensures the managed labels of the node reflect the given identity.
     *
     * @return true if the node was patched, false if it was already up to date
     * @throws ai.nodetrust.registry.NodeNotFoundException if the node no longer exists
     * @throws ai.nodetrust.registry.ConflictException if the node changed after the snapshot was read
     */
    public boolean syncIdentity(Node node, NodeIdentity identity) {
        String name = Nodes.name(node);
        LabelPatch patch = patchFor(Nodes.labels(node), identity);
        if (patch.isEmpty()) {
            log.log(Level.FINE, () -> "Identity labels of node " + name + " are up to date");
            return false;
        }

        registry.patchLabels(name, Nodes.resourceVersion(node), patch);
        log.log(Level.INFO, () -> "Updated identity labels of node " + name + ": " + patch);
        return true;
    }

    /** Returns the changes to the managed labels needed for the given labels to reflect the identity */
    static LabelPatch patchFor(Map<String, String> labels, NodeIdentity identity) {
        LabelPatch.Builder patch = LabelPatch.against(labels);
        patch.set(ManagedLabels.clusterName, identity.clusterName());
        if ( ! identity.platform().isEmpty())
            patch.set(ManagedLabels.platform, identity.platform());
        if (identity.spot())
            patch.set(ManagedLabels.lifecycle, ManagedLabels.spotLifecycle);
        else
            patch.remove(ManagedLabels.lifecycle);
        return patch.build();
    }

}
