// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.identity;

import ai.nodetrust.concurrent.Sleeper;
import ai.nodetrust.registry.NodeRegistry;
import ai.nodetrust.registry.NodeRegistryException;
import io.fabric8.kubernetes.api.model.Node;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Brings the identity labels of a node up to date, reading the node again and retrying with backoff
 * when the registry reports a conflict or a transient failure. A missing node fails at once.
 * When the attempts are exhausted the last failure is rethrown, to be retried on the next reconciliation.
 */
public class NodeIdentityReconciler {

    private static final Logger log = Logger.getLogger(NodeIdentityReconciler.class.getName());

    private final NodeRegistry registry;
    private final PlatformMetadataSource metadataSource;
    private final IdentitySynchronizer synchronizer;
    private final String clusterName;
    private final RetryPolicy retryPolicy;
    private final Duration readTimeout;
    private final Sleeper sleeper;

    public NodeIdentityReconciler(NodeRegistry registry, PlatformMetadataSource metadataSource, String clusterName,
                                  RetryPolicy retryPolicy, Duration readTimeout, Sleeper sleeper) {
        this.registry = Objects.requireNonNull(registry);
        this.metadataSource = Objects.requireNonNull(metadataSource);
        this.synchronizer = new IdentitySynchronizer(registry);
        this.clusterName = Objects.requireNonNull(clusterName);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.readTimeout = Objects.requireNonNull(readTimeout);
        this.sleeper = Objects.requireNonNull(sleeper);
    }

    /**
     * Reconciles the identity labels of the named node.
     *
     * @return true if the node was patched, false if it was already up to date
     * @throws ai.nodetrust.registry.NodeNotFoundException if the node does not exist
     * @throws NodeRegistryException the last failure, if all attempts failed
     */
    public boolean reconcile(String nodeName) {
        NodeIdentity identity = NodeIdentity.from(clusterName, metadataSource.metadata(nodeName));
        for (int attempt = 1; ; attempt++) {
            try {
                Node node = registry.get(nodeName, readTimeout);
                return synchronizer.syncIdentity(node, identity);
            } catch (NodeRegistryException e) {
                if ( ! e.isRetryable()) throw e;
                if (attempt >= retryPolicy.maxAttempts()) {
                    log.log(Level.WARNING, "Failed to sync identity of node " + nodeName + " after " + attempt +
                                           " attempts: " + e.getMessage());
                    throw e;
                }
                Duration delay = retryPolicy.delayAfter(attempt);
                int failedAttempt = attempt;
                log.log(Level.FINE, () -> "Attempt " + failedAttempt + " to sync identity of node " + nodeName +
                                          " failed, retrying in " + delay + ": " + e.getMessage());
                sleeper.sleep(delay);
            }
        }
    }

}
