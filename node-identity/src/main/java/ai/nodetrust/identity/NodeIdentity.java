// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.identity;

import ai.nodetrust.ValidationException;

import java.util.Objects;

/**
 * The identity of a node as derived from the cluster configuration and platform metadata.
 */
public record NodeIdentity(String clusterName, String platform, String hostname, boolean spot) {

    public NodeIdentity {
        Objects.requireNonNull(clusterName, "clusterName must be non-null");
        if (clusterName.isBlank()) throw new ValidationException("Cluster name must be non-empty");
        platform = Objects.requireNonNullElse(platform, "");
        hostname = Objects.requireNonNullElse(hostname, "");
    }

    public static NodeIdentity from(String clusterName, PlatformMetadata metadata) {
        return new NodeIdentity(clusterName, metadata.platform(), metadata.hostname(), metadata.spot());
    }

}
