// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.identity;

import java.util.Objects;

/**
 * What the platform metadata backend knows about a node.
 *
 * @param platform the platform name, e.g. "metal" or "aws", or empty if unknown
 * @param hostname the host name of the node, or empty if unknown
 * @param spot whether the node is a spot (preemptible) instance
 */
public record PlatformMetadata(String platform, String hostname, boolean spot) {

    public PlatformMetadata {
        platform = Objects.requireNonNullElse(platform, "");
        hostname = Objects.requireNonNullElse(hostname, "");
    }

    public static PlatformMetadata empty() { return new PlatformMetadata("", "", false); }

}
