// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.address;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The settings steering address classification for a node.
 *
 * @param platform the platform the node runs on, e.g. "metal", "nocloud", "gcp" or "aws"
 * @param preferIpv6 whether the IPv6 external address is listed before the IPv4 one
 * @param providedIp the node IP handed to the kubelet, if any
 */
public record PlatformPolicy(String platform, boolean preferIpv6, Optional<String> providedIp) {

    /** Platforms without a managed cloud network, where public addresses are only known from the interfaces */
    private static final Set<String> bareMetalPlatforms = Set.of("metal", "nocloud");

    public PlatformPolicy {
        Objects.requireNonNull(platform, "platform must be non-null");
        Objects.requireNonNull(providedIp, "providedIp must be non-null");
        providedIp = providedIp.map(String::trim).filter(ip -> ! ip.isEmpty());
    }

    public static PlatformPolicy of(String platform, boolean preferIpv6, String providedIp) {
        return new PlatformPolicy(platform, preferIpv6, Optional.ofNullable(providedIp));
    }

    /**
     * Returns whether any public address of the node counts as external. When false, only
     * addresses the platform attaches to its external-facing link count as external.
     */
    public boolean promotesPublicAddresses() {
        return bareMetalPlatforms.contains(platform);
    }

}
