// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.address;

import ai.nodetrust.identity.PlatformMetadata;
import ai.nodetrust.registry.Nodes;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeAddress;
import io.fabric8.kubernetes.api.model.NodeAddressBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves the status addresses of a node from its discovered addresses and platform metadata.
 */
public class NodeAddressResolver {

    private static final Logger log = Logger.getLogger(NodeAddressResolver.class.getName());

    private final AddressDiscovery discovery;
    private final boolean preferIpv6;

    public NodeAddressResolver(AddressDiscovery discovery, boolean preferIpv6) {
        this.discovery = Objects.requireNonNull(discovery);
        this.preferIpv6 = preferIpv6;
    }

    /**
     * Returns the addresses to record in the status of the given node: the classified internal and
     * external addresses, followed by the host name, if known.
     *
     * @throws ai.nodetrust.ValidationException if the provided IP of the node is invalid
     */
    public List<NodeAddress> resolve(Node node, PlatformMetadata metadata) {
        String name = Nodes.name(node);
        // The first provided IP is the primary one when dual stack
        String providedIp = Nodes.providedIps(node).stream().findFirst().orElse(null);
        PlatformPolicy policy = PlatformPolicy.of(metadata.platform(), preferIpv6, providedIp);

        List<NodeAddress> addresses = new ArrayList<>();
        for (ClassifiedAddress address : AddressClassifier.classify(policy, discovery.addresses(name)))
            addresses.add(nodeAddress(address.category().nodeAddressType(), address.address()));
        if ( ! metadata.hostname().isEmpty())
            addresses.add(nodeAddress(Nodes.hostname, metadata.hostname()));

        log.log(Level.FINE, () -> "Resolved addresses of node " + name + " on " + policy + ": " + addresses);
        return addresses;
    }

    private static NodeAddress nodeAddress(String type, String address) {
        return new NodeAddressBuilder().withType(type).withAddress(address).build();
    }

}
