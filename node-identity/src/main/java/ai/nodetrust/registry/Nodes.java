// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.registry;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeAddress;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Null-safe accessors for the parts of a node object used here.
 */
public class Nodes {

    /** Annotation holding the node IP(s) given to the kubelet, comma separated when dual stack */
    public static final String providedIpAnnotation = "alpha.kubernetes.io/provided-node-ip";

    public static final String internalIp = "InternalIP";
    public static final String externalIp = "ExternalIP";
    public static final String hostname = "Hostname";

    private Nodes() {}

    public static String name(Node node) {
        return node.getMetadata() == null ? null : node.getMetadata().getName();
    }

    public static String resourceVersion(Node node) {
        return node.getMetadata() == null ? null : node.getMetadata().getResourceVersion();
    }

    public static Map<String, String> labels(Node node) {
        if (node.getMetadata() == null || node.getMetadata().getLabels() == null) return Map.of();
        return node.getMetadata().getLabels();
    }

    /** Returns the provided node IPs from the node annotation, in order */
    public static List<String> providedIps(Node node) {
        return Optional.ofNullable(node.getMetadata())
                .map(metadata -> metadata.getAnnotations())
                .map(annotations -> annotations.get(providedIpAnnotation))
                .map(value -> Arrays.stream(value.split(","))
                        .map(String::trim)
                        .filter(ip -> ! ip.isEmpty())
                        .toList())
                .orElse(List.of());
    }

    /** Returns the status addresses of the given types, in order */
    public static List<String> statusAddresses(Node node, Set<String> types) {
        if (node.getStatus() == null || node.getStatus().getAddresses() == null) return List.of();
        return node.getStatus().getAddresses().stream()
                .filter(address -> types.contains(address.getType()))
                .map(NodeAddress::getAddress)
                .toList();
    }

}
