// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.csr;

import ai.nodetrust.ValidationException;
import ai.nodetrust.net.IpAddresses;
import ai.nodetrust.registry.NodeRegistry;
import ai.nodetrust.registry.NodeRegistryException;
import ai.nodetrust.registry.Nodes;
import ai.nodetrust.time.TimeBudget;
import ai.nodetrust.time.UncheckedTimeoutException;
import io.fabric8.kubernetes.api.model.Node;

import java.net.InetAddress;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Decides whether a serving certificate may be issued for the identity claimed by a request,
 * by checking every claimed IP address against the addresses currently recorded for the node.
 *
 * <p>The recorded addresses are the internal and external status addresses of the node, and the
 * node IP(s) it was provided with. A request without IP addresses is approved as long as the node
 * exists. A request with any IP address not recorded for the node is denied. Failing to read the node
 * is neither: it is a {@link NodeLookupException}, which must leave the request pending.</p>
 *
 * <p>This holds no state and may be used concurrently. It sees the node as of the time of the call.</p>
 */
public class CertificateTrustValidator {

    private static final Logger log = Logger.getLogger(CertificateTrustValidator.class.getName());

    private static final Set<String> recordedAddressTypes = Set.of(Nodes.internalIp, Nodes.externalIp);

    private final Duration maxLookupTimeout;

    /**
     * @param maxLookupTimeout the longest time to wait for the node registry, also when the caller's budget has no deadline
     */
    public CertificateTrustValidator(Duration maxLookupTimeout) {
        Objects.requireNonNull(maxLookupTimeout, "maxLookupTimeout must be non-null");
        if (maxLookupTimeout.isNegative() || maxLookupTimeout.isZero())
            throw new ValidationException("Max lookup timeout must be positive, but was " + maxLookupTimeout);
        this.maxLookupTimeout = maxLookupTimeout;
    }

    /**
     * Returns whether the request should be approved.
     *
     * @param budget the time the caller allows for this evaluation
     * @throws NodeLookupException if the node could not be read, including when it does not exist or the budget is spent
     * @throws ValidationException if the request names no node
     */
    public boolean evaluate(TimeBudget budget, NodeRegistry registry, CertificateRequest request) {
        String nodeName = request.nodeName()
                .orElseThrow(() -> new ValidationException("Certificate request has no DNS names: " + request));
        Node node = lookup(budget, registry, nodeName);
        if (request.ipAddresses().isEmpty()) return true;

        Set<InetAddress> recorded = recordedAddresses(node);
        for (InetAddress claimed : request.ipAddresses()) {
            if ( ! recorded.contains(claimed)) {
                log.log(Level.FINE, () -> "Node " + nodeName + " does not hold " + IpAddresses.toString(claimed) +
                                          ", it has " + recorded.stream().map(IpAddresses::toString).toList());
                return false;
            }
        }
        return true;
    }

    /** Returns the outcome of {@link #evaluate}, with failures to evaluate as an error decision */
    public TrustDecision decide(TimeBudget budget, NodeRegistry registry, CertificateRequest request) {
        try {
            if (evaluate(budget, registry, request))
                return TrustDecision.approve("Auto-approved serving certificate for " + request.dnsNames() +
                                             " as all IP addresses are held by node " + request.nodeName().get());
            return TrustDecision.deny("IPAddressMismatch",
                                      "Some IP addresses of the " + request + " are not held by node " + request.nodeName().get());
        } catch (NodeLookupException | ValidationException e) {
            log.log(Level.WARNING, "Could not evaluate " + request + ": " + e.getMessage());
            return TrustDecision.error(e);
        }
    }

    private Node lookup(TimeBudget budget, NodeRegistry registry, String nodeName) {
        try {
            Duration timeout = budget.timeLeftOrThrow()
                                     .filter(left -> left.compareTo(maxLookupTimeout) < 0)
                                     .orElse(maxLookupTimeout);
            return registry.get(nodeName, timeout);
        } catch (NodeRegistryException | UncheckedTimeoutException e) {
            throw new NodeLookupException(nodeName, e);
        }
    }

    /** Returns the addresses recorded for the node, in canonical form */
    static Set<InetAddress> recordedAddresses(Node node) {
        Set<InetAddress> addresses = new LinkedHashSet<>();
        Stream.of(Nodes.providedIps(node), Nodes.statusAddresses(node, recordedAddressTypes))
              .flatMap(List::stream)
              .forEach(address -> {
                  try {
                      addresses.add(IpAddresses.parse(address));
                  } catch (ValidationException e) {
                      log.log(Level.FINE, () -> "Ignoring invalid address recorded for node " + Nodes.name(node) + ": " + e.getMessage());
                  }
              });
        return addresses;
    }

}
