// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.address;

import ai.nodetrust.net.IpAddresses;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies the observed addresses of a node into at most one internal address and at most one
 * external address per IP family.
 *
 * <p>The provided IP, when given, is the single internal address. External candidates are the observed
 * addresses which are neither the provided IP, loopback, link-local, multicast nor seen on an overlay link.
 * On bare-metal platforms any remaining public (global unicast, non-private) address is a candidate,
 * on managed cloud platforms only those the platform put on the {@value #externalLink} link.
 * Of the candidates of each IP family, the one lowest in canonical textual order is selected, which makes the
 * result independent of input order. The selected addresses are ordered by IP family preference.</p>
 *
 * <p>This is a pure function of its input and safe for concurrent use.</p>
 */
public class AddressClassifier {

    /** Links carrying overlay or mesh traffic, which never identify a node externally */
    static final Set<String> overlayLinks = Set.of("kubespan");

    /** The link on which managed cloud platforms put the public addresses of a node */
    static final String externalLink = "external";

    private AddressClassifier() {}

    /**
     * Returns the classified addresses of a node: the internal address first, if any, followed by the external ones.
     *
     * @throws ai.nodetrust.ValidationException if the provided IP of the policy is not a valid IP address
     */
    public static List<ClassifiedAddress> classify(PlatformPolicy policy, List<ObservedAddress> observed) {
        Optional<InetAddress> providedIp = policy.providedIp().map(IpAddresses::parse);

        List<ClassifiedAddress> addresses = new ArrayList<>(3);
        providedIp.ifPresent(ip -> addresses.add(ClassifiedAddress.internal(IpAddresses.toString(ip))));

        String ipv4 = null;
        String ipv6 = null;
        for (ObservedAddress candidate : observed) {
            if ( ! isExternalCandidate(candidate, policy, providedIp)) continue;

            String address = IpAddresses.toString(candidate.ip());
            if (IpAddresses.isIpv6(candidate.ip()))
                ipv6 = lowest(ipv6, address);
            else
                ipv4 = lowest(ipv4, address);
        }

        for (String external : policy.preferIpv6() ? new String[] { ipv6, ipv4 } : new String[] { ipv4, ipv6 }) {
            if (external != null)
                addresses.add(ClassifiedAddress.external(external));
        }
        return List.copyOf(addresses);
    }

    private static String lowest(String current, String candidate) {
        return current == null || candidate.compareTo(current) < 0 ? candidate : current;
    }

    private static boolean isExternalCandidate(ObservedAddress candidate, PlatformPolicy policy, Optional<InetAddress> providedIp) {
        InetAddress ip = candidate.ip();
        if (providedIp.map(ip::equals).orElse(false)) return false;
        if ( ! IpAddresses.isGlobalUnicast(ip)) return false;
        if (candidate.link().map(overlayLinks::contains).orElse(false)) return false;

        if (policy.promotesPublicAddresses())
            return ! IpAddresses.isPrivate(ip);
        return candidate.isOnLink(externalLink);
    }

}
