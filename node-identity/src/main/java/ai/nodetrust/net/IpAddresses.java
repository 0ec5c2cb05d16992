// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.net;

import ai.nodetrust.ValidationException;
import com.google.common.net.InetAddresses;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.List;

/**
 * Parsing, formatting and classification of IP addresses.
 *
 * @author hakonhall
 */
public class IpAddresses {

    private static final List<IpPrefix> privateNetworks = List.of(IpPrefix.fromString("10.0.0.0/8"),
                                                                  IpPrefix.fromString("172.16.0.0/12"),
                                                                  IpPrefix.fromString("192.168.0.0/16"),
                                                                  IpPrefix.fromString("fc00::/7"));

    private IpAddresses() {}

    /**
     * Parses an IP address literal. Host names are never resolved.
     *
     * @throws ValidationException if the input is not an IPv4 or IPv6 literal
     */
    public static InetAddress parse(String address) {
        try {
            return InetAddresses.forString(address.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid IP address '" + address + "'", e);
        }
    }

    /** Returns the lower case string representation of the IP address (w/o scope), with :: compression for IPv6. */
    public static String toString(InetAddress inetAddress) {
        if (inetAddress instanceof Inet6Address) {
            String address = InetAddresses.toAddrString(inetAddress);
            // toAddrString() returns any interface/scope as a %-suffix
            int percentIndex = address.indexOf('%');
            return percentIndex < 0 ? address : address.substring(0, percentIndex);
        } else {
            return inetAddress.getHostAddress();
        }
    }

    public static boolean isIpv6(InetAddress address) {
        return address instanceof Inet6Address;
    }

    /** Returns whether the address is in one of the private networks of RFC 1918 (IPv4) or RFC 4193 (IPv6) */
    public static boolean isPrivate(InetAddress address) {
        return privateNetworks.stream().anyMatch(network -> network.contains(address));
    }

    /** Returns whether the address is usable as a unicast address beyond the local link */
    public static boolean isGlobalUnicast(InetAddress address) {
        return ! address.isAnyLocalAddress()
               && ! address.isLoopbackAddress()
               && ! address.isLinkLocalAddress()
               && ! address.isMulticastAddress()
               && ! address.equals(InetAddresses.forString("255.255.255.255"));
    }

}
