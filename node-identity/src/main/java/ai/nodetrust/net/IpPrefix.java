// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.net;

import ai.nodetrust.ValidationException;

import java.math.BigInteger;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.Objects;

/**
 * An IPv4 or IPv6 address together with the length of its network prefix, e.g. 192.168.0.1/24.
 * Unlike a CIDR block the host bits are kept: this is an interface address, not a network.
 *
 * @author valerijf
 */
public class IpPrefix {

    private final InetAddress address;
    private final int prefixLength;

    /** Creates a prefix that only contains the given address (/32 if IPv4, /128 if IPv6) */
    public IpPrefix(InetAddress address) {
        this(address, 8 * address.getAddress().length);
    }

    public IpPrefix(InetAddress address, int prefixLength) {
        this.address = Objects.requireNonNull(address);
        int addressLength = 8 * address.getAddress().length;
        if (prefixLength < 0)
            throw new ValidationException("Prefix size cannot be negative, but was " + prefixLength);
        if (prefixLength > addressLength)
            throw new ValidationException(String.format("Prefix size (%s) cannot be longer than address length (%s)",
                                                        prefixLength, addressLength));
        this.prefixLength = prefixLength;
    }

    /** Returns the address, with host bits intact */
    public InetAddress address() { return address; }

    /** Returns the number of bits in the network mask */
    public int prefixLength() { return prefixLength; }

    public boolean isIpv6() { return address instanceof Inet6Address; }

    /** Returns true iff the given address is in the network of this prefix */
    public boolean contains(InetAddress other) {
        byte[] otherBytes = other.getAddress();
        byte[] ownBytes = address.getAddress();
        if (otherBytes.length != ownBytes.length) return false;
        int suffixLength = 8 * ownBytes.length - prefixLength;
        return toBigInteger(ownBytes).shiftRight(suffixLength).equals(toBigInteger(otherBytes).shiftRight(suffixLength));
    }

    /**
     * Parses an address with prefix, e.g. "2001:db8::1/64". A bare address is taken as a
     * single address prefix.
     *
     * @throws ValidationException if the input is not a valid address or prefix
     */
    public static IpPrefix fromString(String prefix) {
        String[] parts = prefix.split("/", -1);
        if (parts.length > 2)
            throw new ValidationException("Invalid IP prefix, expected format to be " +
                                          "'<ip address>/<prefix size>', but was '" + prefix + "'");
        InetAddress inetAddress = IpAddresses.parse(parts[0]);
        if (parts.length == 1) return new IpPrefix(inetAddress);
        try {
            return new IpPrefix(inetAddress, Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid prefix size in '" + prefix + "'", e);
        }
    }

    private static BigInteger toBigInteger(byte[] address) {
        return new BigInteger(1, address);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IpPrefix ipPrefix = (IpPrefix) o;
        return prefixLength == ipPrefix.prefixLength && address.equals(ipPrefix.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, prefixLength);
    }

    @Override
    public String toString() {
        return IpAddresses.toString(address) + "/" + prefixLength;
    }

}
