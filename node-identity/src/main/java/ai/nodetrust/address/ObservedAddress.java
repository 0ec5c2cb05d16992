// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.address;

import ai.nodetrust.net.IpPrefix;

import java.net.InetAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * An address reported by the address discovery backend of a node: an IP with prefix length,
 * and the name of the link it was seen on, if known.
 */
public record ObservedAddress(IpPrefix address, Optional<String> link) {

    public ObservedAddress {
        Objects.requireNonNull(address, "address must be non-null");
        Objects.requireNonNull(link, "link must be non-null");
        link = link.filter(name -> ! name.isBlank());
    }

    /** Returns the IP of this, without prefix */
    public InetAddress ip() { return address.address(); }

    /** Returns whether this was observed on the named link */
    public boolean isOnLink(String name) {
        return link.map(name::equals).orElse(false);
    }

    public static ObservedAddress of(String prefix) {
        return new ObservedAddress(IpPrefix.fromString(prefix), Optional.empty());
    }

    public static ObservedAddress of(String prefix, String link) {
        return new ObservedAddress(IpPrefix.fromString(prefix), Optional.ofNullable(link));
    }

}
