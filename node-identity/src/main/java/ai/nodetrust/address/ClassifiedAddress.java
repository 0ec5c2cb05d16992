// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.address;

import java.util.Objects;

/**
 * A node address with its category. The address is a bare IP in canonical form.
 */
public record ClassifiedAddress(Category category, String address) {

    public ClassifiedAddress {
        Objects.requireNonNull(category, "category must be non-null");
        Objects.requireNonNull(address, "address must be non-null");
    }

    public static ClassifiedAddress internal(String address) { return new ClassifiedAddress(Category.INTERNAL, address); }

    public static ClassifiedAddress external(String address) { return new ClassifiedAddress(Category.EXTERNAL, address); }

    public enum Category {

        /** Routable inside the cluster */
        INTERNAL("InternalIP"),

        /** Reachable from outside the cluster */
        EXTERNAL("ExternalIP");

        private final String nodeAddressType;

        Category(String nodeAddressType) {
            this.nodeAddressType = nodeAddressType;
        }

        /** Returns the node status address type of this category */
        public String nodeAddressType() { return nodeAddressType; }

    }

}
