// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.address;

import ai.nodetrust.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static ai.nodetrust.address.ClassifiedAddress.external;
import static ai.nodetrust.address.ClassifiedAddress.internal;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AddressClassifierTest {

    private static final List<ObservedAddress> nocloudWithPublicAddresses = List.of(
            ObservedAddress.of("192.168.0.1/24"),
            ObservedAddress.of("fe80::e0b5:71ff:fe24:7e60/64"),
            ObservedAddress.of("fd15:1:2::192:168:0:1/64"),
            ObservedAddress.of("1.2.3.4/24"),
            ObservedAddress.of("4.3.2.1/24"),
            ObservedAddress.of("2001:1234::1/64"),
            ObservedAddress.of("2001:1234:4321::32/64"));

    @Test
    void nocloud_without_public_addresses_has_internal_address_only() {
        List<ObservedAddress> observed = List.of(
                ObservedAddress.of("192.168.0.1/24"),
                ObservedAddress.of("fe80::e0b5:71ff:fe24:7e60/64"),
                ObservedAddress.of("fd15:1:2::192:168:0:1/64"),
                ObservedAddress.of("fd43:fe8a:be2:ab02:dc3c:38ff:fe51:5022/64", "kubespan"));
        assertEquals(List.of(internal("192.168.0.1")),
                     AddressClassifier.classify(PlatformPolicy.of("nocloud", false, "192.168.0.1"), observed));
    }

    @Test
    void nocloud_with_many_public_addresses_selects_one_per_family() {
        assertEquals(List.of(internal("192.168.0.1"), external("1.2.3.4"), external("2001:1234:4321::32")),
                     AddressClassifier.classify(PlatformPolicy.of("nocloud", false, "192.168.0.1"), nocloudWithPublicAddresses));
    }

    @Test
    void ipv6_first_when_preferred() {
        assertEquals(List.of(internal("192.168.0.1"), external("2001:1234:4321::32"), external("1.2.3.4")),
                     AddressClassifier.classify(PlatformPolicy.of("nocloud", true, "192.168.0.1"), nocloudWithPublicAddresses));
    }

    @Test
    void metal_promotes_public_addresses() {
        List<ObservedAddress> observed = List.of(
                ObservedAddress.of("192.168.0.1/24"),
                ObservedAddress.of("fe80::e0b5:71ff:fe24:7e60/64"),
                ObservedAddress.of("fd15:1:2::192:168:0:1/64"),
                ObservedAddress.of("1.2.3.4/24"),
                ObservedAddress.of("2001:1234::1/128"));
        assertEquals(List.of(internal("192.168.0.1"), external("1.2.3.4"), external("2001:1234::1")),
                     AddressClassifier.classify(PlatformPolicy.of("metal", false, "192.168.0.1"), observed));
    }

    @Test
    void managed_cloud_promotes_only_addresses_on_external_link() {
        List<ObservedAddress> observed = List.of(
                ObservedAddress.of("192.168.0.1/24"),
                ObservedAddress.of("fe80::e0b5:71ff:fe24:7e60/64"),
                ObservedAddress.of("1.2.3.4/24", "external"),
                ObservedAddress.of("4.3.2.1/24"),
                ObservedAddress.of("2001:1234::1/128", "external"),
                ObservedAddress.of("2001:1234::123/64"));
        assertEquals(List.of(internal("192.168.0.1"), external("1.2.3.4"), external("2001:1234::1")),
                     AddressClassifier.classify(PlatformPolicy.of("gcp", false, "192.168.0.1"), observed));
    }

    @Test
    void local_scope_addresses_are_never_external() {
        List<ObservedAddress> observed = List.of(
                ObservedAddress.of("127.0.0.1/8", "external"),
                ObservedAddress.of("::1/128", "external"),
                ObservedAddress.of("169.254.0.5/16", "external"),
                ObservedAddress.of("fe80::1/64", "external"),
                ObservedAddress.of("224.0.0.1/32", "external"));
        for (String platform : List.of("metal", "nocloud", "aws"))
            assertEquals(List.of(), AddressClassifier.classify(PlatformPolicy.of(platform, false, null), observed), platform);
    }

    @Test
    void overlay_link_addresses_are_never_external() {
        List<ObservedAddress> observed = List.of(ObservedAddress.of("5.6.7.8/32", "kubespan"),
                                                 ObservedAddress.of("2001:db8::5/128", "kubespan"));
        assertEquals(List.of(), AddressClassifier.classify(PlatformPolicy.of("metal", false, null), observed));
    }

    @Test
    void provided_ip_is_internal_and_never_external() {
        List<ObservedAddress> observed = List.of(ObservedAddress.of("1.2.3.4/24"), ObservedAddress.of("5.6.7.8/24"));
        assertEquals(List.of(internal("1.2.3.4"), external("5.6.7.8")),
                     AddressClassifier.classify(PlatformPolicy.of("metal", false, "1.2.3.4"), observed));
    }

    @Test
    void provided_ip_is_canonical() {
        assertEquals(List.of(internal("2001:db8::1")),
                     AddressClassifier.classify(PlatformPolicy.of("metal", false, "2001:DB8:0::1"), List.of()));
    }

    @Test
    void no_input_gives_no_addresses() {
        assertEquals(List.of(), AddressClassifier.classify(PlatformPolicy.of("metal", false, null), List.of()));
        assertEquals(List.of(), AddressClassifier.classify(PlatformPolicy.of("metal", false, " "), List.of()));
    }

    @Test
    void invalid_provided_ip_is_rejected() {
        assertThrows(ValidationException.class,
                     () -> AddressClassifier.classify(PlatformPolicy.of("metal", false, "node1"), nocloudWithPublicAddresses));
    }

    @Test
    void at_most_one_internal_and_one_external_per_family() {
        List<ClassifiedAddress> addresses = AddressClassifier.classify(PlatformPolicy.of("nocloud", false, "192.168.0.1"),
                                                                       nocloudWithPublicAddresses);
        assertEquals(1, addresses.stream().filter(address -> address.category() == ClassifiedAddress.Category.INTERNAL).count());
        assertEquals(1, addresses.stream().filter(address -> address.category() == ClassifiedAddress.Category.EXTERNAL
                                                             && address.address().contains(":")).count());
        assertEquals(1, addresses.stream().filter(address -> address.category() == ClassifiedAddress.Category.EXTERNAL
                                                             && ! address.address().contains(":")).count());
    }

    @Test
    void result_is_independent_of_interleaving_of_families() {
        PlatformPolicy policy = PlatformPolicy.of("nocloud", false, "192.168.0.1");
        List<ClassifiedAddress> expected = AddressClassifier.classify(policy, nocloudWithPublicAddresses);

        List<ObservedAddress> ipv6First = new ArrayList<>();
        nocloudWithPublicAddresses.stream().filter(address -> address.address().isIpv6()).forEach(ipv6First::add);
        nocloudWithPublicAddresses.stream().filter(address -> ! address.address().isIpv6()).forEach(ipv6First::add);
        assertEquals(expected, AddressClassifier.classify(policy, ipv6First));
        assertEquals(expected, AddressClassifier.classify(policy, nocloudWithPublicAddresses), "deterministic");
    }

    @Test
    void result_is_independent_of_order_within_a_family() {
        PlatformPolicy policy = PlatformPolicy.of("nocloud", false, "192.168.0.1");
        List<ObservedAddress> reordered = List.of(
                ObservedAddress.of("2001:1234:4321::32/64"),
                ObservedAddress.of("4.3.2.1/24"),
                ObservedAddress.of("fd15:1:2::192:168:0:1/64"),
                ObservedAddress.of("2001:1234::1/64"),
                ObservedAddress.of("192.168.0.1/24"),
                ObservedAddress.of("1.2.3.4/24"),
                ObservedAddress.of("fe80::e0b5:71ff:fe24:7e60/64"));
        List<ClassifiedAddress> expected = List.of(internal("192.168.0.1"), external("1.2.3.4"), external("2001:1234:4321::32"));
        assertEquals(expected, AddressClassifier.classify(policy, nocloudWithPublicAddresses));
        assertEquals(expected, AddressClassifier.classify(policy, reordered));

        List<ObservedAddress> reversed = new ArrayList<>(nocloudWithPublicAddresses);
        Collections.reverse(reversed);
        assertEquals(expected, AddressClassifier.classify(policy, reversed));
    }

    @Test
    void lowest_address_is_selected_in_canonical_form() {
        List<ObservedAddress> observed = List.of(ObservedAddress.of("2001:DB8:0:0:0:0:0:9/64"),
                                                 ObservedAddress.of("2001:db8::10/64"),
                                                 ObservedAddress.of("8.8.8.8/32"),
                                                 ObservedAddress.of("11.0.0.1/32"));
        assertEquals(List.of(external("11.0.0.1"), external("2001:db8::10")),
                     AddressClassifier.classify(PlatformPolicy.of("metal", false, null), observed));
    }

    @Test
    void result_is_immutable() {
        List<ClassifiedAddress> addresses = AddressClassifier.classify(PlatformPolicy.of("metal", false, "10.0.0.1"), List.of());
        assertThrows(UnsupportedOperationException.class, () -> addresses.add(external("1.2.3.4")));
        assertTrue(addresses.contains(internal("10.0.0.1")));
    }

}
