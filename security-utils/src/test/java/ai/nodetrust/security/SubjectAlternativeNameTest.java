// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.security;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.UnknownHostException;

import static ai.nodetrust.security.SubjectAlternativeName.Type.DNS;
import static ai.nodetrust.security.SubjectAlternativeName.Type.IP;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SubjectAlternativeNameTest {

    @Test
    void ip_names_resolve_to_canonical_address() throws UnknownHostException {
        assertEquals(InetAddress.getByName("2000::1"), new SubjectAlternativeName(IP, "2000:0:0:0:0:0:0:1").getIpAddress());
        assertEquals(InetAddress.getByName("1.2.3.4"), new SubjectAlternativeName(IP, "1.2.3.4").getIpAddress());
    }

    @Test
    void dns_names_have_no_ip_address() {
        assertThrows(IllegalStateException.class, () -> new SubjectAlternativeName(DNS, "node1").getIpAddress());
    }

    @Test
    void tag_lookup() {
        assertEquals(IP, SubjectAlternativeName.Type.fromTag(7));
        assertThrows(IllegalArgumentException.class, () -> SubjectAlternativeName.Type.fromTag(42));
    }

}
