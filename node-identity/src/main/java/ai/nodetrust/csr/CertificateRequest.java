// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.csr;

import ai.nodetrust.net.IpAddresses;
import ai.nodetrust.security.Pkcs10Csr;
import ai.nodetrust.security.SubjectAlternativeName;

import java.net.InetAddress;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The identity claims of a certificate signing request: its DNS names and IP addresses, in request order.
 */
public class CertificateRequest {

    private final List<String> dnsNames;
    private final List<InetAddress> ipAddresses;

    public CertificateRequest(List<String> dnsNames, List<InetAddress> ipAddresses) {
        this.dnsNames = List.copyOf(dnsNames);
        this.ipAddresses = List.copyOf(ipAddresses);
    }

    /** Returns the claims of the subject alternative names of the given signing request */
    public static CertificateRequest fromCsr(Pkcs10Csr csr) {
        List<SubjectAlternativeName> names = csr.getSubjectAlternativeNames();
        return new CertificateRequest(names.stream()
                                           .filter(name -> name.getType() == SubjectAlternativeName.Type.DNS)
                                           .map(SubjectAlternativeName::getValue)
                                           .toList(),
                                      names.stream()
                                           .filter(name -> name.getType() == SubjectAlternativeName.Type.IP)
                                           .map(SubjectAlternativeName::getIpAddress)
                                           .toList());
    }

    /** Creates a request from a list of DNS names and IP address literals */
    public static CertificateRequest of(List<String> dnsNames, String ... ipAddresses) {
        return new CertificateRequest(dnsNames, Arrays.stream(ipAddresses).map(IpAddresses::parse).toList());
    }

    public List<String> dnsNames() { return dnsNames; }

    public List<InetAddress> ipAddresses() { return ipAddresses; }

    /** Returns the name of the node this request claims to be, which is its first DNS name */
    public Optional<String> nodeName() {
        return dnsNames.stream().findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CertificateRequest that = (CertificateRequest) o;
        return dnsNames.equals(that.dnsNames) && ipAddresses.equals(that.ipAddresses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dnsNames, ipAddresses);
    }

    @Override
    public String toString() {
        return "certificate request for DNS names " + dnsNames + " and IP addresses " +
               ipAddresses.stream().map(IpAddresses::toString).toList();
    }

}
