// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.security;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.pkcs.Attribute;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.bouncycastle.asn1.x509.Extensions;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentVerifierProviderBuilder;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.PKCSException;
import org.bouncycastle.pkcs.jcajce.JcaPKCS10CertificationRequest;

import javax.security.auth.x500.X500Principal;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static java.util.Collections.emptyList;

/**
 * A PKCS#10 certificate signing request.
 *
 * @author bjorncs
 */
public class Pkcs10Csr {

    private final PKCS10CertificationRequest csr;

    Pkcs10Csr(PKCS10CertificationRequest csr) {
        this.csr = csr;
    }

    PKCS10CertificationRequest getBcCsr() {
        return csr;
    }

    public X500Principal getSubject() {
        try {
            return new X500Principal(csr.getSubject().getEncoded());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Returns the values of all common name (CN) attributes of the subject, in order */
    public List<String> getSubjectCommonNames() {
        return getSubjectRdnValues(BCStyle.CN);
    }

    /** Returns the values of all organization (O) attributes of the subject, in order */
    public List<String> getSubjectOrganizations() {
        return getSubjectRdnValues(BCStyle.O);
    }

    private List<String> getSubjectRdnValues(ASN1ObjectIdentifier attributeType) {
        X500Name subject = csr.getSubject();
        return Arrays.stream(subject.getRDNs(attributeType))
                .map(RDN::getFirst)
                .map(typeAndValue -> IETFUtils.valueToString(typeAndValue.getValue()))
                .toList();
    }

    /**
     * @return If basic constraints extension is present: returns true if CA cert, false otherwise. Returns empty if the extension is not present.
     */
    public Optional<Boolean> getBasicConstraints() {
        return getExtensions()
                .map(org.bouncycastle.asn1.x509.BasicConstraints::fromExtensions)
                .map(org.bouncycastle.asn1.x509.BasicConstraints::isCA);
    }

    /** Returns the subject alternative names in the order they appear in the request */
    public List<SubjectAlternativeName> getSubjectAlternativeNames() {
        return getExtensions()
                .map(extensions -> GeneralNames.fromExtensions(extensions, Extension.SUBJECT_ALTERNATIVE_NAMES.extensionOId))
                .map(SubjectAlternativeName::fromGeneralNames)
                .orElse(emptyList());
    }

    /** Returns whether the request is signed by the private key matching its own public key */
    public boolean isSignatureValid() {
        try {
            var verifierProvider = new JcaContentVerifierProviderBuilder()
                    .setProvider(BouncyCastleProviderHolder.getInstance())
                    .build(new JcaPKCS10CertificationRequest(csr).getPublicKey());
            return csr.isSignatureValid(verifierProvider);
        } catch (OperatorCreationException | GeneralSecurityException | PKCSException e) {
            throw new IllegalArgumentException("Unable to verify signature of certificate signing request", e);
        }
    }

    private Optional<Extensions> getExtensions() {
        Attribute[] attributes = csr.getAttributes(PKCSObjectIdentifiers.pkcs_9_at_extensionRequest);
        if (attributes.length == 0) return Optional.empty();
        ASN1Encodable[] values = attributes[0].getAttrValues().toArray();
        if (values.length == 0) return Optional.empty();
        return Optional.of(Extensions.getInstance(values[0]));
    }

}
