// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.security;

import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.io.pem.PemObject;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * @author bjorncs
 */
public class Pkcs10CsrUtils {

    private Pkcs10CsrUtils() {}

    /**
     * Parses a PEM encoded certificate signing request.
     *
     * @throws IllegalArgumentException if the input does not contain a certificate signing request
     */
    public static Pkcs10Csr fromPem(String pem) {
        try (PEMParser pemParser = new PEMParser(new StringReader(pem))) {
            Object pemObject = pemParser.readObject();
            if ( ! (pemObject instanceof PKCS10CertificationRequest))
                throw new IllegalArgumentException("Expected a certificate signing request, but found " + pemObject);
            return new Pkcs10Csr((PKCS10CertificationRequest) pemObject);
        } catch (IOException | DecoderException e) {
            throw new IllegalArgumentException("Invalid PEM encoded certificate signing request", e);
        }
    }

    public static String toPem(Pkcs10Csr csr) {
        try (StringWriter stringWriter = new StringWriter(); JcaPEMWriter pemWriter = new JcaPEMWriter(stringWriter)) {
            pemWriter.writeObject(new PemObject("CERTIFICATE REQUEST", csr.getBcCsr().getEncoded()));
            pemWriter.flush();
            return stringWriter.toString();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
