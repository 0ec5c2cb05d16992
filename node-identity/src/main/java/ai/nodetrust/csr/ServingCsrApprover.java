// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.csr;

import ai.nodetrust.registry.NodeRegistry;
import ai.nodetrust.security.Pkcs10Csr;
import ai.nodetrust.security.Pkcs10CsrUtils;
import ai.nodetrust.time.TimeBudget;
import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequest;
import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequestSpec;
import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequestStatus;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reviews kubelet serving certificate signing requests.
 *
 * <p>A request must come from a node ({@value #nodeUserPrefix}&lt;name&gt; in group {@value #nodesGroup}),
 * ask for server auth usage only, carry a validly signed non-CA PKCS#10 request for that same node as subject,
 * and name the node as its first DNS name. The IP addresses it claims are then checked by the
 * {@link CertificateTrustValidator}.</p>
 */
public class ServingCsrApprover {

    private static final Logger log = Logger.getLogger(ServingCsrApprover.class.getName());

    public static final String kubeletServingSigner = "kubernetes.io/kubelet-serving";

    static final String nodeUserPrefix = "system:node:";
    static final String nodesGroup = "system:nodes";
    static final String serverAuthUsage = "server auth";
    static final Set<String> allowedUsages = Set.of("digital signature", "key encipherment", serverAuthUsage);
    static final Set<String> decidedConditions = Set.of("Approved", "Denied", "Failed");

    private final CertificateTrustValidator validator;
    private final NodeRegistry registry;

    public ServingCsrApprover(CertificateTrustValidator validator, NodeRegistry registry) {
        this.validator = Objects.requireNonNull(validator);
        this.registry = Objects.requireNonNull(registry);
    }

    /**
     * Returns the decision for the given request, or empty if it is not a kubelet serving request,
     * or it has already been approved, denied or failed.
     */
    public Optional<TrustDecision> review(CertificateSigningRequest csr, TimeBudget budget) {
        CertificateSigningRequestSpec spec = csr.getSpec();
        if (spec == null || ! kubeletServingSigner.equals(spec.getSignerName())) return Optional.empty();
        if (isDecided(csr.getStatus())) return Optional.empty();

        String name = csr.getMetadata() == null ? "(unnamed)" : csr.getMetadata().getName();
        TrustDecision decision = decide(spec, budget);
        log.log(Level.INFO, () -> "Certificate signing request " + name + " from " + spec.getUsername() + ": " + decision);
        return Optional.of(decision);
    }

    private TrustDecision decide(CertificateSigningRequestSpec spec, TimeBudget budget) {
        String username = spec.getUsername();
        List<String> groups = spec.getGroups() == null ? List.of() : spec.getGroups();
        if (username == null || ! username.startsWith(nodeUserPrefix) || ! groups.contains(nodesGroup))
            return TrustDecision.deny("InvalidRequestor", "Requestor " + username + " in groups " + groups + " is not a node");
        String nodeName = username.substring(nodeUserPrefix.length());

        List<String> usages = spec.getUsages() == null ? List.of() : spec.getUsages();
        if ( ! usages.contains(serverAuthUsage) || ! allowedUsages.containsAll(usages))
            return TrustDecision.deny("InvalidUsages", "Usages " + usages + " are not a subset of " + allowedUsages +
                                                       " including '" + serverAuthUsage + "'");

        Pkcs10Csr pkcs10Csr;
        try {
            pkcs10Csr = Pkcs10CsrUtils.fromPem(new String(Base64.getDecoder().decode(Objects.requireNonNullElse(spec.getRequest(), "")),
                                                          StandardCharsets.UTF_8));
            if ( ! pkcs10Csr.isSignatureValid())
                return TrustDecision.deny("InvalidRequest", "Signature of certificate signing request is invalid");
            if (pkcs10Csr.getBasicConstraints().orElse(false))
                return TrustDecision.deny("InvalidRequest", "Serving certificate cannot be a certificate authority");
        } catch (IllegalArgumentException e) {
            return TrustDecision.deny("InvalidRequest", "Could not parse certificate signing request: " + e.getMessage());
        }

        if ( ! pkcs10Csr.getSubjectOrganizations().equals(List.of(nodesGroup)) ||
             ! pkcs10Csr.getSubjectCommonNames().equals(List.of(username)))
            return TrustDecision.deny("InvalidSubject", "Subject " + pkcs10Csr.getSubject().getName() +
                                                        " does not match requestor " + username);

        CertificateRequest request = CertificateRequest.fromCsr(pkcs10Csr);
        if ( ! request.nodeName().map(nodeName::equals).orElse(false))
            return TrustDecision.deny("InvalidDNSName", "First DNS name of " + request + " is not node " + nodeName);

        return validator.decide(budget, registry, request);
    }

    private static boolean isDecided(CertificateSigningRequestStatus status) {
        if (status == null || status.getConditions() == null) return false;
        return status.getConditions().stream()
                .anyMatch(condition -> decidedConditions.contains(condition.getType()));
    }

}
