// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.config;

import ai.nodetrust.ValidationException;
import ai.nodetrust.identity.RetryPolicy;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * The cloud provider configuration file, e.g.
 *
 * <pre>
 * global:
 *   clusterName: prod-cluster
 *   preferIPv6: false
 * identitySync:
 *   maxAttempts: 5
 *   initialBackoffMillis: 200
 *   maxBackoffMillis: 5000
 * certificates:
 *   nodeLookupTimeoutMillis: 10000
 * </pre>
 *
 * Only the cluster name is required. Unknown keys are ignored.
 */
public class CloudConfig {

    private static final ObjectMapper mapper = YAMLMapper.builder()
                                                         .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                                                         .build();

    private final Global global;
    private final IdentitySync identitySync;
    private final Certificates certificates;

    private CloudConfig(Global global, IdentitySync identitySync, Certificates certificates) {
        this.global = global;
        this.identitySync = identitySync;
        this.certificates = certificates;
    }

    public String clusterName() { return global.clusterName; }

    public boolean preferIpv6() { return global.preferIpv6; }

    /** Returns the retry policy for writing identity labels on conflicts and transient failures */
    public RetryPolicy retryPolicy() {
        return new RetryPolicy(identitySync.maxAttempts,
                               Duration.ofMillis(identitySync.initialBackoffMillis),
                               Duration.ofMillis(identitySync.maxBackoffMillis));
    }

    /** Returns the longest time to wait for the node registry when evaluating a certificate request */
    public Duration nodeLookupTimeout() { return Duration.ofMillis(certificates.nodeLookupTimeoutMillis); }

    /**
     * Reads config from the given YAML text.
     *
     * @throws ValidationException if the YAML is malformed, or the config is invalid
     */
    public static CloudConfig fromYaml(String yaml) {
        Root root;
        try {
            root = mapper.readValue(yaml, Root.class);
        } catch (IOException e) {
            throw new ValidationException("Invalid cloud config: " + e.getMessage(), e);
        }
        if (root == null) root = new Root();
        return validated(new CloudConfig(root.global == null ? new Global() : root.global,
                                         root.identitySync == null ? new IdentitySync() : root.identitySync,
                                         root.certificates == null ? new Certificates() : root.certificates));
    }

    /** Reads config from the given YAML file */
    public static CloudConfig fromYaml(Path path) {
        try {
            return fromYaml(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read cloud config from " + path, e);
        }
    }

    private static CloudConfig validated(CloudConfig config) {
        if (config.global.clusterName == null || config.global.clusterName.isBlank())
            throw new ValidationException("global.clusterName must be set");
        if (config.certificates.nodeLookupTimeoutMillis <= 0)
            throw new ValidationException("certificates.nodeLookupTimeoutMillis must be positive, but was " +
                                          config.certificates.nodeLookupTimeoutMillis);
        try {
            config.retryPolicy();
        } catch (ValidationException e) {
            throw new ValidationException("Invalid identitySync config: " + e.getMessage(), e);
        }
        return config;
    }

    @Override
    public String toString() {
        return "cloud config for cluster " + clusterName() + ", " + retryPolicy() + ", node lookup timeout " + nodeLookupTimeout();
    }

    private static class Root {
        @JsonProperty("global") Global global;
        @JsonProperty("identitySync") IdentitySync identitySync;
        @JsonProperty("certificates") Certificates certificates;
    }

    private static class Global {
        @JsonProperty("clusterName") String clusterName;
        @JsonProperty("preferIPv6") boolean preferIpv6 = false;
    }

    private static class IdentitySync {
        @JsonProperty("maxAttempts") int maxAttempts = 5;
        @JsonProperty("initialBackoffMillis") long initialBackoffMillis = 200;
        @JsonProperty("maxBackoffMillis") long maxBackoffMillis = 5000;
    }

    private static class Certificates {
        @JsonProperty("nodeLookupTimeoutMillis") long nodeLookupTimeoutMillis = 10000;
    }

}
