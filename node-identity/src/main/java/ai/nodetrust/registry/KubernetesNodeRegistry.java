// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;

import java.net.HttpURLConnection;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A node registry backed by the Kubernetes API server.
 *
 * <p>Reads run on a worker thread so they can be abandoned when the caller's timeout expires.
 * Label changes are sent as JSON merge patches carrying the resource version of the node snapshot
 * they were computed from, which makes the API server reject them with 409 Conflict if the node has
 * changed since.</p>
 */
public class KubernetesNodeRegistry implements NodeRegistry, AutoCloseable {

    private static final Logger log = Logger.getLogger(KubernetesNodeRegistry.class.getName());

    private static final ObjectMapper mapper = new ObjectMapper();

    private final KubernetesClient client;
    private final ExecutorService executor;

    public KubernetesNodeRegistry(KubernetesClient client) {
        this(client, Executors.newCachedThreadPool(new ThreadFactoryBuilder().setNameFormat("node-registry-%d")
                                                                              .setDaemon(true)
                                                                              .build()));
    }

    KubernetesNodeRegistry(KubernetesClient client, ExecutorService executor) {
        this.client = client;
        this.executor = executor;
    }

    @Override
    public Node get(String name, Duration timeout) {
        Future<Node> future = executor.submit(() -> client.nodes().withName(name).get());
        try {
            Node node = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (node == null) throw new NodeNotFoundException(name);
            return node;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientException("Timed out after " + timeout + " getting node " + name, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientException("Interrupted while getting node " + name, e);
        } catch (ExecutionException e) {
            throw translate(name, e.getCause());
        }
    }

    @Override
    public Node patchLabels(String name, String resourceVersion, LabelPatch patch) {
        String body = toMergePatch(resourceVersion, patch);
        log.log(Level.FINE, () -> "Patching node " + name + " at resource version " + resourceVersion + ": " + body);
        try {
            return client.nodes().withName(name).patch(PatchContext.of(PatchType.JSON_MERGE), body);
        } catch (KubernetesClientException e) {
            throw translate(name, e);
        }
    }

    /** Returns a JSON merge patch which changes the labels of the patch, and nothing else */
    static String toMergePatch(String resourceVersion, LabelPatch patch) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode metadata = root.putObject("metadata");
        if (resourceVersion != null)
            metadata.put("resourceVersion", resourceVersion);
        ObjectNode labels = metadata.putObject("labels");
        patch.set().forEach(labels::put);
        patch.removed().forEach(labels::putNull);
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + patch, e);
        }
    }

    static NodeRegistryException translate(String name, Throwable t) {
        if (t instanceof KubernetesClientException) {
            KubernetesClientException e = (KubernetesClientException) t;
            switch (e.getCode()) {
                case HttpURLConnection.HTTP_NOT_FOUND:
                    return new NodeNotFoundException(name, e);
                case HttpURLConnection.HTTP_CONFLICT:
                    return new ConflictException("Node " + name + " was modified concurrently: " + e.getMessage(), e);
                default:
                    break;
            }
        }
        return new TransientException("Failed talking to the API server about node " + name + ": " + t.getMessage(), t);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

}
