// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.registry;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

@EnableKubernetesMockClient(crud = true)
public class KubernetesNodeRegistryTest {

    private static final Duration timeout = Duration.ofSeconds(10);

    KubernetesClient client;

    private KubernetesNodeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new KubernetesNodeRegistry(client);
        client.nodes().resource(new NodeBuilder().withNewMetadata()
                                                 .withName("node1")
                                                 .withLabels(Map.of("team", "storage"))
                                                 .endMetadata()
                                                 .build())
              .create();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void get_node() {
        assertEquals("node1", registry.get("node1", timeout).getMetadata().getName());
    }

    @Test
    void get_missing_node() {
        NodeNotFoundException e = assertThrows(NodeNotFoundException.class, () -> registry.get("node2", timeout));
        assertEquals("nodes \"node2\" not found", e.getMessage());
    }

    @Test
    void patch_labels() {
        Node node = registry.get("node1", timeout);
        LabelPatch patch = LabelPatch.against(node.getMetadata().getLabels()).set("zone", "a").build();
        registry.patchLabels("node1", node.getMetadata().getResourceVersion(), patch);
        assertEquals(Map.of("team", "storage", "zone", "a"), registry.get("node1", timeout).getMetadata().getLabels());
    }

    @Test
    void merge_patch_carries_resource_version_and_changed_labels_only() {
        LabelPatch patch = LabelPatch.against(Map.of("a", "1", "b", "2")).set("a", "one").remove("b").set("c", "3").build();
        assertEquals("{\"metadata\":{\"resourceVersion\":\"42\",\"labels\":{\"a\":\"one\",\"c\":\"3\",\"b\":null}}}",
                     KubernetesNodeRegistry.toMergePatch("42", patch));
        assertEquals("{\"metadata\":{\"labels\":{\"c\":\"3\"}}}",
                     KubernetesNodeRegistry.toMergePatch(null, LabelPatch.against(Map.of()).set("c", "3").build()));
    }

    @Test
    void api_errors_are_translated() {
        assertInstanceOf(NodeNotFoundException.class, KubernetesNodeRegistry.translate("node1", new KubernetesClientException("gone", 404, null)));
        assertInstanceOf(ConflictException.class, KubernetesNodeRegistry.translate("node1", new KubernetesClientException("modified", 409, null)));
        assertInstanceOf(TransientException.class, KubernetesNodeRegistry.translate("node1", new KubernetesClientException("unavailable", 503, null)));
        assertInstanceOf(TransientException.class, KubernetesNodeRegistry.translate("node1", new IllegalStateException("boom")));
        assertEquals("nodes \"node1\" not found",
                     KubernetesNodeRegistry.translate("node1", new KubernetesClientException("gone", 404, null)).getMessage());
    }

}
