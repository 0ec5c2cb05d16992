// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.identity;

import ai.nodetrust.registry.ConflictException;
import ai.nodetrust.registry.NodeNotFoundException;
import ai.nodetrust.registry.TransientException;
import ai.nodetrust.test.InMemoryNodeRegistry;
import ai.nodetrust.test.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static ai.nodetrust.test.InMemoryNodeRegistry.node;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NodeIdentityReconcilerTest {

    private final InMemoryNodeRegistry registry = new InMemoryNodeRegistry();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final NodeIdentityReconciler reconciler =
            new NodeIdentityReconciler(registry,
                                       nodeName -> new PlatformMetadata("metal", nodeName, true),
                                       "test-cluster",
                                       new RetryPolicy(3, Duration.ofMillis(100), Duration.ofMillis(150)),
                                       Duration.ofSeconds(2),
                                       sleeper);

    private static final Map<String, String> expectedLabels = Map.of(ManagedLabels.clusterName, "test-cluster",
                                                                     ManagedLabels.platform, "metal",
                                                                     ManagedLabels.lifecycle, "spot");

    @Test
    void labels_node() {
        registry.add(node("node1", Map.of()));
        assertTrue(reconciler.reconcile("node1"));
        assertEquals(expectedLabels, registry.labels("node1"));
        assertFalse(reconciler.reconcile("node1"));
        assertEquals(List.of(), sleeper.sleeps());
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(2)), registry.getTimeouts());
    }

    @Test
    void conflict_is_retried_with_fresh_read() {
        registry.add(node("node1", Map.of()));
        registry.failNextPatchesWithConflict(2);
        assertTrue(reconciler.reconcile("node1"));
        assertEquals(expectedLabels, registry.labels("node1"));
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(150)), sleeper.sleeps());
        assertEquals(3, registry.getTimeouts().size());
    }

    @Test
    void transient_read_failure_is_retried() {
        registry.add(node("node1", Map.of()));
        registry.failNextGets(1);
        assertTrue(reconciler.reconcile("node1"));
        assertEquals(List.of(Duration.ofMillis(100)), sleeper.sleeps());
    }

    @Test
    void last_failure_is_rethrown_when_attempts_are_exhausted() {
        registry.add(node("node1", Map.of()));
        registry.failNextPatchesWithConflict(3);
        assertThrows(ConflictException.class, () -> reconciler.reconcile("node1"));
        assertEquals(Map.of(), registry.labels("node1"));
        assertEquals(2, sleeper.sleeps().size());

        registry.failNextGets(5);
        assertThrows(TransientException.class, () -> reconciler.reconcile("node1"));
    }

    @Test
    void missing_node_fails_at_once() {
        NodeNotFoundException e = assertThrows(NodeNotFoundException.class, () -> reconciler.reconcile("node2"));
        assertEquals("nodes \"node2\" not found", e.getMessage());
        assertEquals(List.of(), sleeper.sleeps());
    }

}
