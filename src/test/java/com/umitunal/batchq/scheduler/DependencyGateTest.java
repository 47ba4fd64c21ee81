package com.umitunal.batchq.scheduler;

import com.umitunal.batchq.core.ItemRegistry;
import com.umitunal.batchq.core.WorkItem;
import com.umitunal.batchq.core.WorkRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DependencyGateTest {

    private ItemRegistry<String> registry;
    private DependencyGate<String> gate;

    @BeforeEach
    void setUp() {
        registry = new ItemRegistry<>();
        gate = new DependencyGate<>(registry);
    }

    private WorkItem<String> add(String id, String... deps) {
        return registry.register(WorkRequest.builder(id, id).dependsOn(deps).build(), 3);
    }

    private void complete(WorkItem<String> item) {
        registry.startAttempt(item);
        registry.complete(item, null);
    }

    @Test
    @DisplayName("Item without dependencies can always run")
    void testNoDependencies() {
        WorkItem<String> item = add("solo");

        assertThat(gate.canRun(item)).isTrue();
        assertThat(gate.unmetDependencies(item)).isEmpty();
        assertThat(gate.isPermanentlyBlocked(item)).isFalse();
    }

    @Test
    @DisplayName("Item waits until every dependency is COMPLETED")
    void testWaitsForAllDependencies() {
        // Given
        WorkItem<String> a = add("a");
        WorkItem<String> b = add("b");
        WorkItem<String> c = add("c", "a", "b");

        // When
        complete(a);

        // Then
        assertThat(gate.canRun(c)).isFalse();
        assertThat(gate.unmetDependencies(c)).containsExactly("b");
        assertThat(gate.isPermanentlyBlocked(c)).isFalse();

        complete(b);
        assertThat(gate.canRun(c)).isTrue();
    }

    @Test
    @DisplayName("Processing dependency does not satisfy the gate")
    void testProcessingDependency() {
        WorkItem<String> a = add("a");
        WorkItem<String> b = add("b", "a");

        registry.startAttempt(a);

        assertThat(gate.canRun(b)).isFalse();
    }

    @Test
    @DisplayName("Missing or failed dependency blocks permanently")
    void testPermanentlyBlocked() {
        // Given
        WorkItem<String> orphan = add("orphan", "ghost");
        WorkItem<String> a = add("a");
        WorkItem<String> b = add("b", "a");

        // When
        registry.startAttempt(a);
        registry.recordFailure(a, "boom", null);
        registry.fail(a);

        // Then
        assertThat(gate.canRun(orphan)).isFalse();
        assertThat(gate.unmetDependencies(orphan)).containsExactly("ghost");
        assertThat(gate.isPermanentlyBlocked(orphan)).isTrue();
        assertThat(gate.isPermanentlyBlocked(b)).isTrue();
    }

    @Test
    @DisplayName("Dependency submitted later unblocks the item once completed")
    void testLateDependency() {
        // Given
        WorkItem<String> child = add("child", "parent");
        assertThat(gate.isPermanentlyBlocked(child)).isTrue();

        // When
        WorkItem<String> parent = add("parent");

        // Then
        assertThat(gate.isPermanentlyBlocked(child)).isFalse();
        assertThat(gate.canRun(child)).isFalse();
        complete(parent);
        assertThat(gate.canRun(child)).isTrue();
    }
}
