package com.ryuqq.aar.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Task 테스트.
 *
 * <p>(priority, sequence) 정렬 규칙과 불변성을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskTest {

    @Test
    void compareTo_LowerPriorityValue_ComesFirst() {
        // Given
        Task<String> normal = Task.create(AnalysisDomain.SAFETY, "a", null, 2, 0);
        Task<String> high = Task.create(AnalysisDomain.SAFETY, "b", null, 1, 1);

        // When & Then
        assertTrue(high.compareTo(normal) < 0);
        assertTrue(normal.compareTo(high) > 0);
    }

    @Test
    void compareTo_SamePriority_OrdersBySequence() {
        // Given
        Task<String> first = Task.create(AnalysisDomain.SAFETY, "a", null, 2, 5);
        Task<String> second = Task.create(AnalysisDomain.SAFETY, "b", null, 2, 6);

        // When & Then
        assertTrue(first.compareTo(second) < 0);
    }

    @Test
    void sort_MixedPriorities_ProducesFifoWithinPriority() {
        // Given
        Task<String> p2a = Task.create(AnalysisDomain.SAFETY, "p2a", null, 2, 0);
        Task<String> p1 = Task.create(AnalysisDomain.SAFETY, "p1", null, 1, 1);
        Task<String> p2b = Task.create(AnalysisDomain.SAFETY, "p2b", null, 2, 2);
        List<Task<String>> tasks = new ArrayList<>(List.of(p2b, p1, p2a));

        // When
        Collections.sort(tasks);

        // Then
        assertEquals(List.of(p1, p2a, p2b), tasks);
    }

    @Test
    void getConfig_SourceMapModified_SnapshotUnchanged() {
        // Given
        Map<String, Object> config = new HashMap<>();
        config.put("threshold", 3);
        Task<String> task = Task.create(AnalysisDomain.NETWORK, "data", config, 2, 0);

        // When
        config.put("threshold", 9);

        // Then
        assertEquals(3, task.getConfig().get("threshold"));
        assertThrows(UnsupportedOperationException.class, () -> task.getConfig().put("x", 1));
    }

    @Test
    void create_NullConfig_UsesEmptyMap() {
        // When
        Task<String> task = Task.create(AnalysisDomain.NETWORK, "data", null, 2, 0);

        // Then
        assertTrue(task.getConfig().isEmpty());
    }

    @Test
    void of_NullDomain_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> Task.of(TaskId.of("t-1"), null, "d", null, 2, 0, Instant.now()));
    }

    @Test
    void of_NegativeSequence_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> Task.of(TaskId.of("t-1"), AnalysisDomain.SAFETY, "d", null, 2, -1, Instant.now()));
        assertTrue(exception.getMessage().contains("non-negative"));
    }

    @Test
    void equals_SameTaskId_ReturnsTrue() {
        // Given
        Instant now = Instant.now();
        Task<String> a = Task.of(TaskId.of("t-1"), AnalysisDomain.SAFETY, "a", null, 1, 0, now);
        Task<String> b = Task.of(TaskId.of("t-1"), AnalysisDomain.SAFETY, "b", null, 3, 7, now);

        // When & Then
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void taskPriority_Values_AreOrdered() {
        // When & Then
        assertEquals(0, TaskPriority.CRITICAL.value());
        assertEquals(1, TaskPriority.HIGH.value());
        assertEquals(2, TaskPriority.NORMAL.value());
        assertEquals(3, TaskPriority.LOW.value());
    }
}
