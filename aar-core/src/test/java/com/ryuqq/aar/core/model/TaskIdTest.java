package com.ryuqq.aar.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskId Value Object 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskIdTest {

    @Test
    void of_ValidValue_CreatesTaskId() {
        // Given
        String value = "task-12345";

        // When
        TaskId taskId = TaskId.of(value);

        // Then
        assertEquals(value, taskId.getValue());
    }

    @Test
    void of_ValidValueWithUnderscores_CreatesTaskId() {
        // When
        TaskId taskId = TaskId.of("task_safety_001");

        // Then
        assertEquals("task_safety_001", taskId.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> TaskId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> TaskId.of("   "));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> TaskId.of("task@123")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void of_TooLong_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> TaskId.of("a".repeat(256)));
    }

    @Test
    void generate_ReturnsDistinctIds() {
        // When
        TaskId first = TaskId.generate();
        TaskId second = TaskId.generate();

        // Then
        assertNotEquals(first, second);
        assertDoesNotThrow(() -> TaskId.of(first.getValue()));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        // Given
        TaskId a = TaskId.of("task-1");
        TaskId b = TaskId.of("task-1");

        // When & Then
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
