package com.ryuqq.aar.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AnalysisDomain Value Object 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class AnalysisDomainTest {

    @Test
    void of_ValidValue_CreatesDomain() {
        // When
        AnalysisDomain domain = AnalysisDomain.of("AIR_QUALITY");

        // Then
        assertEquals("AIR_QUALITY", domain.getValue());
    }

    @Test
    void of_KnownValue_EqualsConstant() {
        // When & Then
        assertEquals(AnalysisDomain.SAFETY, AnalysisDomain.of("SAFETY"));
        assertEquals(AnalysisDomain.SAFETY.hashCode(), AnalysisDomain.of("SAFETY").hashCode());
    }

    @Test
    void of_LowerCase_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> AnalysisDomain.of("safety")
        );
        assertTrue(exception.getMessage().contains("uppercase"));
    }

    @Test
    void of_Blank_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> AnalysisDomain.of(""));
        assertThrows(IllegalArgumentException.class, () -> AnalysisDomain.of(null));
    }

    @Test
    void of_TooLong_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> AnalysisDomain.of("A".repeat(51)));
    }
}
