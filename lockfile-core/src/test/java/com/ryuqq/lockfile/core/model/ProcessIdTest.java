package com.ryuqq.lockfile.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProcessId Value Object 테스트.
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
class ProcessIdTest {

    @Test
    void of_PositiveValue_CreatesProcessId() {
        // Given
        long value = 12345L;

        // When
        ProcessId processId = ProcessId.of(value);

        // Then
        assertEquals(value, processId.getValue());
    }

    @Test
    void of_ZeroValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ProcessId.of(0)
        );
        assertTrue(exception.getMessage().contains("must be positive"));
    }

    @Test
    void of_NegativeValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ProcessId.of(-1));
    }

    @Test
    void current_MatchesRunningJvm() {
        // When
        ProcessId current = ProcessId.current();

        // Then
        assertEquals(ProcessHandle.current().pid(), current.getValue());
    }

    @Test
    void toString_IsBareDecimal() {
        // Given
        ProcessId processId = ProcessId.of(4242);

        // When
        String text = processId.toString();

        // Then: 마커 파일 내용과 정확히 일치 (개행, 공백 없음)
        assertEquals("4242", text);
    }

    @Test
    void parse_DecimalText_ReturnsProcessId() {
        assertEquals(ProcessId.of(31337), ProcessId.parse("31337"));
    }

    @Test
    void parse_SurroundingWhitespace_IsTolerated() {
        assertEquals(ProcessId.of(31337), ProcessId.parse(" 31337\n"));
    }

    @Test
    void parse_NonNumericText_ThrowsException() {
        // Given
        String garbage = "dean woz 'ere!";

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ProcessId.parse(garbage)
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void parse_BlankText_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ProcessId.parse(""));
        assertThrows(IllegalArgumentException.class, () -> ProcessId.parse("   "));
        assertThrows(IllegalArgumentException.class, () -> ProcessId.parse(null));
    }

    @Test
    void parse_SignedOrZeroText_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ProcessId.parse("-12"));
        assertThrows(IllegalArgumentException.class, () -> ProcessId.parse("+12"));
        assertThrows(IllegalArgumentException.class, () -> ProcessId.parse("0"));
    }

    @Test
    void parse_TruncatedWriteWithEmbeddedSpace_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ProcessId.parse("12 34"));
    }

    @Test
    void parse_OverflowingText_ThrowsException() {
        // Given
        String tooLarge = "99999999999999999999999";

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ProcessId.parse(tooLarge)
        );
        assertTrue(exception.getMessage().contains("out of range"));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        assertEquals(ProcessId.of(7), ProcessId.of(7));
        assertEquals(ProcessId.of(7).hashCode(), ProcessId.of(7).hashCode());
    }

    @Test
    void equals_DifferentValue_ReturnsFalse() {
        assertNotEquals(ProcessId.of(7), ProcessId.of(8));
        assertNotEquals(null, ProcessId.of(7));
    }
}
