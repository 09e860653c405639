package com.flagship.gl_posting.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PostingExceptionTest {

    @Test
    @DisplayName("The most severe kind wins: COA beats validation")
    void dominantKind() {
        PostingException e = new PostingException(List.of(
            PostingError.validation("UNBALANCED_JOURNAL", "Debits and credits differ by 10.00"),
            PostingError.of(ErrorKind.COA_ERROR, "ACCOUNT_INACTIVE", "Account 1000 is inactive")));

        assertEquals(ErrorKind.COA_ERROR, e.getKind());
        assertEquals(List.of("UNBALANCED_JOURNAL", "ACCOUNT_INACTIVE"), e.getCodes());
        assertTrue(e.hasCode("ACCOUNT_INACTIVE"));
        assertEquals("Debits and credits differ by 10.00 (and 1 more)", e.getMessage());
    }

    @Test
    @DisplayName("Line errors carry a 0-based index and a 1-based message")
    void lineError() {
        PostingError error = PostingError.line(2, "NEGATIVE_AMOUNT", "amounts must not be negative");

        assertEquals("Line 3: amounts must not be negative", error.getMessage());
        assertEquals(2, error.getDetails().get("lineIndex"));
        assertEquals(ErrorKind.VALIDATION_ERROR, error.getKind());
    }

    @Test
    @DisplayName("An exception needs at least one error")
    void requiresErrors() {
        assertThrows(IllegalArgumentException.class, () -> new PostingException(List.of()));
    }

    @Test
    @DisplayName("Only upstream failures are retryable")
    void retryable() {
        assertTrue(ErrorKind.UPSTREAM_UNAVAILABLE.isRetryable());
        assertFalse(ErrorKind.IDEMPOTENCY_CONFLICT.isRetryable());
        assertFalse(ErrorKind.VALIDATION_ERROR.isRetryable());
    }
}
