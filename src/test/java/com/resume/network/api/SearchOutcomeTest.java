package com.resume.network.api;

import com.resume.network.network.InternalInconsistencyException;
import com.resume.network.query.QueryValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SearchOutcome Tests")
class SearchOutcomeTest {

    @Test
    @DisplayName("OK outcome should return its result")
    void testOk() {
        SearchOutcome<String> outcome = SearchOutcome.ok("result", 3, "corr-1");

        assertTrue(outcome.isOk());
        assertEquals("result", outcome.getOrThrow());
        assertEquals("result", outcome.toOptional().orElseThrow());
        assertEquals(3, outcome.snapshotVersion());
    }

    @Test
    @DisplayName("Validation error should rethrow with its field")
    void testValidationError() {
        SearchOutcome<String> outcome = SearchOutcome.validationError("page", "page must be >= 0", 3, "corr-2");

        assertFalse(outcome.isOk());
        assertTrue(outcome.toOptional().isEmpty());
        QueryValidationException e = assertThrows(QueryValidationException.class, outcome::getOrThrow);
        assertEquals("page", e.getField());
        assertEquals("page must be >= 0", e.getReason());
    }

    @Test
    @DisplayName("Internal error should rethrow as an inconsistency")
    void testInternalError() {
        SearchOutcome<String> outcome = SearchOutcome.internalError("edge without node", 3, "corr-3");

        InternalInconsistencyException e = assertThrows(InternalInconsistencyException.class, outcome::getOrThrow);
        assertEquals("edge without node", e.getMessage());
    }
}
