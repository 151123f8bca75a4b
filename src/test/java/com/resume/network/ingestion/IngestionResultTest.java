package com.resume.network.ingestion;

import com.resume.network.ingestion.IngestionResult.IngestionError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IngestionResultTest {

    @Test
    @DisplayName("Merging shifts record numbers of the later batch")
    void testMerge() {
        IngestionResult first = new IngestionResult(3, List.of("a", "b"),
                List.of(new IngestionError(2, "x", "bad")), 4);
        IngestionResult second = new IngestionResult(2, List.of("c"),
                List.of(new IngestionError(1, "y", "worse")), 5);

        IngestionResult merged = first.merge(second);

        assertEquals(5, merged.totalRecords());
        assertEquals(List.of("a", "b", "c"), merged.acceptedIds());
        assertEquals(List.of(2L, 4L), merged.errors().stream().map(IngestionError::recordNumber).toList());
        assertEquals(5, merged.snapshotVersion());
    }

    @Test
    @DisplayName("Empty result has no errors")
    void testEmpty() {
        IngestionResult empty = IngestionResult.empty(7);

        assertEquals(0, empty.totalRecords());
        assertFalse(empty.hasErrors());
        assertEquals(7, empty.snapshotVersion());
        assertEquals("IngestionResult{total=0, accepted=0, errors=0, version=7}", empty.toString());
    }
}
