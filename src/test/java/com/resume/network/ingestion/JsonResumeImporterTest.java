package com.resume.network.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resume.network.fixture.TestCandidates;
import com.resume.network.pool.CandidatePool;
import com.resume.network.pool.CandidatePoolHolder;
import com.resume.network.pool.InMemoryCandidateStore;
import com.resume.network.rules.DefaultNormalizationRules;
import com.resume.network.rules.SkillSynonyms;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonResumeImporter Tests")
class JsonResumeImporterTest {

    private CandidatePoolHolder poolHolder;
    private ResumeIngestionService ingestionService;

    @BeforeEach
    void setUp() {
        poolHolder = new CandidatePoolHolder();
        ResumeNormalizer normalizer = new ResumeNormalizer(DefaultNormalizationRules.createDefaultEngine(),
                SkillSynonyms.defaults(), new SeniorityClassifier(), TestCandidates.CLOCK);
        ingestionService = new ResumeIngestionService(normalizer, new InMemoryCandidateStore(), poolHolder);
    }

    @Test
    @DisplayName("Should import JSON Lines with top-level and nested sections")
    void testJsonLines() {
        String jsonl = """
                {"id": "c-1", "Name": "Ada Lovelace", "Work History": [{"company": "Acme", "title": "Engineer", "dates": "2019 - 2021"}], "Skills": "java, sql"}
                {"id": "c-2", "source": "upload-2", "sections": {"full_name": "Alan Turing", "experience": [{"employer": "Acme", "role": "Researcher", "from": "2020", "to": "Present"}]}}
                """;

        IngestionResult result = new JsonResumeImporter(ingestionService)
                .importResumes(new StringReader(jsonl), ProgressCallback.NOOP);

        assertEquals(2, result.totalRecords());
        assertEquals(List.of("c-1", "c-2"), result.acceptedIds());
        CandidatePool pool = poolHolder.current();
        assertEquals(Set.of("java", "sql"), pool.get("c-1").orElseThrow().getSkills());
        assertEquals("Alan Turing", pool.get("c-2").orElseThrow().getName());
        assertTrue(pool.get("c-2").orElseThrow().getExperiences().get(0).current());
    }

    @Test
    @DisplayName("Should import a JSON array from a stream")
    void testJsonArray() {
        String json = """
                [
                  {"id": "a", "name": "Ada"},
                  {"id": "b", "name": "Bob"},
                  {"id": "c", "name": "Cy"}
                ]
                """;

        IngestionResult result = new JsonResumeImporter(ingestionService, new ObjectMapper(), 2)
                .importResumes(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), null);

        assertEquals(3, result.totalRecords());
        assertEquals(3, result.successCount());
        assertEquals(3, poolHolder.current().size());
    }

    @Test
    @DisplayName("Non-object records are reported with their record number")
    void testNonObjectRecord() {
        String jsonl = """
                {"id": "a", "name": "Ada"}
                42
                {"id": "b", "name": "Bob"}
                """;

        IngestionResult result = new JsonResumeImporter(ingestionService)
                .importResumes(new StringReader(jsonl), ProgressCallback.NOOP);

        assertEquals(3, result.totalRecords());
        assertEquals(List.of("a", "b"), result.acceptedIds());
        assertEquals(1, result.errorCount());
        assertEquals(2, result.errors().get(0).recordNumber());
        assertTrue(result.errors().get(0).message().startsWith("Expected a JSON object"));
    }

    @Test
    @DisplayName("Malformed JSON ends the import but keeps what was read")
    void testMalformedJson() {
        String jsonl = "{\"id\": \"a\", \"name\": \"Ada\"}\n{\"id\": broken\n";

        IngestionResult result = new JsonResumeImporter(ingestionService)
                .importResumes(new StringReader(jsonl), ProgressCallback.NOOP);

        assertEquals(List.of("a"), result.acceptedIds());
        assertTrue(result.hasErrors());
        assertTrue(result.errors().get(0).message().startsWith("Malformed JSON"));
    }

    @Test
    @DisplayName("Chunk size must be positive")
    void testInvalidChunkSize() {
        assertThrows(IllegalArgumentException.class,
                () -> new JsonResumeImporter(ingestionService, new ObjectMapper(), 0));
    }
}
