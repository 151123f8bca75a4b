package com.resume.network.ingestion;

import com.resume.network.fixture.TestCandidates;
import com.resume.network.metrics.MetricsService;
import com.resume.network.pool.CandidatePool;
import com.resume.network.pool.CandidatePoolHolder;
import com.resume.network.pool.InMemoryCandidateStore;
import com.resume.network.pool.SnapshotListener;
import com.resume.network.rules.DefaultNormalizationRules;
import com.resume.network.rules.SkillSynonyms;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResumeIngestionService Tests")
class ResumeIngestionServiceTest {

    @Mock
    private MetricsService metricsService;

    private InMemoryCandidateStore store;
    private CandidatePoolHolder poolHolder;
    private ResumeIngestionService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryCandidateStore();
        poolHolder = new CandidatePoolHolder();
        ResumeNormalizer normalizer = new ResumeNormalizer(DefaultNormalizationRules.createDefaultEngine(),
                SkillSynonyms.defaults(), new SeniorityClassifier(), TestCandidates.CLOCK);
        service = new ResumeIngestionService(normalizer, store, poolHolder, metricsService);
    }

    @Test
    @DisplayName("Should publish accepted resumes as one new snapshot")
    void testIngestPublishesSnapshot() {
        long before = poolHolder.current().version();

        IngestionResult result = service.ingest(List.of(
                TestCandidates.rawResume("a", "Ada", "Acme", "Engineering", "Engineer", "2019 - 2021", "python"),
                TestCandidates.rawResume("b", "Bob", "Acme", "Engineering", "Engineer", "2020 - 2022", "golang")));

        assertEquals(2, result.successCount());
        assertFalse(result.hasErrors());
        assertEquals(before + 1, result.snapshotVersion());

        CandidatePool pool = poolHolder.current();
        assertEquals(result.snapshotVersion(), pool.version());
        assertEquals(Set.of("a", "b"), pool.asMap().keySet());
        assertEquals(2, store.size());
        verify(metricsService).incrementCandidatesIngested(2);
        verify(metricsService, never()).incrementNormalizationFailures(anyInt());
    }

    @Test
    @DisplayName("One bad resume does not fail the batch")
    void testFailureIsolation() {
        List<RawResume> batch = new ArrayList<>(Arrays.asList(
                TestCandidates.rawResume("a", "Ada", "Acme", null, "Engineer", "2019 - 2021"),
                RawResume.unparseable("broken", "scan.pdf"),
                null,
                TestCandidates.rawResume("c", "Cy", "Globex", null, "Analyst", "2018 - 2020")));

        IngestionResult result = service.ingest(batch);

        assertEquals(4, result.totalRecords());
        assertEquals(List.of("a", "c"), result.acceptedIds());
        assertEquals(2, result.errorCount());
        assertEquals(2, result.errors().get(0).recordNumber());
        assertEquals("broken", result.errors().get(0).resumeLabel());
        assertEquals(3, result.errors().get(1).recordNumber());
        assertEquals(2, poolHolder.current().size());
        verify(metricsService).incrementNormalizationFailures(2);
    }

    @Test
    @DisplayName("Re-ingesting a candidate replaces the previous version")
    void testReingestReplaces() {
        service.ingest(List.of(TestCandidates.rawResume("a", "Ada", "Acme", null, "Engineer", "2019 - 2021")));
        service.ingest(List.of(TestCandidates.rawResume("a", "Ada King", "Globex", null, "Lead", "2021 - 2023")));

        CandidatePool pool = poolHolder.current();
        assertEquals(1, pool.size());
        assertEquals("Ada King", pool.get("a").orElseThrow().getName());
        assertEquals(Set.of("globex"), pool.get("a").orElseThrow().organizationKeys());
    }

    @Test
    @DisplayName("A batch with no accepted resumes publishes nothing")
    void testAllRejected() {
        long before = poolHolder.current().version();

        IngestionResult result = service.ingest(List.of(RawResume.unparseable("x", null)));

        assertEquals(0, result.successCount());
        assertEquals(before, poolHolder.current().version());
    }

    @Test
    @DisplayName("Delete removes candidates and publishes a snapshot")
    void testDelete() {
        service.ingest(List.of(
                TestCandidates.rawResume("a", "Ada", "Acme", null, "Engineer", "2019 - 2021"),
                TestCandidates.rawResume("b", "Bob", "Acme", null, "Engineer", "2020 - 2022")));
        long before = poolHolder.current().version();

        int removed = service.delete(List.of("a", "missing"));

        assertEquals(1, removed);
        assertEquals(before + 1, poolHolder.current().version());
        assertFalse(poolHolder.current().contains("a"));
        assertTrue(poolHolder.current().contains("b"));
    }

    @Test
    @DisplayName("Reload rebuilds the pool from the store")
    void testReload() {
        service.ingest(List.of(TestCandidates.rawResume("a", "Ada", "Acme", null, "Engineer", "2019 - 2021")));
        poolHolder.publish(CandidatePool.empty());

        CandidatePool reloaded = service.reload();

        assertEquals(1, reloaded.size());
        assertTrue(reloaded.contains("a"));
    }

    @Test
    @DisplayName("Snapshot listeners are notified after publishing")
    void testListenerNotified() {
        SnapshotListener listener = mock(SnapshotListener.class);
        poolHolder.addListener(listener);

        service.ingest(List.of(TestCandidates.rawResume("a", "Ada", "Acme", null, "Engineer", "2019 - 2021")));

        verify(listener).onSnapshotPublished(any(CandidatePool.class));
    }

    @Test
    @DisplayName("Progress callback reports completion")
    void testProgressCallback() {
        List<String> messages = new ArrayList<>();

        service.ingest(List.of(TestCandidates.rawResume("a", "Ada", "Acme", null, "Engineer", "2019 - 2021")),
                (processed, total, message) -> messages.add(processed + "/" + total + " " + message));

        assertEquals(List.of("1/1 Ingestion completed"), messages);
    }
}
