package com.resume.network.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.resume.network.ingestion.IngestionResult.IngestionError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON importer for parsed resumes.
 *
 * <p>Expected format: JSON Lines, one resume object per line,</p>
 * <pre>
 * {"id": "c-1", "Name": "Ada Lovelace", "Work History": [...], "Skills": "java, sql"}
 * {"id": "c-2", "sections": {"full_name": "Alan Turing", "experience": [...]}}
 * </pre>
 *
 * <p>or a JSON array of the same objects. A resume either nests its sections under
 * {@code "sections"} or lists them as top-level fields next to {@code "id"} and
 * {@code "source"}. Resumes are ingested in chunks of {@code chunkSize}; each chunk publishes
 * one snapshot.</p>
 */
public class JsonResumeImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonResumeImporter.class);

    public static final int DEFAULT_CHUNK_SIZE = 500;
    private static final int PROGRESS_INTERVAL = 100;

    private final ResumeIngestionService ingestionService;
    private final ObjectMapper objectMapper;
    private final int chunkSize;

    public JsonResumeImporter(ResumeIngestionService ingestionService) {
        this(ingestionService, new ObjectMapper(), DEFAULT_CHUNK_SIZE);
    }

    public JsonResumeImporter(ResumeIngestionService ingestionService, ObjectMapper objectMapper, int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1");
        }
        this.ingestionService = Objects.requireNonNull(ingestionService, "ingestionService is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
        this.chunkSize = chunkSize;
    }

    public IngestionResult importResumes(InputStream input, ProgressCallback callback) {
        return importResumes(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    /**
     * Reads and ingests all resumes from {@code reader}. Malformed records are reported as
     * errors; a syntax error that makes the rest of the stream unreadable ends the import.
     */
    public IngestionResult importResumes(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        IngestionResult total = IngestionResult.empty(ingestionService.getPoolHolder().current().version());
        List<RawResume> chunk = new ArrayList<>(chunkSize);
        List<IngestionError> readErrors = new ArrayList<>();
        long recordNumber = 0;

        try (MappingIterator<JsonNode> records = objectMapper.readerFor(JsonNode.class).readValues(reader)) {
            while (records.hasNextValue()) {
                JsonNode node = records.nextValue();
                recordNumber++;
                if (!node.isObject()) {
                    readErrors.add(new IngestionError(recordNumber, "record-" + recordNumber,
                            "Expected a JSON object, got " + node.getNodeType()));
                    chunk.add(null);
                } else {
                    chunk.add(toRawResume((ObjectNode) node));
                }
                if (chunk.size() == chunkSize) {
                    total = total.merge(ingestChunk(chunk));
                    chunk.clear();
                }
                if (recordNumber % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(recordNumber, -1, "Read " + recordNumber + " resumes");
                }
            }
        } catch (JsonProcessingException e) {
            log.error("import.failed record={} error={}", recordNumber + 1, e.getOriginalMessage());
            readErrors.add(new IngestionError(recordNumber + 1, "record-" + (recordNumber + 1),
                    "Malformed JSON: " + e.getOriginalMessage()));
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            readErrors.add(new IngestionError(0, "", "IO error: " + e.getMessage()));
        }
        if (!chunk.isEmpty()) {
            total = total.merge(ingestChunk(chunk));
        }

        IngestionResult result = replaceNullErrors(total, readErrors);
        cb.onProgress(result.totalRecords(), result.totalRecords(), "Import completed");
        log.info("import.completed result={}", result);
        return result;
    }

    private IngestionResult ingestChunk(List<RawResume> chunk) {
        return ingestionService.ingest(new ArrayList<>(chunk));
    }

    /**
     * Non-object records were passed to the service as nulls to keep record numbering; their
     * errors are replaced by the more precise read errors.
     */
    private static IngestionResult replaceNullErrors(IngestionResult result, List<IngestionError> readErrors) {
        if (readErrors.isEmpty()) {
            return result;
        }
        Map<Long, IngestionError> byRecord = new LinkedHashMap<>();
        for (IngestionError error : result.errors()) {
            byRecord.put(error.recordNumber(), error);
        }
        for (IngestionError error : readErrors) {
            byRecord.put(error.recordNumber(), error);
        }
        List<IngestionError> errors = new ArrayList<>(byRecord.values());
        errors.sort((a, b) -> Long.compare(a.recordNumber(), b.recordNumber()));
        return new IngestionResult(result.totalRecords(), result.acceptedIds(), errors, result.snapshotVersion());
    }

    private RawResume toRawResume(ObjectNode node) {
        String id = node.hasNonNull("id") ? node.get("id").asText() : null;
        String source = node.hasNonNull("source") ? node.get("source").asText() : null;
        JsonNode sectionsNode = node.get("sections");
        Map<String, Object> sections = new LinkedHashMap<>();
        if (sectionsNode != null && sectionsNode.isObject()) {
            sections.putAll(toMap(sectionsNode));
        } else {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getKey().equals("id") && !field.getKey().equals("source")) {
                    sections.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
                }
            }
        }
        return new RawResume(id, sections, source);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toMap(JsonNode node) {
        return objectMapper.convertValue(node, Map.class);
    }
}
