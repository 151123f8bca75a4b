package com.resume.network.ingestion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of the external document parser: an unordered bag of sections with inconsistent keys.
 * Values are untyped (text, lists, nested maps) and are only interpreted by {@link ResumeNormalizer}.
 *
 * @param id       candidate id assigned upstream, or null to let the normalizer generate one
 * @param sections section key to raw value
 * @param source   optional description of where the resume came from (file name, upload id)
 */
public record RawResume(String id, Map<String, Object> sections, String source) {

    public RawResume {
        sections = sections != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(sections))
                : Map.of();
    }

    public static RawResume of(String id, Map<String, Object> sections) {
        return new RawResume(id, sections, null);
    }

    /**
     * A resume the parser failed to read. Normalizing it always fails.
     */
    public static RawResume unparseable(String id, String source) {
        return new RawResume(id, Map.of(), source);
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }

    /**
     * Label used in logs and error reports.
     */
    public String label() {
        if (id != null) {
            return id;
        }
        return source != null ? source : "<anonymous>";
    }
}
