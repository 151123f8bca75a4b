package com.resume.network.rules;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Folds skill tokens into canonical form: lower-cased, trimmed, and mapped through a synonym
 * table so that near-duplicates such as "JS" and "JavaScript" collapse into one token.
 * Instances are immutable; use {@link #with(String, String)} to extend a table.
 */
public final class SkillSynonyms {

    private final Map<String, String> aliasToCanonical;

    private SkillSynonyms(Map<String, String> aliasToCanonical) {
        this.aliasToCanonical = Map.copyOf(aliasToCanonical);
    }

    public static SkillSynonyms empty() {
        return new SkillSynonyms(Map.of());
    }

    /**
     * Synonyms for common technology and business skills.
     */
    public static SkillSynonyms defaults() {
        Map<String, String> map = new HashMap<>();
        alias(map, "javascript", "js", "ecmascript", "java script");
        alias(map, "typescript", "ts");
        alias(map, "python", "py", "python3");
        alias(map, "golang", "go", "go lang");
        alias(map, "kubernetes", "k8s", "kube");
        alias(map, "postgresql", "postgres", "psql");
        alias(map, "node.js", "node", "nodejs", "node js");
        alias(map, "react", "reactjs", "react.js");
        alias(map, "c#", "csharp", "c sharp");
        alias(map, "c++", "cpp");
        alias(map, "machine learning", "ml");
        alias(map, "artificial intelligence", "ai");
        alias(map, "amazon web services", "aws");
        alias(map, "google cloud platform", "gcp", "google cloud");
        alias(map, "microsoft excel", "excel", "ms excel");
        alias(map, "sql", "structured query language");
        return new SkillSynonyms(map);
    }

    public static SkillSynonyms of(Map<String, String> aliasToCanonical) {
        Map<String, String> map = new HashMap<>();
        aliasToCanonical.forEach((alias, canonical) ->
                map.put(clean(alias), clean(canonical)));
        return new SkillSynonyms(map);
    }

    /**
     * Returns a copy of this table with one more alias.
     */
    public SkillSynonyms with(String alias, String canonical) {
        Map<String, String> map = new HashMap<>(aliasToCanonical);
        map.put(clean(alias), clean(canonical));
        return new SkillSynonyms(map);
    }

    /**
     * Returns the canonical token for a raw skill, or an empty string for blank input.
     */
    public String canonicalize(String rawSkill) {
        String cleaned = clean(rawSkill);
        if (cleaned.isEmpty()) {
            return cleaned;
        }
        return aliasToCanonical.getOrDefault(cleaned, cleaned);
    }

    /**
     * Canonicalizes and deduplicates a collection of skills, keeping first-seen order.
     */
    public Set<String> canonicalizeAll(Iterable<String> rawSkills) {
        Set<String> result = new LinkedHashSet<>();
        for (String raw : rawSkills) {
            String canonical = canonicalize(raw);
            if (!canonical.isEmpty()) {
                result.add(canonical);
            }
        }
        return result;
    }

    /**
     * Whether the token is an alias or a canonical form in this table.
     */
    public boolean isKnown(String rawSkill) {
        String cleaned = clean(rawSkill);
        return aliasToCanonical.containsKey(cleaned) || aliasToCanonical.containsValue(cleaned);
    }

    public int size() {
        return aliasToCanonical.size();
    }

    static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.toLowerCase(Locale.ROOT)
                .replaceAll("^[\\s\"'(\\[{*•-]+|[\\s\"')\\]}.,;:]+$", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static void alias(Map<String, String> map, String canonical, String... aliases) {
        Objects.requireNonNull(canonical);
        for (String alias : aliases) {
            map.put(alias, canonical);
        }
    }
}
