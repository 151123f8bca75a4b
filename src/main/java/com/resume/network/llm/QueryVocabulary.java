package com.resume.network.llm;

import com.resume.network.core.model.Candidate;
import com.resume.network.core.model.Experience;
import com.resume.network.pool.CandidatePool;
import com.resume.network.rules.NormalizationEngine;
import com.resume.network.rules.SkillSynonyms;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Terms known to a pool snapshot: organizations, departments, skills and role-title words.
 * Lookups fold simple English plurals ("engineers" finds "engineer").
 */
public final class QueryVocabulary {

    private final long snapshotVersion;
    private final Map<String, String> organizations;
    private final Map<String, String> departments;
    private final Set<String> skills;
    private final Set<String> titleWords;
    private final NormalizationEngine normalizationEngine;
    private final SkillSynonyms skillSynonyms;

    private QueryVocabulary(long snapshotVersion, Map<String, String> organizations, Map<String, String> departments,
                            Set<String> skills, Set<String> titleWords, NormalizationEngine normalizationEngine,
                            SkillSynonyms skillSynonyms) {
        this.snapshotVersion = snapshotVersion;
        this.organizations = Collections.unmodifiableMap(organizations);
        this.departments = Collections.unmodifiableMap(departments);
        this.skills = Collections.unmodifiableSet(skills);
        this.titleWords = Collections.unmodifiableSet(titleWords);
        this.normalizationEngine = normalizationEngine;
        this.skillSynonyms = skillSynonyms;
    }

    public static QueryVocabulary from(CandidatePool pool, NormalizationEngine normalizationEngine,
                                       SkillSynonyms skillSynonyms) {
        Map<String, String> organizations = new TreeMap<>();
        Map<String, String> departments = new TreeMap<>();
        Set<String> skills = new TreeSet<>();
        Set<String> titleWords = new TreeSet<>();
        for (Candidate candidate : pool.candidates()) {
            skills.addAll(candidate.getSkills());
            for (Experience experience : candidate.getExperiences()) {
                if (experience.hasOrganization()) {
                    organizations.putIfAbsent(experience.organizationKey(), experience.organization());
                }
                if (experience.hasDepartment()) {
                    departments.putIfAbsent(experience.departmentKey(), experience.department());
                }
                for (String word : normalizationEngine.titleKey(experience.title()).split(" ")) {
                    if (word.length() > 1) {
                        titleWords.add(word);
                    }
                }
            }
        }
        return new QueryVocabulary(pool.version(), organizations, departments, skills, titleWords,
                normalizationEngine, skillSynonyms);
    }

    public long snapshotVersion() {
        return snapshotVersion;
    }

    /**
     * Returns the organization key for a phrase, or null when the pool knows no such organization.
     */
    public String organizationKey(String phrase) {
        String key = normalizationEngine.organizationKey(phrase);
        return !key.isEmpty() && organizations.containsKey(key) ? key : null;
    }

    /**
     * Returns the department key for a phrase, also trying its singular form, or null.
     */
    public String departmentKey(String phrase) {
        String key = normalizationEngine.departmentKey(phrase);
        if (key.isEmpty()) {
            return null;
        }
        if (departments.containsKey(key)) {
            return key;
        }
        return singular(key, departments.keySet());
    }

    /**
     * Returns the canonical skill for a phrase, or null when it is neither a pool skill nor a
     * known synonym.
     */
    public String skill(String phrase) {
        String canonical = skillSynonyms.canonicalize(phrase);
        if (canonical.isEmpty()) {
            return null;
        }
        if (skills.contains(canonical)) {
            return canonical;
        }
        String singular = singular(canonical, skills);
        if (singular != null) {
            return singular;
        }
        return skillSynonyms.isKnown(phrase) ? canonical : null;
    }

    /**
     * Returns the role-title word for a word, folding plurals, or null.
     */
    public String titleWord(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (titleWords.contains(lower)) {
            return lower;
        }
        return singular(lower, titleWords);
    }

    public Set<String> organizationNames() {
        return new TreeSet<>(organizations.values());
    }

    public Set<String> skills() {
        return skills;
    }

    /**
     * Singular form of {@code word} if that form is in {@code known}.
     */
    static String singular(String word, Set<String> known) {
        if (word.endsWith("ies") && word.length() > 3) {
            String candidate = word.substring(0, word.length() - 3) + "y";
            if (known.contains(candidate)) {
                return candidate;
            }
        }
        if (word.endsWith("es") && word.length() > 2) {
            String candidate = word.substring(0, word.length() - 2);
            if (known.contains(candidate)) {
                return candidate;
            }
        }
        if (word.endsWith("s") && word.length() > 1) {
            String candidate = word.substring(0, word.length() - 1);
            if (known.contains(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Singular form of a word regardless of any vocabulary.
     */
    static String fold(String word) {
        if (word.endsWith("ies") && word.length() > 4) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.endsWith("ss") || word.length() <= 3) {
            return word;
        }
        if (word.endsWith("s")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }
}
