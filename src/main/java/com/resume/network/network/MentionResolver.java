package com.resume.network.network;

import com.resume.network.core.model.Candidate;
import com.resume.network.core.model.ColleagueEdge;
import com.resume.network.core.model.DateInterval;
import com.resume.network.core.model.Experience;
import com.resume.network.core.model.RelationshipType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Links candidates to the colleagues they name in their resumes.
 *
 * <p>A mentioned name matches a candidate when every word of the name is a word of the
 * candidate's name, ignoring case and punctuation: "Ada Lovelace" matches "Ada King Lovelace"
 * but "Al" does not match "Alan". An ambiguous name links to every candidate it matches.
 * Candidates never match themselves.</p>
 */
public class MentionResolver {
    private static final Logger log = LoggerFactory.getLogger(MentionResolver.class);

    private static final Pattern NON_LETTERS = Pattern.compile("[^\\p{L}\\p{N}]+");

    /**
     * Returns one {@link RelationshipType#DIRECT_COLLEAGUE} edge per resolved mention, unsorted.
     * Only candidates in {@code candidates} are considered as targets.
     */
    public List<ColleagueEdge> resolve(Collection<Candidate> candidates, LocalDate today) {
        Map<String, Set<String>> byNameWord = indexNames(candidates);
        List<ColleagueEdge> edges = new ArrayList<>();
        int unresolved = 0;
        for (Candidate candidate : candidates) {
            for (Experience experience : candidate.getExperiences()) {
                for (String mention : experience.mentionedColleagues()) {
                    Set<String> matches = match(mention, byNameWord);
                    matches.remove(candidate.getId());
                    if (matches.isEmpty()) {
                        unresolved++;
                        continue;
                    }
                    DateInterval interval = experience.interval(today).orElse(null);
                    for (String colleagueId : matches) {
                        edges.add(new ColleagueEdge(candidate.getId(), colleagueId, experience.organizationKey(),
                                experience.organization(), null, interval, RelationshipType.DIRECT_COLLEAGUE));
                    }
                }
            }
        }
        if (!edges.isEmpty() || unresolved > 0) {
            log.debug("network.mentions.resolved edges={} unresolved={}", edges.size(), unresolved);
        }
        return edges;
    }

    private static Map<String, Set<String>> indexNames(Collection<Candidate> candidates) {
        Map<String, Set<String>> index = new HashMap<>();
        for (Candidate candidate : candidates) {
            for (String word : words(candidate.getName())) {
                index.computeIfAbsent(word, key -> new TreeSet<>()).add(candidate.getId());
            }
        }
        return index;
    }

    private static Set<String> match(String mention, Map<String, Set<String>> byNameWord) {
        Set<String> words = words(mention);
        if (words.isEmpty()) {
            return new TreeSet<>();
        }
        Set<String> matches = null;
        for (String word : words) {
            Set<String> holders = byNameWord.getOrDefault(word, Set.of());
            if (matches == null) {
                matches = new TreeSet<>(holders);
            } else {
                matches.retainAll(holders);
            }
            if (matches.isEmpty()) {
                break;
            }
        }
        return matches;
    }

    static Set<String> words(String name) {
        Set<String> words = new LinkedHashSet<>();
        if (name == null) {
            return words;
        }
        for (String word : NON_LETTERS.split(name.toLowerCase(Locale.ROOT))) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }
}
