package com.resume.network.similarity;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Jaccard similarity (token overlap).
 * Computes similarity as |intersection| / |union| of two token sets.
 * Two empty sets share nothing and score 0.0.
 */
public class JaccardSimilarity {

    private static final Set<String> TITLE_STOP_WORDS = Set.of(
            "a", "an", "and", "the", "of", "for", "in", "at", "to", "on", "with");

    private final Pattern tokenPattern;

    public JaccardSimilarity() {
        this("[^\\p{L}\\p{N}+#]+");
    }

    public JaccardSimilarity(String tokenPattern) {
        this.tokenPattern = Pattern.compile(tokenPattern);
    }

    /**
     * Jaccard coefficient of two sets.
     */
    public static double compute(Set<String> first, Set<String> second) {
        if (first == null || second == null || first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        int intersectionSize = intersectionSize(first, second);
        // |union| = |A| + |B| - |intersection|
        int unionSize = first.size() + second.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }

    public static int intersectionSize(Set<String> first, Set<String> second) {
        Set<String> smaller = first.size() <= second.size() ? first : second;
        Set<String> larger = smaller == first ? second : first;
        int count = 0;
        for (String token : smaller) {
            if (larger.contains(token)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Token Jaccard over free text such as role titles, with stop words removed.
     */
    public double computeTokens(Collection<String> first, Collection<String> second) {
        return compute(tokenize(first), tokenize(second));
    }

    /**
     * Lower-cased tokens of all given strings, minus stop words.
     */
    public Set<String> tokenize(Collection<String> texts) {
        Set<String> tokens = new LinkedHashSet<>();
        if (texts == null) {
            return tokens;
        }
        for (String text : texts) {
            if (text == null || text.isBlank()) {
                continue;
            }
            for (String token : tokenPattern.split(text.toLowerCase(Locale.ROOT))) {
                if (!token.isEmpty() && !TITLE_STOP_WORDS.contains(token)) {
                    tokens.add(token);
                }
            }
        }
        return tokens;
    }
}
