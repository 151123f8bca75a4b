package com.resume.network.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies normalization rules to organization, department and title text.
 * Rules run in priority order (lower number first). The same engine is used at ingestion and
 * at query time so that query text and stored keys are comparable.
 *
 * <p>The rule list is replaced, never mutated in place, so normalization may run concurrently
 * with {@link #addRule(NormalizationRule)}.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private volatile List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = List.of();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = sorted(rules);
    }

    public synchronized void addRule(NormalizationRule rule) {
        List<NormalizationRule> next = new ArrayList<>(rules);
        next.add(rule);
        rules = sorted(next);
    }

    public synchronized void addRules(List<NormalizationRule> newRules) {
        List<NormalizationRule> next = new ArrayList<>(rules);
        next.addAll(newRules);
        rules = sorted(next);
    }

    public synchronized boolean removeRule(String ruleName) {
        List<NormalizationRule> next = new ArrayList<>(rules);
        boolean removed = next.removeIf(r -> r.getName().equals(ruleName));
        rules = sorted(next);
        return removed;
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Canonical organization key: legal suffixes stripped, punctuation removed, case-folded.
     */
    public String organizationKey(String organization) {
        return normalize(organization, NormalizationTarget.ORGANIZATION);
    }

    public String departmentKey(String department) {
        return normalize(department, NormalizationTarget.DEPARTMENT);
    }

    public String titleKey(String title) {
        return normalize(title, NormalizationTarget.TITLE);
    }

    /**
     * Normalizes text for the given target, then lowercases, trims and collapses whitespace.
     */
    public String normalize(String text, NormalizationTarget target) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = text.trim();
        for (NormalizationRule rule : rules) {
            if (target == null || rule.appliesTo(target)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                }
            }
        }

        return result.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }

    /**
     * Checks if two organization names map to the same key.
     */
    public boolean sameOrganization(String name1, String name2) {
        String key1 = organizationKey(name1);
        return !key1.isEmpty() && key1.equals(organizationKey(name2));
    }

    private static List<NormalizationRule> sorted(List<NormalizationRule> rules) {
        List<NormalizationRule> copy = new ArrayList<>(rules);
        copy.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        return List.copyOf(copy);
    }
}
