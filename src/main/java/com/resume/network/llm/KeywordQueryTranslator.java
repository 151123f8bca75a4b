package com.resume.network.llm;

import com.resume.network.core.model.SeniorityTier;
import com.resume.network.query.DateRange;
import com.resume.network.query.SkillMatchMode;
import com.resume.network.query.QueryValidator;
import com.resume.network.query.StructuredQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic translation of a free-form request into a {@link StructuredQuery} by matching
 * its words against a {@link QueryVocabulary}.
 *
 * <p>Matching order: year phrases and experience-length phrases, then organizations,
 * departments and skills (longest phrase first, up to four words), then seniority words and
 * role-title words. When none of these match, the remaining significant words become
 * free-text terms.</p>
 */
public class KeywordQueryTranslator {
    private static final Logger log = LoggerFactory.getLogger(KeywordQueryTranslator.class);

    private static final int MAX_PHRASE_WORDS = 4;

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}+#.\\-]*");
    private static final Pattern BETWEEN_YEARS = Pattern.compile(
            "\\b(?:between|from)\\s+(\\d{4})\\s*(?:and|to|-|–)\\s*(\\d{4})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SINCE_YEAR = Pattern.compile(
            "\\b(since|from|after)\\s+(\\d{4})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BEFORE_YEAR = Pattern.compile(
            "\\b(?:before|until|till|prior\\s+to)\\s+(\\d{4})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern IN_YEAR = Pattern.compile(
            "\\b(?:in|during)\\s+(\\d{4})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEARS_OF_EXPERIENCE = Pattern.compile(
            "\\b(?:at\\s+least\\s+|over\\s+|more\\s+than\\s+)?(\\d{1,2})\\s*\\+?\\s*(?:years?|yrs?)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, SeniorityTier> SENIORITY_WORDS = Map.ofEntries(
            Map.entry("junior", SeniorityTier.JUNIOR),
            Map.entry("jr", SeniorityTier.JUNIOR),
            Map.entry("entry", SeniorityTier.JUNIOR),
            Map.entry("graduate", SeniorityTier.JUNIOR),
            Map.entry("mid", SeniorityTier.MID),
            Map.entry("mid-level", SeniorityTier.MID),
            Map.entry("intermediate", SeniorityTier.MID),
            Map.entry("senior", SeniorityTier.SENIOR),
            Map.entry("sr", SeniorityTier.SENIOR),
            Map.entry("lead", SeniorityTier.LEAD),
            Map.entry("leads", SeniorityTier.LEAD),
            Map.entry("principal", SeniorityTier.LEAD));

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "of", "for", "in", "at", "to", "on", "with", "by", "from", "as",
            "find", "search", "show", "list", "get", "give", "me", "us", "i", "we", "need", "want", "looking",
            "who", "whom", "that", "which", "has", "have", "had", "worked", "work", "works", "working",
            "people", "person", "candidates", "candidate", "someone", "anyone", "all", "any", "some",
            "know", "knows", "knowing", "skilled", "experienced", "experience", "background", "good",
            "strong", "please", "are", "is", "was", "were", "be", "been", "there", "their", "them",
            "like", "similar", "years", "year", "time", "same", "company", "companies", "either", "both");

    private static final Set<String> ANY_MARKERS = Set.of("or", "any", "either");

    /**
     * Translates a request using the vocabulary of one pool snapshot.
     */
    public StructuredQuery translate(String text, QueryVocabulary vocabulary) {
        StructuredQuery.Builder builder = StructuredQuery.builder();
        StringBuilder remaining = new StringBuilder(text);
        boolean matchedDates = extractDates(remaining, builder);
        boolean matchedYears = extractYearsOfExperience(remaining, builder);
        boolean matchedAnything = matchedDates || matchedYears;

        List<String> words = new ArrayList<>();
        Matcher matcher = WORD.matcher(remaining);
        while (matcher.find()) {
            words.add(matcher.group().replaceAll("[.\\-]+$", ""));
        }
        boolean[] consumed = new boolean[words.size()];

        String organization = matchPhrase(words, consumed, phrase -> vocabulary.organizationKey(phrase) != null);
        if (organization != null) {
            builder.organization(organization);
            matchedAnything = true;
        }
        String department = matchPhrase(words, consumed, phrase -> vocabulary.departmentKey(phrase) != null);
        if (department != null) {
            builder.department(department);
            matchedAnything = true;
        }

        Set<String> skills = new LinkedHashSet<>();
        String skillPhrase;
        while ((skillPhrase = matchPhrase(words, consumed, phrase -> vocabulary.skill(phrase) != null)) != null) {
            skills.add(vocabulary.skill(skillPhrase));
        }
        if (!skills.isEmpty()) {
            builder.skills(new ArrayList<>(skills));
            matchedAnything = true;
        }

        Set<String> terms = new LinkedHashSet<>();
        boolean anyMarker = false;
        for (int i = 0; i < words.size(); i++) {
            if (consumed[i]) {
                continue;
            }
            String lower = words.get(i).toLowerCase(Locale.ROOT);
            if (ANY_MARKERS.contains(lower)) {
                anyMarker = true;
            }
            SeniorityTier tier = SENIORITY_WORDS.get(lower);
            if (tier != null) {
                builder.seniority(tier);
                consumed[i] = true;
                matchedAnything = true;
                continue;
            }
            String titleWord = STOP_WORDS.contains(lower) ? null : vocabulary.titleWord(lower);
            if (titleWord != null) {
                terms.add(titleWord);
                consumed[i] = true;
                matchedAnything = true;
            }
        }
        if (anyMarker && skills.size() > 1) {
            builder.skillMatchMode(SkillMatchMode.ANY);
        }

        if (!matchedAnything) {
            for (int i = 0; i < words.size(); i++) {
                String lower = words.get(i).toLowerCase(Locale.ROOT);
                if (!consumed[i] && lower.length() > 2 && !STOP_WORDS.contains(lower)) {
                    terms.add(QueryVocabulary.fold(lower));
                }
            }
        }
        builder.freeTextTerms(new ArrayList<>(terms));

        StructuredQuery query = builder.build();
        log.debug("keyword.translated text='{}' query={}", text, query);
        return query;
    }

    /**
     * Finds the longest unconsumed phrase accepted by {@code known}, marks its words consumed
     * and returns it as written. Single stop words never match.
     */
    private static String matchPhrase(List<String> words, boolean[] consumed, PhrasePredicate known) {
        for (int length = Math.min(MAX_PHRASE_WORDS, words.size()); length >= 1; length--) {
            for (int start = 0; start + length <= words.size(); start++) {
                if (anyConsumed(consumed, start, length)) {
                    continue;
                }
                if (length == 1 && STOP_WORDS.contains(words.get(start).toLowerCase(Locale.ROOT))) {
                    continue;
                }
                String phrase = String.join(" ", words.subList(start, start + length));
                if (known.test(phrase)) {
                    for (int i = start; i < start + length; i++) {
                        consumed[i] = true;
                    }
                    return phrase;
                }
            }
        }
        return null;
    }

    private static boolean anyConsumed(boolean[] consumed, int start, int length) {
        for (int i = start; i < start + length; i++) {
            if (consumed[i]) {
                return true;
            }
        }
        return false;
    }

    private static boolean extractDates(StringBuilder text, StructuredQuery.Builder builder) {
        Matcher between = BETWEEN_YEARS.matcher(text);
        if (between.find()) {
            Integer from = year(between.group(1));
            Integer to = year(between.group(2));
            if (from != null && to != null && from <= to) {
                builder.dateRange(DateRange.between(LocalDate.of(from, 1, 1), LocalDate.of(to + 1, 1, 1)));
                blank(text, between.start(), between.end());
                return true;
            }
        }
        Matcher since = SINCE_YEAR.matcher(text);
        if (since.find()) {
            Integer from = year(since.group(2));
            if (from != null) {
                int startYear = since.group(1).equalsIgnoreCase("after") ? from + 1 : from;
                builder.dateRange(DateRange.since(LocalDate.of(startYear, 1, 1)));
                blank(text, since.start(), since.end());
                return true;
            }
        }
        Matcher before = BEFORE_YEAR.matcher(text);
        if (before.find()) {
            Integer to = year(before.group(1));
            if (to != null) {
                builder.dateRange(DateRange.until(LocalDate.of(to, 1, 1)));
                blank(text, before.start(), before.end());
                return true;
            }
        }
        Matcher in = IN_YEAR.matcher(text);
        if (in.find()) {
            Integer year = year(in.group(1));
            if (year != null) {
                builder.dateRange(DateRange.year(year));
                blank(text, in.start(), in.end());
                return true;
            }
        }
        return false;
    }

    private static boolean extractYearsOfExperience(StringBuilder text, StructuredQuery.Builder builder) {
        Matcher matcher = YEARS_OF_EXPERIENCE.matcher(text);
        if (matcher.find()) {
            int years = Integer.parseInt(matcher.group(1));
            if (years <= QueryValidator.MAX_MIN_EXPERIENCE_YEARS) {
                builder.minExperienceYears(years);
            } else {
                log.debug("keyword.years.ignored years={}", years);
            }
            blank(text, matcher.start(), matcher.end());
            return true;
        }
        return false;
    }

    private static Integer year(String digits) {
        int year = Integer.parseInt(digits);
        return year >= 1900 && year <= 2100 ? year : null;
    }

    private static void blank(StringBuilder text, int start, int end) {
        for (int i = start; i < end; i++) {
            text.setCharAt(i, ' ');
        }
    }

    @FunctionalInterface
    private interface PhrasePredicate {
        boolean test(String phrase);
    }
}
