package com.resume.network.ingestion;

import com.resume.network.core.model.Candidate;
import com.resume.network.core.model.DateInterval;
import com.resume.network.core.model.Experience;
import com.resume.network.core.model.SeniorityTier;
import com.resume.network.ingestion.FlexibleDateParser.ParsedDate;
import com.resume.network.ingestion.FlexibleDateParser.ParsedRange;
import com.resume.network.ingestion.SectionAliases.ExperienceField;
import com.resume.network.ingestion.SectionAliases.SectionKind;
import com.resume.network.rules.DefaultNormalizationRules;
import com.resume.network.rules.NormalizationEngine;
import com.resume.network.rules.SkillSynonyms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts a {@link RawResume} into the canonical {@link Candidate} record.
 *
 * <p>All upstream shapes are treated as untyped input and validated here, once. Lesser defects
 * degrade gracefully: unknown sections are kept as opaque text, unparseable dates become null
 * dates on an experience that is still kept. Normalization fails only when the resume has
 * neither a name nor any experience with a parseable date.</p>
 */
public class ResumeNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ResumeNormalizer.class);

    private static final Pattern SKILL_SEPARATOR = Pattern.compile("\\s*(?:[,;|\\n•]|\\s/\\s)\\s*");
    private static final Pattern LINE_SEPARATOR = Pattern.compile("\\r?\\n");
    private static final Pattern ENTRY_SEPARATOR = Pattern.compile("\\s*[,|]\\s*|\\s+at\\s+|\\s+@\\s+");
    private static final Pattern DESCRIPTION_TOKEN = Pattern.compile("[\\p{L}\\p{N}+#.]+");

    private final NormalizationEngine normalizationEngine;
    private final SkillSynonyms skillSynonyms;
    private final SeniorityClassifier seniorityClassifier;
    private final FlexibleDateParser dateParser;
    private final Clock clock;

    public ResumeNormalizer() {
        this(DefaultNormalizationRules.createDefaultEngine(), SkillSynonyms.defaults(),
                new SeniorityClassifier(), Clock.systemUTC());
    }

    public ResumeNormalizer(NormalizationEngine normalizationEngine, SkillSynonyms skillSynonyms,
                            SeniorityClassifier seniorityClassifier, Clock clock) {
        this.normalizationEngine = Objects.requireNonNull(normalizationEngine, "normalizationEngine is required");
        this.skillSynonyms = Objects.requireNonNull(skillSynonyms, "skillSynonyms is required");
        this.seniorityClassifier = Objects.requireNonNull(seniorityClassifier, "seniorityClassifier is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.dateParser = new FlexibleDateParser();
    }

    /**
     * Normalizes one resume.
     *
     * @throws NormalizationException if the resume has no name and no datable experience
     */
    public Candidate normalize(RawResume raw) {
        Objects.requireNonNull(raw, "raw resume is required");
        if (raw.isEmpty()) {
            throw new NormalizationException(raw.label(), "Resume has no sections: parser output is empty");
        }

        Sections sections = new Sections();
        collectSections(raw.sections(), sections);

        Set<String> declaredSkills = skillSynonyms.canonicalizeAll(sections.rawSkills);
        List<Experience> experiences = new ArrayList<>();
        for (Map<ExperienceField, Object> entry : sections.entries) {
            toExperience(entry, declaredSkills, raw.label()).ifPresent(experiences::add);
        }

        boolean hasDatedExperience = experiences.stream().anyMatch(e -> e.startDate() != null);
        if (sections.name.isBlank() && !hasDatedExperience) {
            throw new NormalizationException(raw.label(),
                    "Resume has no name and no experience with a parseable date");
        }

        Set<String> skills = new LinkedHashSet<>(declaredSkills);
        experiences.forEach(e -> skills.addAll(e.keywords()));

        LocalDate today = LocalDate.now(clock);
        long totalMonths = totalExperienceMonths(experiences, today);
        SeniorityTier seniority = seniorityClassifier.classify(totalMonths, mostRecentTitle(experiences, today));

        Candidate candidate = Candidate.builder()
                .id(raw.id())
                .name(sections.name)
                .email(blankToNull(sections.email))
                .location(blankToNull(sections.location))
                .summary(blankToNull(sections.summary))
                .experiences(experiences)
                .skills(skills)
                .totalExperienceMonths(totalMonths)
                .seniority(seniority)
                .unmatchedSections(sections.unmatched)
                .build();

        log.debug("resume.normalized id={} experiences={} skills={} seniority={} unmatchedSections={}",
                candidate.getId(), experiences.size(), skills.size(), seniority, sections.unmatched.keySet());
        return candidate;
    }

    /**
     * Total months covered by the union of all datable experiences, so that parallel roles are
     * counted once.
     */
    static long totalExperienceMonths(List<Experience> experiences, LocalDate today) {
        List<DateInterval> intervals = new ArrayList<>();
        for (Experience experience : experiences) {
            experience.interval(today).ifPresent(intervals::add);
        }
        intervals.sort(Comparator.comparing(DateInterval::start));

        long months = 0;
        LocalDate runStart = null;
        LocalDate runEnd = null;
        for (DateInterval interval : intervals) {
            if (runEnd == null || interval.start().isAfter(runEnd)) {
                if (runEnd != null) {
                    months += ChronoUnit.MONTHS.between(runStart, runEnd);
                }
                runStart = interval.start();
                runEnd = interval.end();
            } else if (interval.end().isAfter(runEnd)) {
                runEnd = interval.end();
            }
        }
        if (runEnd != null) {
            months += ChronoUnit.MONTHS.between(runStart, runEnd);
        }
        return months;
    }

    private String mostRecentTitle(List<Experience> experiences, LocalDate today) {
        return experiences.stream()
                .filter(e -> e.startDate() != null)
                .max(Comparator.comparing((Experience e) -> e.endDate() != null ? e.endDate() : today)
                        .thenComparing(Experience::startDate))
                .or(() -> experiences.stream().findFirst())
                .map(Experience::title)
                .orElse("");
    }

    // ========== Section collection ==========

    private void collectSections(Map<?, ?> rawSections, Sections out) {
        for (Map.Entry<?, ?> section : rawSections.entrySet()) {
            String key = String.valueOf(section.getKey());
            Object value = section.getValue();
            Optional<SectionKind> kind = SectionAliases.sectionKind(key);
            if (kind.isEmpty()) {
                String opaque = text(value);
                if (!opaque.isBlank()) {
                    out.unmatched.put(key, opaque);
                }
                continue;
            }
            switch (kind.get()) {
                case NAME -> out.name = firstNonBlank(out.name, text(value));
                case EMAIL -> out.email = firstNonBlank(out.email, text(value).toLowerCase(Locale.ROOT));
                case LOCATION -> out.location = firstNonBlank(out.location, text(value));
                case SUMMARY -> out.summary = firstNonBlank(out.summary, text(value));
                case CONTACT -> {
                    if (value instanceof Map<?, ?> contact) {
                        collectSections(contact, out);
                    } else if (value != null) {
                        out.unmatched.put(key, text(value));
                    }
                }
                case EXPERIENCE -> collectExperience(value, out);
                case SKILLS -> collectSkills(value, out.rawSkills);
            }
        }
    }

    private void collectExperience(Object value, Sections out) {
        if (value instanceof Collection<?> entries) {
            for (Object entry : entries) {
                collectExperience(entry, out);
            }
        } else if (value instanceof Map<?, ?> map) {
            Map<ExperienceField, Object> fields = experienceFields(map);
            if (!fields.isEmpty()) {
                out.entries.add(fields);
            } else {
                map.values().forEach(nested -> collectExperience(nested, out));
            }
        } else if (value != null) {
            for (String line : LINE_SEPARATOR.split(value.toString())) {
                if (!line.isBlank()) {
                    out.entries.add(parseEntryLine(line));
                }
            }
        }
    }

    private Map<ExperienceField, Object> experienceFields(Map<?, ?> map) {
        Map<ExperienceField, Object> fields = new EnumMap<>(ExperienceField.class);
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            SectionAliases.experienceField(String.valueOf(entry.getKey()))
                    .ifPresent(field -> fields.putIfAbsent(field, entry.getValue()));
        }
        return fields;
    }

    /**
     * Parses a free-text line such as {@code "Senior Engineer, Acme Corp (2019 - 2021)"} or
     * {@code "Analyst at Globex | Sales | Jan 2018 - Present"}: the first non-date part is the
     * title, the second the organization, the third the department.
     */
    private Map<ExperienceField, Object> parseEntryLine(String line) {
        Map<ExperienceField, Object> fields = new EnumMap<>(ExperienceField.class);
        String prepared = line.replace('(', ',').replace(')', ',').trim();
        List<ExperienceField> order = List.of(ExperienceField.TITLE, ExperienceField.ORGANIZATION,
                ExperienceField.DEPARTMENT);
        int next = 0;
        for (String part : ENTRY_SEPARATOR.split(prepared)) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            ParsedRange range = dateParser.parseRange(trimmed);
            boolean looksLikeDate = range.start().hasDate() || range.start().openEnded();
            if (looksLikeDate && !fields.containsKey(ExperienceField.DATES)) {
                fields.put(ExperienceField.DATES, trimmed);
            } else if (next < order.size()) {
                fields.put(order.get(next++), trimmed);
            }
        }
        if (!fields.containsKey(ExperienceField.TITLE) && !fields.containsKey(ExperienceField.DATES)) {
            fields.put(ExperienceField.DESCRIPTION, line.trim());
        }
        return fields;
    }

    private void collectSkills(Object value, List<String> out) {
        if (value == null) {
            return;
        }
        if (value instanceof Collection<?> items) {
            items.forEach(item -> collectSkills(item, out));
        } else if (value instanceof Map<?, ?> map) {
            Object named = map.get("name") != null ? map.get("name") : map.get("skill");
            if (named != null) {
                collectSkills(named, out);
            } else {
                // Categorized skills: {"technical": [...], "tools": [...]}
                map.values().forEach(nested -> collectSkills(nested, out));
            }
        } else {
            for (String token : SKILL_SEPARATOR.split(value.toString())) {
                if (!token.isBlank()) {
                    out.add(token);
                }
            }
        }
    }

    // ========== Experience construction ==========

    private Optional<Experience> toExperience(Map<ExperienceField, Object> fields, Set<String> declaredSkills,
                                              String resumeLabel) {
        String organization = text(fields.get(ExperienceField.ORGANIZATION));
        String department = text(fields.get(ExperienceField.DEPARTMENT));
        String team = text(fields.get(ExperienceField.TEAM));
        String title = text(fields.get(ExperienceField.TITLE));

        ParsedDate start = ParsedDate.missing();
        ParsedDate end = ParsedDate.missing();
        String startText = text(fields.get(ExperienceField.START));
        String endText = text(fields.get(ExperienceField.END));
        if (!startText.isBlank()) {
            ParsedRange range = endText.isBlank() ? dateParser.parseRange(startText) : null;
            start = range != null ? range.start() : dateParser.parse(startText);
            end = range != null ? range.end() : dateParser.parse(endText);
        } else if (!endText.isBlank()) {
            end = dateParser.parse(endText);
        }
        String datesText = text(fields.get(ExperienceField.DATES));
        if (!datesText.isBlank()) {
            ParsedRange range = dateParser.parseRange(datesText);
            if (!start.isPresent()) {
                start = range.start();
            }
            if (!end.isPresent()) {
                end = range.end();
            }
        }

        if (organization.isBlank() && title.isBlank() && !start.isPresent() && !end.isPresent()
                && !fields.containsKey(ExperienceField.DESCRIPTION)) {
            return Optional.empty();
        }

        LocalDate startDate = start.date();
        LocalDate endDate = end.date();
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            log.warn("resume.dates.swapped resume={} organization='{}' start={} end={}",
                    resumeLabel, organization, startDate, endDate);
            LocalDate swap = startDate;
            startDate = endDate;
            endDate = swap;
        }
        if (startDate != null && endDate != null && !endDate.isAfter(startDate)
                && start.precision() != null && start.precision() == end.precision()) {
            // "2019 - 2019" names the whole year, so the exclusive end moves one unit on.
            endDate = end.precision().next(endDate);
        }
        if ((start.isPresent() && !start.recognized()) || (end.isPresent() && !end.recognized())) {
            log.debug("resume.dates.unparseable resume={} organization='{}' start='{}' end='{}'",
                    resumeLabel, organization, start.raw(), end.raw());
        }

        boolean current = isTrue(fields.get(ExperienceField.CURRENT))
                || end.openEnded()
                || (!end.isPresent() && startDate != null);

        return Optional.of(Experience.builder()
                .organization(organization)
                .organizationKey(normalizationEngine.organizationKey(organization))
                .department(blankToNull(department))
                .departmentKey(normalizationEngine.departmentKey(department))
                .team(blankToNull(team))
                .title(title)
                .startDate(startDate)
                .endDate(endDate)
                .current(current)
                .rawDates(rawDates(start, end))
                .keywords(keywords(fields, declaredSkills))
                .mentionedColleagues(names(fields.get(ExperienceField.COLLEAGUES)))
                .build());
    }

    /**
     * Explicit role skills first, then known skills mentioned in the description.
     */
    private List<String> keywords(Map<ExperienceField, Object> fields, Set<String> declaredSkills) {
        List<String> explicit = new ArrayList<>();
        collectSkills(fields.get(ExperienceField.SKILLS), explicit);
        Set<String> keywords = new LinkedHashSet<>(skillSynonyms.canonicalizeAll(explicit));

        String description = text(fields.get(ExperienceField.DESCRIPTION));
        Matcher matcher = DESCRIPTION_TOKEN.matcher(description);
        while (matcher.find()) {
            String token = matcher.group();
            String canonical = skillSynonyms.canonicalize(token);
            if (!canonical.isEmpty() && (declaredSkills.contains(canonical) || skillSynonyms.isKnown(token))) {
                keywords.add(canonical);
            }
        }
        return List.copyOf(keywords);
    }

    private static List<String> names(Object value) {
        List<String> names = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                String name = text(item);
                if (!name.isBlank()) {
                    names.add(name);
                }
            }
        } else if (value != null) {
            for (String name : value.toString().split("\\s*[,;]\\s*")) {
                if (!name.isBlank()) {
                    names.add(name.trim());
                }
            }
        }
        return names;
    }

    private static String rawDates(ParsedDate start, ParsedDate end) {
        if (!start.isPresent() && !end.isPresent()) {
            return null;
        }
        if (!end.isPresent()) {
            return start.raw();
        }
        return (start.isPresent() ? start.raw() : "") + " - " + end.raw();
    }

    private static boolean isTrue(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        String text = text(value).toLowerCase(Locale.ROOT);
        return text.equals("true") || text.equals("yes") || text.equals("y");
    }

    static String text(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Map<?, ?> map) {
            StringJoiner joiner = new StringJoiner("; ");
            map.forEach((k, v) -> {
                String nested = text(v);
                if (!nested.isBlank()) {
                    joiner.add(k + ": " + nested);
                }
            });
            return joiner.toString();
        }
        if (value instanceof Collection<?> items) {
            StringJoiner joiner = new StringJoiner(", ");
            items.forEach(item -> {
                String nested = text(item);
                if (!nested.isBlank()) {
                    joiner.add(nested);
                }
            });
            return joiner.toString();
        }
        return value.toString().trim();
    }

    private static String firstNonBlank(String current, String candidate) {
        return current != null && !current.isBlank() ? current : candidate;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * Mutable accumulator for one resume's sections.
     */
    private static final class Sections {
        private String name = "";
        private String email;
        private String location;
        private String summary;
        private final List<String> rawSkills = new ArrayList<>();
        private final List<Map<ExperienceField, Object>> entries = new ArrayList<>();
        private final Map<String, String> unmatched = new LinkedHashMap<>();
    }
}
