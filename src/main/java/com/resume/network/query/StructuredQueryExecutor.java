package com.resume.network.query;

import com.resume.network.core.model.Candidate;
import com.resume.network.core.model.DateInterval;
import com.resume.network.core.model.Experience;
import com.resume.network.pool.CandidatePool;
import com.resume.network.rules.DefaultNormalizationRules;
import com.resume.network.rules.NormalizationEngine;
import com.resume.network.rules.SkillSynonyms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Executes {@link StructuredQuery}s against a pool snapshot.
 *
 * <p>Organization and department filters compare canonical keys produced by the same
 * {@link NormalizationEngine} the ingestion side uses. Organization, department and date-range
 * filters are experience-scoped: one single experience must satisfy all of them.</p>
 *
 * <p>Results are ordered by matched-dimension count (desc), skill overlap (desc), then candidate
 * id (asc), so repeated calls with identical inputs return identical pages.</p>
 */
public class StructuredQueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(StructuredQueryExecutor.class);

    public static final int DEFAULT_MAX_PAGE_SIZE = 100;

    static final Comparator<QueryMatch> RANKING = Comparator
            .comparingInt(QueryMatch::matchedDimensionCount).reversed()
            .thenComparing(Comparator.comparingInt(QueryMatch::skillOverlap).reversed())
            .thenComparing(QueryMatch::candidateId);

    private final NormalizationEngine normalizationEngine;
    private final SkillSynonyms skillSynonyms;
    private final Clock clock;
    private final int maxPageSize;

    public StructuredQueryExecutor() {
        this(DefaultNormalizationRules.createDefaultEngine(), SkillSynonyms.defaults(), Clock.systemUTC(),
                DEFAULT_MAX_PAGE_SIZE);
    }

    public StructuredQueryExecutor(NormalizationEngine normalizationEngine, SkillSynonyms skillSynonyms,
                                   Clock clock, int maxPageSize) {
        if (maxPageSize < 1) {
            throw new IllegalArgumentException("maxPageSize must be >= 1");
        }
        this.normalizationEngine = Objects.requireNonNull(normalizationEngine, "normalizationEngine is required");
        this.skillSynonyms = Objects.requireNonNull(skillSynonyms, "skillSynonyms is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.maxPageSize = maxPageSize;
    }

    /**
     * Executes the query and returns one page of the ordered matches.
     *
     * @param page     zero-based page index; a page past the end is empty
     * @param pageSize requested page size, clamped to the configured maximum
     * @throws QueryValidationException if the query, page or page size is invalid
     */
    public QueryPage execute(StructuredQuery query, CandidatePool pool, int page, int pageSize) {
        QueryValidator.validatePage(page, pageSize);
        int effectivePageSize = Math.min(pageSize, maxPageSize);

        List<QueryMatch> matches = matchAll(query, pool);

        long offset = (long) page * effectivePageSize;
        List<QueryMatch> content = offset >= matches.size()
                ? List.of()
                : matches.subList((int) offset, (int) Math.min(matches.size(), offset + effectivePageSize));

        log.debug("query.executed poolVersion={} total={} page={} pageSize={} returned={}",
                pool.version(), matches.size(), page, effectivePageSize, content.size());
        return new QueryPage(content, matches.size(), page, effectivePageSize, pool.version());
    }

    /**
     * Returns every match, fully ordered.
     */
    public List<QueryMatch> matchAll(StructuredQuery query, CandidatePool pool) {
        QueryValidator.validate(query);
        Objects.requireNonNull(pool, "pool is required");
        Criteria criteria = compile(query);

        List<QueryMatch> matches = new ArrayList<>();
        for (Candidate candidate : pool.candidates()) {
            match(candidate, criteria).ifPresent(matches::add);
        }
        matches.sort(RANKING);
        return matches;
    }

    private Criteria compile(StructuredQuery query) {
        String organizationKey = query.getOrganization() != null
                ? normalizationEngine.organizationKey(query.getOrganization())
                : null;
        String departmentKey = query.getDepartment() != null
                ? normalizationEngine.departmentKey(query.getDepartment())
                : null;
        if (organizationKey != null && organizationKey.isEmpty()) {
            throw new QueryValidationException("organization", "'" + query.getOrganization() + "' has no usable name");
        }
        if (departmentKey != null && departmentKey.isEmpty()) {
            throw new QueryValidationException("department", "'" + query.getDepartment() + "' has no usable name");
        }
        Set<String> skills = skillSynonyms.canonicalizeAll(query.getSkills());
        List<String> terms = new ArrayList<>();
        for (String term : query.getFreeTextTerms()) {
            terms.add(term.trim().toLowerCase(Locale.ROOT));
        }
        return new Criteria(query, organizationKey, departmentKey, skills, terms, LocalDate.now(clock));
    }

    private Optional<QueryMatch> match(Candidate candidate, Criteria criteria) {
        StructuredQuery query = criteria.query();
        List<QueryDimension> dimensions = new ArrayList<>();

        if (query.hasExperienceFilter()) {
            if (!hasMatchingExperience(candidate, criteria)) {
                return Optional.empty();
            }
            if (criteria.organizationKey() != null) {
                dimensions.add(QueryDimension.ORGANIZATION);
            }
            if (criteria.departmentKey() != null) {
                dimensions.add(QueryDimension.DEPARTMENT);
            }
            if (query.getDateRange() != null) {
                dimensions.add(QueryDimension.DATE_RANGE);
            }
        }

        List<String> matchedSkills = new ArrayList<>();
        if (!criteria.skills().isEmpty()) {
            for (String skill : criteria.skills()) {
                if (candidate.getSkills().contains(skill)) {
                    matchedSkills.add(skill);
                }
            }
            boolean skillsMatch = query.getSkillMatchMode() == SkillMatchMode.ALL
                    ? matchedSkills.size() == criteria.skills().size()
                    : !matchedSkills.isEmpty();
            if (!skillsMatch) {
                return Optional.empty();
            }
            dimensions.add(QueryDimension.SKILLS);
        }

        if (query.getSeniority() != null) {
            if (candidate.getSeniority() != query.getSeniority()) {
                return Optional.empty();
            }
            dimensions.add(QueryDimension.SENIORITY);
        }

        if (query.getMinExperienceYears() != null) {
            if (candidate.getTotalExperienceMonths() < query.getMinExperienceYears() * 12L) {
                return Optional.empty();
            }
            dimensions.add(QueryDimension.MIN_EXPERIENCE);
        }

        if (!criteria.terms().isEmpty()) {
            String searchable = searchableText(candidate);
            int matchedTerms = 0;
            for (String term : criteria.terms()) {
                if (searchable.contains(term)) {
                    matchedTerms++;
                    dimensions.add(QueryDimension.FREE_TEXT);
                }
            }
            if (matchedTerms == 0) {
                return Optional.empty();
            }
        }

        return Optional.of(new QueryMatch(candidate, dimensions, matchedSkills));
    }

    private boolean hasMatchingExperience(Candidate candidate, Criteria criteria) {
        for (Experience experience : candidate.getExperiences()) {
            if (criteria.organizationKey() != null
                    && !criteria.organizationKey().equals(experience.organizationKey())) {
                continue;
            }
            if (criteria.departmentKey() != null && !matchesDepartment(experience, criteria.departmentKey())) {
                continue;
            }
            if (criteria.query().getDateRange() != null
                    && !intersects(experience, criteria.query().getDateRange(), criteria.today())) {
                continue;
            }
            return true;
        }
        return false;
    }

    private boolean matchesDepartment(Experience experience, String departmentKey) {
        if (departmentKey.equals(experience.departmentKey())) {
            return true;
        }
        return experience.team() != null && departmentKey.equals(normalizationEngine.departmentKey(experience.team()));
    }

    private static boolean intersects(Experience experience, DateRange range, LocalDate today) {
        Optional<DateInterval> interval = experience.interval(today);
        return interval.isPresent() && range.intersects(interval.get().start(), interval.get().end());
    }

    private static String searchableText(Candidate candidate) {
        StringBuilder text = new StringBuilder();
        text.append(candidate.getName()).append('\n');
        if (candidate.getSummary() != null) {
            text.append(candidate.getSummary()).append('\n');
        }
        candidate.getSkills().forEach(skill -> text.append(skill).append('\n'));
        for (Experience experience : candidate.getExperiences()) {
            text.append(experience.title()).append('\n')
                    .append(experience.organization()).append('\n');
            if (experience.department() != null) {
                text.append(experience.department()).append('\n');
            }
            experience.keywords().forEach(keyword -> text.append(keyword).append('\n'));
        }
        return text.toString().toLowerCase(Locale.ROOT);
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    private record Criteria(
            StructuredQuery query,
            String organizationKey,
            String departmentKey,
            Set<String> skills,
            List<String> terms,
            LocalDate today
    ) {
    }
}
