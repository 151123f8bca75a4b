package com.resume.network.query;

/**
 * Validates structured queries and page requests before execution.
 */
public final class QueryValidator {

    public static final int MAX_MIN_EXPERIENCE_YEARS = 80;

    private QueryValidator() {
    }

    /**
     * @throws QueryValidationException naming the first offending field
     */
    public static void validate(StructuredQuery query) {
        if (query == null) {
            throw new QueryValidationException("query", "query is required");
        }
        for (String skill : query.getSkills()) {
            if (skill == null || skill.isBlank()) {
                throw new QueryValidationException("skills", "skill tokens must not be blank");
            }
        }
        DateRange range = query.getDateRange();
        if (range != null && range.from() != null && range.to() != null && !range.from().isBefore(range.to())) {
            throw new QueryValidationException("dateRange",
                    "from must be before to, got " + range.from() + " >= " + range.to());
        }
        Integer years = query.getMinExperienceYears();
        if (years != null && (years < 0 || years > MAX_MIN_EXPERIENCE_YEARS)) {
            throw new QueryValidationException("minExperienceYears",
                    "must be between 0 and " + MAX_MIN_EXPERIENCE_YEARS + ", got " + years);
        }
        for (String term : query.getFreeTextTerms()) {
            if (term == null || term.isBlank()) {
                throw new QueryValidationException("freeTextTerms", "terms must not be blank");
            }
        }
    }

    public static void validatePage(int page, int pageSize) {
        if (page < 0) {
            throw new QueryValidationException("page", "page must be >= 0, got " + page);
        }
        if (pageSize < 1) {
            throw new QueryValidationException("pageSize", "pageSize must be >= 1, got " + pageSize);
        }
    }
}
