package com.resume.network.query;

import com.resume.network.core.model.SeniorityTier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Filters for candidate search. All present filters are AND-combined; skills
 * combine according to {@link SkillMatchMode}. Free-text terms are a relevance fallback: a
 * candidate must match at least one of them, and every matched term counts as a matched
 * dimension.
 *
 * <p>Built the same way whether it comes from a structured request or from the
 * natural-language translator.</p>
 */
public final class StructuredQuery {

    private final String organization;
    private final String department;
    private final Set<String> skills;
    private final SkillMatchMode skillMatchMode;
    private final DateRange dateRange;
    private final SeniorityTier seniority;
    private final Integer minExperienceYears;
    private final List<String> freeTextTerms;

    private StructuredQuery(Builder builder) {
        this.organization = blankToNull(builder.organization);
        this.department = blankToNull(builder.department);
        this.skills = Collections.unmodifiableSet(new LinkedHashSet<>(builder.skills));
        this.skillMatchMode = builder.skillMatchMode != null ? builder.skillMatchMode : SkillMatchMode.ALL;
        this.dateRange = builder.dateRange != null && !builder.dateRange.isUnbounded() ? builder.dateRange : null;
        this.seniority = builder.seniority;
        this.minExperienceYears = builder.minExperienceYears;
        this.freeTextTerms = List.copyOf(builder.freeTextTerms);
    }

    public String getOrganization() {
        return organization;
    }

    public String getDepartment() {
        return department;
    }

    public Set<String> getSkills() {
        return skills;
    }

    public SkillMatchMode getSkillMatchMode() {
        return skillMatchMode;
    }

    public DateRange getDateRange() {
        return dateRange;
    }

    public SeniorityTier getSeniority() {
        return seniority;
    }

    public Integer getMinExperienceYears() {
        return minExperienceYears;
    }

    public List<String> getFreeTextTerms() {
        return freeTextTerms;
    }

    public boolean hasExperienceFilter() {
        return organization != null || department != null || dateRange != null;
    }

    /**
     * Whether the query carries no filter at all and therefore matches every candidate.
     */
    public boolean isEmpty() {
        return !hasExperienceFilter() && skills.isEmpty() && seniority == null
                && minExperienceYears == null && freeTextTerms.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StructuredQuery that = (StructuredQuery) o;
        return Objects.equals(organization, that.organization)
                && Objects.equals(department, that.department)
                && skills.equals(that.skills)
                && skillMatchMode == that.skillMatchMode
                && Objects.equals(dateRange, that.dateRange)
                && seniority == that.seniority
                && Objects.equals(minExperienceYears, that.minExperienceYears)
                && freeTextTerms.equals(that.freeTextTerms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(organization, department, skills, skillMatchMode, dateRange, seniority,
                minExperienceYears, freeTextTerms);
    }

    @Override
    public String toString() {
        return "StructuredQuery{" +
                "organization='" + organization + '\'' +
                ", department='" + department + '\'' +
                ", skills=" + skills +
                ", skillMatchMode=" + skillMatchMode +
                ", dateRange=" + dateRange +
                ", seniority=" + seniority +
                ", minExperienceYears=" + minExperienceYears +
                ", freeTextTerms=" + freeTextTerms +
                '}';
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(StructuredQuery query) {
        return new Builder()
                .organization(query.organization)
                .department(query.department)
                .skills(query.skills)
                .skillMatchMode(query.skillMatchMode)
                .dateRange(query.dateRange)
                .seniority(query.seniority)
                .minExperienceYears(query.minExperienceYears)
                .freeTextTerms(query.freeTextTerms);
    }

    public static class Builder {
        private String organization;
        private String department;
        private final List<String> skills = new ArrayList<>();
        private SkillMatchMode skillMatchMode;
        private DateRange dateRange;
        private SeniorityTier seniority;
        private Integer minExperienceYears;
        private final List<String> freeTextTerms = new ArrayList<>();

        public Builder organization(String organization) {
            this.organization = organization;
            return this;
        }

        public Builder department(String department) {
            this.department = department;
            return this;
        }

        public Builder skill(String skill) {
            this.skills.add(skill);
            return this;
        }

        public Builder skills(Collection<String> skills) {
            this.skills.clear();
            if (skills != null) {
                this.skills.addAll(skills);
            }
            return this;
        }

        public Builder skillMatchMode(SkillMatchMode skillMatchMode) {
            this.skillMatchMode = skillMatchMode;
            return this;
        }

        public Builder dateRange(DateRange dateRange) {
            this.dateRange = dateRange;
            return this;
        }

        public Builder seniority(SeniorityTier seniority) {
            this.seniority = seniority;
            return this;
        }

        public Builder minExperienceYears(Integer minExperienceYears) {
            this.minExperienceYears = minExperienceYears;
            return this;
        }

        public Builder freeTextTerm(String term) {
            this.freeTextTerms.add(term);
            return this;
        }

        public Builder freeTextTerms(Collection<String> terms) {
            this.freeTextTerms.clear();
            if (terms != null) {
                this.freeTextTerms.addAll(terms);
            }
            return this;
        }

        public StructuredQuery build() {
            return new StructuredQuery(this);
        }
    }
}
