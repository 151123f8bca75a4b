package com.resume.network.core.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * One role held by a candidate.
 *
 * <p>{@code organizationKey} and {@code departmentKey} hold the canonical forms produced by the
 * normalization engine and are the only fields used for comparisons. A null {@code endDate}
 * means the role is open-ended; a null {@code startDate} means the resume date could not be
 * parsed, in which case {@code rawDates} keeps the original text.</p>
 *
 * @param organization        organization name as written on the resume
 * @param organizationKey     canonical organization key
 * @param department          department label as written
 * @param departmentKey       normalized department label
 * @param team                team or desk label, if any
 * @param title               role title
 * @param startDate           start of the role (inclusive), nullable when unparseable
 * @param endDate             end of the role (exclusive), null when open-ended
 * @param current             whether the resume marks the role as current
 * @param rawDates            original date text, kept for unparseable values
 * @param keywords            ordered skill/keyword tokens from the role description
 * @param mentionedColleagues colleague names mentioned for this role
 */
public record Experience(
        String organization,
        String organizationKey,
        String department,
        String departmentKey,
        String team,
        String title,
        LocalDate startDate,
        LocalDate endDate,
        boolean current,
        String rawDates,
        List<String> keywords,
        List<String> mentionedColleagues
) {
    public Experience {
        organization = organization != null ? organization : "";
        organizationKey = organizationKey != null ? organizationKey : "";
        departmentKey = departmentKey != null ? departmentKey : "";
        title = title != null ? title : "";
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
        mentionedColleagues = mentionedColleagues != null ? List.copyOf(mentionedColleagues) : List.of();
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new IllegalArgumentException(
                    "startDate must not be after endDate: " + startDate + " > " + endDate);
        }
    }

    public boolean hasOrganization() {
        return !organizationKey.isBlank();
    }

    public boolean hasDepartment() {
        return !departmentKey.isBlank();
    }

    public boolean isOpenEnded() {
        return endDate == null;
    }

    /**
     * Returns the half-open interval covered by this role, closing open-ended roles at
     * {@code today}. Empty when the start date is unknown or the role has not started yet.
     */
    public Optional<DateInterval> interval(LocalDate today) {
        if (startDate == null) {
            return Optional.empty();
        }
        LocalDate end = endDate != null ? endDate : today;
        if (!startDate.isBefore(end)) {
            return Optional.empty();
        }
        return Optional.of(new DateInterval(startDate, end));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String organization;
        private String organizationKey;
        private String department;
        private String departmentKey;
        private String team;
        private String title;
        private LocalDate startDate;
        private LocalDate endDate;
        private boolean current;
        private String rawDates;
        private List<String> keywords;
        private List<String> mentionedColleagues;

        public Builder organization(String organization) {
            this.organization = organization;
            return this;
        }

        public Builder organizationKey(String organizationKey) {
            this.organizationKey = organizationKey;
            return this;
        }

        public Builder department(String department) {
            this.department = department;
            return this;
        }

        public Builder departmentKey(String departmentKey) {
            this.departmentKey = departmentKey;
            return this;
        }

        public Builder team(String team) {
            this.team = team;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder current(boolean current) {
            this.current = current;
            return this;
        }

        public Builder rawDates(String rawDates) {
            this.rawDates = rawDates;
            return this;
        }

        public Builder keywords(List<String> keywords) {
            this.keywords = keywords;
            return this;
        }

        public Builder mentionedColleagues(List<String> mentionedColleagues) {
            this.mentionedColleagues = mentionedColleagues;
            return this;
        }

        public Experience build() {
            return new Experience(organization, organizationKey, department, departmentKey, team, title,
                    startDate, endDate, current, rawDates, keywords, mentionedColleagues);
        }
    }
}
