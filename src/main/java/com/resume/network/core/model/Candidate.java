package com.resume.network.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Canonical record for one resume.
 *
 * <p>Candidates are immutable. A re-parsed resume produces a new instance with the same id
 * that replaces the old one wholesale in the next pool snapshot.</p>
 */
public final class Candidate {
    private final String id;
    private final String name;
    private final String email;
    private final String location;
    private final String summary;
    private final List<Experience> experiences;
    private final SortedSet<String> skills;
    private final long totalExperienceMonths;
    private final SeniorityTier seniority;
    private final Map<String, String> unmatchedSections;

    private Candidate(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.name = builder.name != null ? builder.name : "";
        this.email = builder.email;
        this.location = builder.location;
        this.summary = builder.summary;
        this.experiences = builder.experiences != null ? List.copyOf(builder.experiences) : List.of();
        this.skills = builder.skills != null
                ? Collections.unmodifiableSortedSet(new TreeSet<>(builder.skills))
                : Collections.emptySortedSet();
        this.totalExperienceMonths = builder.totalExperienceMonths;
        this.seniority = builder.seniority != null ? builder.seniority : SeniorityTier.JUNIOR;
        this.unmatchedSections = builder.unmatchedSections != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.unmatchedSections))
                : Map.of();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    public String getLocation() {
        return location;
    }

    public String getSummary() {
        return summary;
    }

    public List<Experience> getExperiences() {
        return experiences;
    }

    public SortedSet<String> getSkills() {
        return skills;
    }

    public long getTotalExperienceMonths() {
        return totalExperienceMonths;
    }

    public double getTotalExperienceYears() {
        return totalExperienceMonths / 12.0;
    }

    public SeniorityTier getSeniority() {
        return seniority;
    }

    public Map<String, String> getUnmatchedSections() {
        return unmatchedSections;
    }

    /**
     * Canonical keys of every organization this candidate worked at.
     */
    public Set<String> organizationKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (Experience experience : experiences) {
            if (experience.hasOrganization()) {
                keys.add(experience.organizationKey());
            }
        }
        return keys;
    }

    /**
     * Normalized department labels across all experiences.
     */
    public Set<String> departmentKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (Experience experience : experiences) {
            if (experience.hasDepartment()) {
                keys.add(experience.departmentKey());
            }
        }
        return keys;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Candidate candidate = (Candidate) o;
        return Objects.equals(id, candidate.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Candidate{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", experiences=" + experiences.size() +
                ", skills=" + skills.size() +
                ", seniority=" + seniority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Candidate candidate) {
        return new Builder()
                .id(candidate.id)
                .name(candidate.name)
                .email(candidate.email)
                .location(candidate.location)
                .summary(candidate.summary)
                .experiences(candidate.experiences)
                .skills(candidate.skills)
                .totalExperienceMonths(candidate.totalExperienceMonths)
                .seniority(candidate.seniority)
                .unmatchedSections(candidate.unmatchedSections);
    }

    public static class Builder {
        private String id;
        private String name;
        private String email;
        private String location;
        private String summary;
        private List<Experience> experiences;
        private Set<String> skills;
        private long totalExperienceMonths;
        private SeniorityTier seniority;
        private Map<String, String> unmatchedSections;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder experiences(List<Experience> experiences) {
            this.experiences = experiences;
            return this;
        }

        public Builder skills(Set<String> skills) {
            this.skills = skills;
            return this;
        }

        public Builder totalExperienceMonths(long totalExperienceMonths) {
            this.totalExperienceMonths = totalExperienceMonths;
            return this;
        }

        public Builder seniority(SeniorityTier seniority) {
            this.seniority = seniority;
            return this;
        }

        public Builder unmatchedSections(Map<String, String> unmatchedSections) {
            this.unmatchedSections = unmatchedSections;
            return this;
        }

        public Candidate build() {
            if (totalExperienceMonths < 0) {
                throw new IllegalArgumentException("totalExperienceMonths must be >= 0");
            }
            return new Candidate(this);
        }
    }
}
