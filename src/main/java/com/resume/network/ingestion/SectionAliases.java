package com.resume.network.ingestion;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fuzzy matching of resume section keys and experience entry keys.
 * Keys are compared case-, whitespace- and punctuation-insensitively ("Work History",
 * "work_history" and "WORK-HISTORY" are the same key), then looked up in a small alias table,
 * then matched on a few stem words.
 */
public final class SectionAliases {

    /**
     * Structured resume sections.
     */
    public enum SectionKind {
        NAME, EMAIL, LOCATION, SUMMARY, CONTACT, EXPERIENCE, SKILLS
    }

    /**
     * Fields of a single experience entry.
     */
    public enum ExperienceField {
        ORGANIZATION, DEPARTMENT, TEAM, TITLE, START, END, DATES, CURRENT, DESCRIPTION, SKILLS, COLLEAGUES
    }

    private static final Map<String, SectionKind> SECTION_ALIASES = new HashMap<>();
    private static final Map<String, ExperienceField> FIELD_ALIASES = new HashMap<>();

    static {
        section(SectionKind.NAME, "name", "fullname", "candidate", "candidatename", "applicant");
        section(SectionKind.EMAIL, "email", "emailaddress", "mail");
        section(SectionKind.LOCATION, "location", "address", "city");
        section(SectionKind.SUMMARY, "summary", "profile", "objective", "about", "professionalsummary");
        section(SectionKind.CONTACT, "contact", "contactinfo", "contactinformation", "personalinfo",
                "personalinformation", "personaldetails");
        section(SectionKind.EXPERIENCE, "experience", "workexperience", "workhistory", "employment",
                "employmenthistory", "professionalexperience", "career", "careerhistory", "positions",
                "jobs", "workexperiences");
        section(SectionKind.SKILLS, "skills", "technicalskills", "competencies", "corecompetencies",
                "expertise", "technologies", "keywords", "skillset", "tools");

        field(ExperienceField.ORGANIZATION, "company", "employer", "organization", "organisation",
                "firm", "companyname", "org");
        field(ExperienceField.DEPARTMENT, "department", "dept", "division", "unit", "businessunit");
        field(ExperienceField.TEAM, "team", "desk", "group", "squad");
        field(ExperienceField.TITLE, "title", "position", "role", "jobtitle", "designation");
        field(ExperienceField.START, "start", "startdate", "from", "since", "began");
        field(ExperienceField.END, "end", "enddate", "to", "until", "finished");
        field(ExperienceField.DATES, "dates", "period", "duration", "tenure", "daterange", "when");
        field(ExperienceField.CURRENT, "iscurrent", "current", "currentrole");
        field(ExperienceField.DESCRIPTION, "description", "summary", "responsibilities", "details",
                "achievements", "duties");
        field(ExperienceField.SKILLS, "skills", "technologies", "keywords", "tools", "stack", "techstack");
        field(ExperienceField.COLLEAGUES, "colleagues", "teammates", "coworkers", "references");
    }

    private SectionAliases() {
        // Utility class
    }

    public static Optional<SectionKind> sectionKind(String rawKey) {
        String key = canonicalKey(rawKey);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        SectionKind exact = SECTION_ALIASES.get(key);
        if (exact != null) {
            return Optional.of(exact);
        }
        if (key.contains("experience") || key.contains("employment") || key.contains("workhistory")) {
            return Optional.of(SectionKind.EXPERIENCE);
        }
        if (key.contains("skill") || key.contains("competenc")) {
            return Optional.of(SectionKind.SKILLS);
        }
        return Optional.empty();
    }

    public static Optional<ExperienceField> experienceField(String rawKey) {
        return Optional.ofNullable(FIELD_ALIASES.get(canonicalKey(rawKey)));
    }

    /**
     * Lower-cases and removes everything but letters and digits.
     */
    static String canonicalKey(String rawKey) {
        if (rawKey == null) {
            return "";
        }
        return rawKey.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]", "");
    }

    private static void section(SectionKind kind, String... aliases) {
        for (String alias : aliases) {
            SECTION_ALIASES.put(alias, kind);
        }
    }

    private static void field(ExperienceField field, String... aliases) {
        for (String alias : aliases) {
            FIELD_ALIASES.put(alias, field);
        }
    }
}
