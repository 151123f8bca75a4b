package com.resume.network.llm;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Request sent to a {@link QueryOracle}.
 *
 * @param text                 the free-form search request
 * @param knownOrganizations   organization names present in the pool, as hints
 * @param knownSkills          skill tokens present in the pool, as hints
 * @param today                reference date for relative expressions such as "last year"
 */
public record OracleRequest(
        String text,
        List<String> knownOrganizations,
        List<String> knownSkills,
        LocalDate today
) {
    public OracleRequest {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(today, "today is required");
        knownOrganizations = knownOrganizations != null ? List.copyOf(knownOrganizations) : List.of();
        knownSkills = knownSkills != null ? List.copyOf(knownSkills) : List.of();
    }
}
