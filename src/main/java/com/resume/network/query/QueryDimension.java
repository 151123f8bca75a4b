package com.resume.network.query;

/**
 * Filter dimensions of a structured query, reported per match.
 */
public enum QueryDimension {
    ORGANIZATION,
    DEPARTMENT,
    DATE_RANGE,
    SKILLS,
    SENIORITY,
    MIN_EXPERIENCE,
    FREE_TEXT
}
