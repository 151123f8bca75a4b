package com.resume.network.rules;

/**
 * Kinds of resume text a normalization rule can be scoped to.
 */
public enum NormalizationTarget {
    ORGANIZATION,
    DEPARTMENT,
    TITLE
}
