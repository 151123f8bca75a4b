package com.resume.network.query;

/**
 * How the skills of a structured query combine.
 */
public enum SkillMatchMode {
    /** Candidate must hold every requested skill. */
    ALL,
    /** Candidate must hold at least one requested skill. */
    ANY
}
