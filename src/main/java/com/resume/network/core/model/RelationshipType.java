package com.resume.network.core.model;

/**
 * Kind of colleague relationship: inferred from an overlap, or stated in a resume.
 */
public enum RelationshipType {
    /** The shared interval is still running. */
    CURRENT_COLLEAGUE,
    /** The shared interval ended in the past. */
    FORMER_COLLEAGUE,
    /** One of the two named the other as a colleague in their resume. */
    DIRECT_COLLEAGUE
}
