package com.resume.network.core.model;

/**
 * Seniority tiers derived from total experience and role titles.
 * Declaration order is significant: tier distance is the difference of ordinals.
 */
public enum SeniorityTier {
    JUNIOR("Junior"),
    MID("Mid-level"),
    SENIOR("Senior"),
    LEAD("Lead");

    private final String label;

    SeniorityTier(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Returns the number of tiers between this tier and the other one.
     */
    public int distanceTo(SeniorityTier other) {
        return Math.abs(ordinal() - other.ordinal());
    }

    /**
     * Returns the higher of the two tiers.
     */
    public SeniorityTier max(SeniorityTier other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }

    /**
     * Largest possible distance between two tiers.
     */
    public static int maxDistance() {
        return values().length - 1;
    }
}
