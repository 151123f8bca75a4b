package com.resume.network.ingestion;

import com.resume.network.core.model.SeniorityTier;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Derives a seniority tier from total experience, raised by keywords in the most recent title.
 * Title keywords can only raise the tier: a "Lead Engineer" with one year of experience is
 * {@code LEAD}, but a "Junior Analyst" with twelve years stays at the duration tier.
 */
public class SeniorityClassifier {

    private static final Pattern LEAD_TITLE = Pattern.compile(
            "\\b(lead|principal|head|director|manager|vp|vice president|chief|cto|ceo|cfo|coo|architect)\\b");
    private static final Pattern SENIOR_TITLE = Pattern.compile("\\b(senior|sr|staff)\\b");

    private final SeniorityThresholds thresholds;

    public SeniorityClassifier() {
        this(SeniorityThresholds.defaults());
    }

    public SeniorityClassifier(SeniorityThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds is required");
    }

    public SeniorityTier classify(long totalMonths, String mostRecentTitle) {
        return byDuration(totalMonths).max(byTitle(mostRecentTitle));
    }

    public SeniorityTier byDuration(long totalMonths) {
        if (totalMonths >= thresholds.leadFromMonths()) {
            return SeniorityTier.LEAD;
        }
        if (totalMonths >= thresholds.seniorFromMonths()) {
            return SeniorityTier.SENIOR;
        }
        if (totalMonths >= thresholds.midFromMonths()) {
            return SeniorityTier.MID;
        }
        return SeniorityTier.JUNIOR;
    }

    public SeniorityTier byTitle(String title) {
        if (title == null || title.isBlank()) {
            return SeniorityTier.JUNIOR;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        if (LEAD_TITLE.matcher(lower).find()) {
            return SeniorityTier.LEAD;
        }
        if (SENIOR_TITLE.matcher(lower).find()) {
            return SeniorityTier.SENIOR;
        }
        return SeniorityTier.JUNIOR;
    }

    public SeniorityThresholds getThresholds() {
        return thresholds;
    }
}
