package com.resume.network.similarity;

import com.resume.network.core.model.Candidate;
import com.resume.network.core.model.Experience;
import com.resume.network.core.model.SeniorityTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Composite candidate scorer that combines four features with configurable weights.
 * Formula: score = w1*skills + w2*organization + w3*seniority + w4*title
 */
public class CandidateSimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(CandidateSimilarityScorer.class);

    static final long SIMILAR_EXPERIENCE_MONTHS = 24;

    private final JaccardSimilarity jaccard;
    private final SimilarityWeights weights;

    public CandidateSimilarityScorer() {
        this(SimilarityWeights.defaultWeights());
    }

    public CandidateSimilarityScorer(SimilarityWeights weights) {
        this.jaccard = new JaccardSimilarity();
        this.weights = weights;
    }

    public double score(Candidate reference, Candidate other) {
        return computeWithBreakdown(reference, other).compositeScore();
    }

    /**
     * Computes the detailed similarity breakdown of {@code other} relative to {@code reference}.
     */
    public SimilarityBreakdown computeWithBreakdown(Candidate reference, Candidate other) {
        Set<String> sharedSkills = new TreeSet<>(reference.getSkills());
        sharedSkills.retainAll(other.getSkills());
        double skillScore = JaccardSimilarity.compute(reference.getSkills(), other.getSkills());

        List<String> sharedOrganizations = sharedOrganizations(reference, other);
        double organizationScore = sharedOrganizations.isEmpty() ? 0.0 : 1.0;

        double seniorityScore = seniorityProximity(reference.getSeniority(), other.getSeniority());
        double titleScore = jaccard.computeTokens(titles(reference), titles(other));

        Set<String> sharedDepartments = new TreeSet<>(reference.departmentKeys());
        sharedDepartments.retainAll(other.departmentKeys());

        boolean similarExperience = Math.abs(reference.getTotalExperienceMonths()
                - other.getTotalExperienceMonths()) <= SIMILAR_EXPERIENCE_MONTHS;

        double compositeScore = weights.skillWeight() * skillScore
                + weights.organizationWeight() * organizationScore
                + weights.seniorityWeight() * seniorityScore
                + weights.titleWeight() * titleScore;
        compositeScore = Math.max(0.0, Math.min(1.0, compositeScore));

        log.trace("similarity.scored reference={} other={} skills={} organization={} seniority={} title={} composite={}",
                reference.getId(), other.getId(), skillScore, organizationScore, seniorityScore, titleScore,
                compositeScore);

        return new SimilarityBreakdown(skillScore, organizationScore, seniorityScore, titleScore, compositeScore,
                new ArrayList<>(sharedSkills), sharedOrganizations, new ArrayList<>(sharedDepartments),
                similarExperience, weights);
    }

    /**
     * 1.0 for equal tiers, decaying linearly to 0.0 at the largest tier distance.
     */
    static double seniorityProximity(SeniorityTier first, SeniorityTier second) {
        return 1.0 - (double) first.distanceTo(second) / SeniorityTier.maxDistance();
    }

    private static List<String> sharedOrganizations(Candidate reference, Candidate other) {
        Set<String> otherKeys = other.organizationKeys();
        Map<String, String> shared = new LinkedHashMap<>();
        for (Experience experience : reference.getExperiences()) {
            if (experience.hasOrganization() && otherKeys.contains(experience.organizationKey())) {
                shared.putIfAbsent(experience.organizationKey(), experience.organization());
            }
        }
        return new ArrayList<>(shared.values());
    }

    private static List<String> titles(Candidate candidate) {
        List<String> titles = new ArrayList<>();
        for (Experience experience : candidate.getExperiences()) {
            titles.add(experience.title());
        }
        return titles;
    }

    public SimilarityWeights getWeights() {
        return weights;
    }

    /**
     * Creates a new scorer with updated weights.
     */
    public CandidateSimilarityScorer withWeights(SimilarityWeights newWeights) {
        return new CandidateSimilarityScorer(newWeights);
    }
}
