package com.resume.network.network;

import com.resume.network.core.model.Candidate;
import com.resume.network.core.model.ColleagueEdge;
import com.resume.network.core.model.DateInterval;
import com.resume.network.core.model.Experience;
import com.resume.network.core.model.RelationshipType;
import com.resume.network.pool.CandidatePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Computes colleague edges: two candidates are colleagues when they held roles at the same
 * canonical organization during overlapping half-open intervals.
 *
 * <p>Experiences are grouped by organization key first, so pairs are only compared within an
 * organization. Experiences without an organization key or without a parseable start date are
 * skipped. Open-ended roles run until "now" as given by the injected {@link Clock}.</p>
 *
 * <p>When {@link ColleagueEdgeOptions#includeMentions()} is set, colleagues named in a resume
 * are added as direct colleague edges by {@link MentionResolver}.</p>
 */
public class ColleagueEdgeBuilder {
    private static final Logger log = LoggerFactory.getLogger(ColleagueEdgeBuilder.class);

    private static final Comparator<LocalDate> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());

    static final Comparator<ColleagueEdge> EDGE_ORDER = Comparator
            .comparing(ColleagueEdge::candidateA)
            .thenComparing(ColleagueEdge::candidateB)
            .thenComparing(ColleagueEdge::organizationKey)
            .thenComparing(ColleagueEdge::relationshipType)
            .thenComparing(ColleagueEdgeBuilder::overlapStart, NULLS_FIRST)
            .thenComparing(ColleagueEdgeBuilder::overlapEnd, NULLS_FIRST)
            .thenComparing(edge -> edge.sharedDepartment() != null ? edge.sharedDepartment() : "");

    private final Clock clock;
    private final ColleagueEdgeOptions options;
    private final MentionResolver mentionResolver = new MentionResolver();

    public ColleagueEdgeBuilder() {
        this(Clock.systemUTC(), ColleagueEdgeOptions.defaults());
    }

    public ColleagueEdgeBuilder(Clock clock, ColleagueEdgeOptions options) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.options = Objects.requireNonNull(options, "options is required");
    }

    public List<ColleagueEdge> buildEdges(CandidatePool pool) {
        return buildEdges(pool.candidates());
    }

    /**
     * Computes all colleague edges among the given candidates, sorted deterministically and
     * free of duplicates.
     */
    public List<ColleagueEdge> buildEdges(Collection<Candidate> candidates) {
        LocalDate today = LocalDate.now(clock);
        Map<String, List<Stint>> byOrganization = groupByOrganization(candidates, today);

        Stream<List<Stint>> groups = byOrganization.size() >= options.parallelThreshold()
                ? byOrganization.values().parallelStream()
                : byOrganization.values().stream();

        Stream<ColleagueEdge> overlapEdges = groups.flatMap(group -> edgesWithin(group).stream());
        Stream<ColleagueEdge> all = options.includeMentions()
                ? Stream.concat(overlapEdges, mentionResolver.resolve(candidates, today).stream())
                : overlapEdges;

        List<ColleagueEdge> edges = all
                .distinct()
                .sorted(EDGE_ORDER)
                .collect(Collectors.toList());

        log.debug("network.edges.computed candidates={} organizations={} edges={}",
                candidates.size(), byOrganization.size(), edges.size());
        return edges;
    }

    private Map<String, List<Stint>> groupByOrganization(Collection<Candidate> candidates, LocalDate today) {
        Map<String, List<Stint>> groups = new TreeMap<>();
        for (Candidate candidate : candidates) {
            for (Experience experience : candidate.getExperiences()) {
                if (!experience.hasOrganization()) {
                    continue;
                }
                Optional<DateInterval> interval = experience.interval(today);
                if (interval.isEmpty()) {
                    continue;
                }
                groups.computeIfAbsent(experience.organizationKey(), key -> new ArrayList<>())
                        .add(new Stint(candidate.getId(), experience, interval.get()));
            }
        }
        return groups;
    }

    private List<ColleagueEdge> edgesWithin(List<Stint> group) {
        List<ColleagueEdge> edges = new ArrayList<>();
        for (int i = 0; i < group.size(); i++) {
            Stint first = group.get(i);
            for (int j = i + 1; j < group.size(); j++) {
                Stint second = group.get(j);
                if (first.candidateId().equals(second.candidateId())) {
                    continue;
                }
                toEdge(first, second).ifPresent(edges::add);
            }
        }
        return edges;
    }

    private Optional<ColleagueEdge> toEdge(Stint first, Stint second) {
        Optional<DateInterval> overlap = first.interval().overlap(second.interval());
        if (overlap.isEmpty()) {
            return Optional.empty();
        }
        if (overlap.get().months() < options.minOverlapMonths()) {
            return Optional.empty();
        }
        Experience a = first.experience();
        Experience b = second.experience();
        String sharedDepartment = a.hasDepartment() && a.departmentKey().equals(b.departmentKey())
                ? a.departmentKey()
                : null;
        if (options.requireSameDepartment() && sharedDepartment == null) {
            return Optional.empty();
        }
        RelationshipType type = a.isOpenEnded() && b.isOpenEnded()
                ? RelationshipType.CURRENT_COLLEAGUE
                : RelationshipType.FORMER_COLLEAGUE;
        String display = first.candidateId().compareTo(second.candidateId()) < 0
                ? a.organization()
                : b.organization();
        return Optional.of(new ColleagueEdge(first.candidateId(), second.candidateId(), a.organizationKey(),
                display, sharedDepartment, overlap.get(), type));
    }

    public ColleagueEdgeOptions getOptions() {
        return options;
    }

    public Clock getClock() {
        return clock;
    }

    private static LocalDate overlapStart(ColleagueEdge edge) {
        return edge.overlap() != null ? edge.overlap().start() : null;
    }

    private static LocalDate overlapEnd(ColleagueEdge edge) {
        return edge.overlap() != null ? edge.overlap().end() : null;
    }

    private record Stint(String candidateId, Experience experience, DateInterval interval) {
    }
}
