package com.resume.network.query;

import com.resume.network.core.model.Candidate;
import com.resume.network.core.model.Experience;
import com.resume.network.core.model.SeniorityTier;
import com.resume.network.fixture.TestCandidates;
import com.resume.network.pool.CandidatePool;
import com.resume.network.rules.DefaultNormalizationRules;
import com.resume.network.rules.SkillSynonyms;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.resume.network.fixture.TestCandidates.role;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StructuredQueryExecutor Tests")
class StructuredQueryExecutorTest {

    private final StructuredQueryExecutor executor = new StructuredQueryExecutor(
            DefaultNormalizationRules.createDefaultEngine(), SkillSynonyms.defaults(), TestCandidates.CLOCK, 100);

    private static List<String> ids(QueryPage page) {
        return page.matches().stream().map(QueryMatch::candidateId).toList();
    }

    @Nested
    @DisplayName("Filters")
    class Filters {

        @Test
        @DisplayName("Should match organization through its canonical key")
        void testOrganizationFilter() {
            StructuredQuery query = StructuredQuery.builder().organization("Acme Corp").build();

            QueryPage page = executor.execute(query, TestCandidates.abcPool(), 0, 10);

            assertEquals(List.of("a", "b"), ids(page));
            assertEquals(List.of(QueryDimension.ORGANIZATION), page.matches().get(0).matchedDimensions());
            assertEquals(1, page.snapshotVersion());
        }

        @Test
        @DisplayName("Should require organization and department on the same experience")
        void testSameExperienceSemantics() {
            Candidate mover = TestCandidates.candidate("m", SeniorityTier.MID, Set.of(),
                    role("Acme", "Sales", "Account Executive", "2015-01-01", "2016-01-01"),
                    role("Globex", "Engineering", "Engineer", "2019-01-01", "2020-01-01"));
            CandidatePool pool = TestCandidates.pool(mover);

            StructuredQuery split = StructuredQuery.builder().organization("Acme").department("Engineering").build();
            StructuredQuery together = StructuredQuery.builder().organization("Acme").department("Sales Dept").build();

            assertEquals(0, executor.execute(split, pool, 0, 10).totalMatches());
            assertEquals(List.of("m"), ids(executor.execute(together, pool, 0, 10)));
        }

        @Test
        @DisplayName("Should match department against the team label")
        void testDepartmentMatchesTeam() {
            Experience withTeam = Experience.builder()
                    .organization("Acme").organizationKey("acme")
                    .department("Engineering").departmentKey("engineering")
                    .team("Payments Team")
                    .title("Engineer")
                    .build();
            CandidatePool pool = TestCandidates.pool(
                    TestCandidates.candidate("t", SeniorityTier.MID, Set.of(), withTeam));

            QueryPage page = executor.execute(StructuredQuery.builder().department("Payments").build(), pool, 0, 10);

            assertEquals(List.of("t"), ids(page));
        }

        @Test
        @DisplayName("Should treat date ranges as half-open")
        void testDateRangeHalfOpen() {
            StructuredQuery query = StructuredQuery.builder()
                    .organization("Acme")
                    .dateRange(DateRange.year(2021))
                    .build();

            QueryPage page = executor.execute(query, TestCandidates.abcPool(), 0, 10);

            // a ends on 2021-01-01, exclusive
            assertEquals(List.of("b"), ids(page));
            assertEquals(List.of(QueryDimension.ORGANIZATION, QueryDimension.DATE_RANGE),
                    page.matches().get(0).matchedDimensions());
        }

        @Test
        @DisplayName("Should resolve open-ended roles against the clock")
        void testOpenEndedRole() {
            StructuredQuery query = StructuredQuery.builder().dateRange(DateRange.since(TestCandidates.TODAY.minusDays(10)))
                    .build();

            QueryPage page = executor.execute(query, TestCandidates.chainPool(), 0, 10);

            assertEquals(List.of("b", "d"), ids(page));
        }

        @Test
        @DisplayName("Should require every skill in ALL mode")
        void testAllSkills() {
            StructuredQuery query = StructuredQuery.builder().skill("python").skill("sql").build();

            assertEquals(List.of("a"), ids(executor.execute(query, TestCandidates.abcPool(), 0, 10)));
        }

        @Test
        @DisplayName("Should rank ANY-mode matches by skill overlap")
        void testAnySkills() {
            StructuredQuery query = StructuredQuery.builder()
                    .skills(List.of("golang", "sql", "python"))
                    .skillMatchMode(SkillMatchMode.ANY)
                    .build();

            QueryPage page = executor.execute(query, TestCandidates.abcPool(), 0, 10);

            assertEquals(List.of("a", "b"), ids(page));
            assertEquals(2, page.matches().get(0).skillOverlap());
            assertEquals(2, page.matches().get(1).skillOverlap());
        }

        @Test
        @DisplayName("Should canonicalize skill synonyms")
        void testSkillSynonyms() {
            StructuredQuery query = StructuredQuery.builder().skill("Excel").build();

            QueryPage page = executor.execute(query, TestCandidates.abcPool(), 0, 10);

            assertEquals(List.of("c"), ids(page));
            assertEquals(List.of("microsoft excel"), page.matches().get(0).matchedSkills());
        }

        @Test
        @DisplayName("Should filter on exact seniority tier")
        void testSeniority() {
            StructuredQuery query = StructuredQuery.builder().seniority(SeniorityTier.SENIOR).build();

            assertEquals(List.of("d"), ids(executor.execute(query, TestCandidates.chainPool(), 0, 10)));
        }

        @Test
        @DisplayName("Should compare minimum experience in months")
        void testMinExperience() {
            CandidatePool pool = TestCandidates.abcPool();

            assertEquals(3, executor.execute(StructuredQuery.builder().minExperienceYears(3).build(), pool, 0, 10)
                    .totalMatches());
            assertEquals(0, executor.execute(StructuredQuery.builder().minExperienceYears(4).build(), pool, 0, 10)
                    .totalMatches());
        }

        @Test
        @DisplayName("Should count one dimension per matched free-text term")
        void testFreeTextRanking() {
            StructuredQuery query = StructuredQuery.builder().freeTextTerm("python").freeTextTerm("GOLANG").build();

            QueryPage page = executor.execute(query, TestCandidates.abcPool(), 0, 10);

            assertEquals(List.of("b", "a"), ids(page));
            assertEquals(2, page.matches().get(0).matchedDimensionCount());
            assertEquals(1, page.matches().get(1).matchedDimensionCount());
        }

        @Test
        @DisplayName("Should return every candidate for an empty query")
        void testEmptyQuery() {
            StructuredQuery query = StructuredQuery.builder().build();

            assertTrue(query.isEmpty());
            assertEquals(List.of("a", "b", "c"), ids(executor.execute(query, TestCandidates.abcPool(), 0, 10)));
        }
    }

    @Nested
    @DisplayName("Pagination")
    class Pagination {

        private CandidatePool largePool() {
            List<Candidate> candidates = new ArrayList<>();
            for (int i = 0; i < 25; i++) {
                candidates.add(TestCandidates.candidate(String.format("c%02d", i), SeniorityTier.MID,
                        Set.of("java"), role("Acme", "Engineering", "Engineer", "2019-01-01", "2020-01-01")));
            }
            return CandidatePool.of(7, candidates);
        }

        @Test
        @DisplayName("Should cover every match exactly once across pages")
        void testPagesAreComplete() {
            CandidatePool pool = largePool();
            StructuredQuery query = StructuredQuery.builder().organization("Acme").build();

            Set<String> seen = new HashSet<>();
            int collected = 0;
            for (int page = 0; page < 3; page++) {
                QueryPage result = executor.execute(query, pool, page, 10);
                assertEquals(25, result.totalMatches());
                assertEquals(3, result.totalPages());
                seen.addAll(ids(result));
                collected += result.numberOfMatches();
            }

            assertEquals(25, collected);
            assertEquals(25, seen.size());
        }

        @Test
        @DisplayName("Should return the last partial page and an empty page past the end")
        void testPageBoundaries() {
            CandidatePool pool = largePool();
            StructuredQuery query = StructuredQuery.builder().build();

            QueryPage last = executor.execute(query, pool, 2, 10);
            QueryPage beyond = executor.execute(query, pool, 9, 10);

            assertEquals(5, last.numberOfMatches());
            assertFalse(last.hasNext());
            assertTrue(last.hasPrevious());
            assertFalse(beyond.hasContent());
            assertEquals(25, beyond.totalMatches());
            assertEquals(7, beyond.snapshotVersion());
        }

        @Test
        @DisplayName("Should return identical pages for identical calls")
        void testIdempotent() {
            CandidatePool pool = largePool();
            StructuredQuery query = StructuredQuery.builder().skill("java").build();

            assertEquals(executor.execute(query, pool, 1, 10), executor.execute(query, pool, 1, 10));
        }

        @Test
        @DisplayName("Should clamp the page size to the configured maximum")
        void testClampPageSize() {
            StructuredQueryExecutor small = new StructuredQueryExecutor(
                    DefaultNormalizationRules.createDefaultEngine(), SkillSynonyms.defaults(), TestCandidates.CLOCK, 5);

            QueryPage page = small.execute(StructuredQuery.builder().build(), largePool(), 0, 500);

            assertEquals(5, page.pageSize());
            assertEquals(5, page.numberOfMatches());
            assertTrue(page.hasNext());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should reject a negative page")
        void testNegativePage() {
            QueryValidationException e = assertThrows(QueryValidationException.class,
                    () -> executor.execute(StructuredQuery.builder().build(), TestCandidates.abcPool(), -1, 10));
            assertEquals("page", e.getField());
        }

        @Test
        @DisplayName("Should reject a zero page size")
        void testZeroPageSize() {
            QueryValidationException e = assertThrows(QueryValidationException.class,
                    () -> executor.execute(StructuredQuery.builder().build(), TestCandidates.abcPool(), 0, 0));
            assertEquals("pageSize", e.getField());
        }

        @Test
        @DisplayName("Should reject an organization with no usable name")
        void testUnusableOrganization() {
            StructuredQuery query = StructuredQuery.builder().organization("!!!").build();

            QueryValidationException e = assertThrows(QueryValidationException.class,
                    () -> executor.execute(query, TestCandidates.abcPool(), 0, 10));
            assertEquals("organization", e.getField());
        }

        @Test
        @DisplayName("Should reject a maxPageSize below one")
        void testInvalidMaxPageSize() {
            assertThrows(IllegalArgumentException.class, () -> new StructuredQueryExecutor(
                    DefaultNormalizationRules.createDefaultEngine(), SkillSynonyms.defaults(), TestCandidates.CLOCK, 0));
        }
    }
}
