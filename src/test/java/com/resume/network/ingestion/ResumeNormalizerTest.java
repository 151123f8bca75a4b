package com.resume.network.ingestion;

import com.resume.network.core.model.Candidate;
import com.resume.network.core.model.Experience;
import com.resume.network.core.model.SeniorityTier;
import com.resume.network.fixture.TestCandidates;
import com.resume.network.rules.DefaultNormalizationRules;
import com.resume.network.rules.SkillSynonyms;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResumeNormalizer Tests")
class ResumeNormalizerTest {

    private ResumeNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new ResumeNormalizer(DefaultNormalizationRules.createDefaultEngine(), SkillSynonyms.defaults(),
                new SeniorityClassifier(), TestCandidates.CLOCK);
    }

    @Nested
    @DisplayName("Structured sections")
    class StructuredTests {

        @Test
        @DisplayName("Should normalize a well-formed resume")
        void testWellFormed() {
            Candidate candidate = normalizer.normalize(TestCandidates.rawResume("c-1", "Ada Lovelace",
                    "Acme Corp.", "Dept. of Engineering", "Software Engineer", "Jan 2019 - Jan 2021",
                    "Python", "py", "SQL"));

            assertEquals("c-1", candidate.getId());
            assertEquals("Ada Lovelace", candidate.getName());
            assertEquals(Set.of("python", "sql"), candidate.getSkills());
            assertEquals(1, candidate.getExperiences().size());

            Experience role = candidate.getExperiences().get(0);
            assertEquals("Acme Corp.", role.organization());
            assertEquals("acme", role.organizationKey());
            assertEquals("engineering", role.departmentKey());
            assertEquals(LocalDate.of(2019, 1, 1), role.startDate());
            assertEquals(LocalDate.of(2021, 1, 1), role.endDate());
            assertFalse(role.current());
            assertEquals(24, candidate.getTotalExperienceMonths());
            assertEquals(SeniorityTier.MID, candidate.getSeniority());
        }

        @Test
        @DisplayName("Should read contact details from a nested contact section")
        void testNestedContact() {
            Map<String, Object> sections = new LinkedHashMap<>();
            sections.put("Full Name", "Grace Hopper");
            sections.put("Contact Info", Map.of("Email", "Grace@Navy.MIL", "City", "Arlington"));
            sections.put("Hobbies", "sailing");

            Candidate candidate = normalizer.normalize(RawResume.of("g", sections));

            assertEquals("Grace Hopper", candidate.getName());
            assertEquals("grace@navy.mil", candidate.getEmail());
            assertEquals("Arlington", candidate.getLocation());
            assertEquals(Map.of("Hobbies", "sailing"), candidate.getUnmatchedSections());
        }

        @Test
        @DisplayName("Open-ended roles are current and count up to today")
        void testOpenEndedRole() {
            Candidate candidate = normalizer.normalize(TestCandidates.rawResume("c-2", "Alan", "Globex",
                    null, "Analyst", "Jun 2022 - Present"));

            Experience role = candidate.getExperiences().get(0);
            assertTrue(role.current());
            assertNull(role.endDate());
            assertEquals(24, candidate.getTotalExperienceMonths());
        }

        @Test
        @DisplayName("Overlapping roles are counted once in total experience")
        void testParallelRolesCountedOnce() {
            Map<String, Object> sections = new LinkedHashMap<>();
            sections.put("name", "Linus");
            sections.put("experience", List.of(
                    Map.of("company", "Acme", "title", "Engineer", "start", "2018-01", "end", "2020-01"),
                    Map.of("company", "Initech", "title", "Advisor", "start", "2019-01", "end", "2021-01")));

            Candidate candidate = normalizer.normalize(RawResume.of("l", sections));

            assertEquals(36, candidate.getTotalExperienceMonths());
        }

        @Test
        @DisplayName("Inverted dates are swapped")
        void testSwappedDates() {
            Candidate candidate = normalizer.normalize(TestCandidates.rawResume("s", "Sam", "Acme", null,
                    "Engineer", "2021 - 2019"));

            Experience role = candidate.getExperiences().get(0);
            assertEquals(LocalDate.of(2019, 1, 1), role.startDate());
            assertEquals(LocalDate.of(2021, 1, 1), role.endDate());
        }

        @Test
        @DisplayName("A range within one year covers the whole year")
        void testSameYearRange() {
            Candidate candidate = normalizer.normalize(TestCandidates.rawResume("y", "Yan", "Acme", null,
                    "Engineer", "2019 - 2019"));

            Experience role = candidate.getExperiences().get(0);
            assertEquals(LocalDate.of(2019, 1, 1), role.startDate());
            assertEquals(LocalDate.of(2020, 1, 1), role.endDate());
            assertEquals(12, candidate.getTotalExperienceMonths());
        }

        @Test
        @DisplayName("A range within one month covers the whole month")
        void testSameMonthRange() {
            Candidate candidate = normalizer.normalize(TestCandidates.rawResume("m", "Mo", "Acme", null,
                    "Engineer", "Mar 2021 - Mar 2021"));

            Experience role = candidate.getExperiences().get(0);
            assertEquals(LocalDate.of(2021, 3, 1), role.startDate());
            assertEquals(LocalDate.of(2021, 4, 1), role.endDate());
            assertEquals(1, candidate.getTotalExperienceMonths());
        }

        @Test
        @DisplayName("Ends written at a different precision are kept as parsed")
        void testMixedPrecisionRange() {
            Candidate candidate = normalizer.normalize(TestCandidates.rawResume("p", "Pat", "Acme", null,
                    "Engineer", "2019 - Jan 2019"));

            Experience role = candidate.getExperiences().get(0);
            assertEquals(LocalDate.of(2019, 1, 1), role.startDate());
            assertEquals(LocalDate.of(2019, 1, 1), role.endDate());
        }
    }

    @Nested
    @DisplayName("Free-text and degraded input")
    class DegradedInputTests {

        @Test
        @DisplayName("Unparseable dates keep the experience with a null date")
        void testUnparseableDate() {
            Candidate candidate = normalizer.normalize(TestCandidates.rawResume("d", "Dana", "Acme", null,
                    "Engineer", "Summer of discontent"));

            assertEquals(1, candidate.getExperiences().size());
            Experience role = candidate.getExperiences().get(0);
            assertEquals("acme", role.organizationKey());
            assertNull(role.startDate());
            assertNull(role.endDate());
            assertEquals("Summer of discontent", role.rawDates());
            assertEquals(0, candidate.getTotalExperienceMonths());
        }

        @Test
        @DisplayName("Should parse free-text experience lines")
        void testFreeTextLines() {
            Map<String, Object> sections = new LinkedHashMap<>();
            sections.put("Name", "Edsger");
            sections.put("Employment History",
                    "Senior Engineer, Acme Corp (2019 - 2021)\nAnalyst at Globex | Sales | Jan 2017 - Dec 2018");

            Candidate candidate = normalizer.normalize(RawResume.of("e", sections));

            List<Experience> roles = candidate.getExperiences();
            assertEquals(2, roles.size());
            assertEquals("Senior Engineer", roles.get(0).title());
            assertEquals("acme", roles.get(0).organizationKey());
            assertEquals(LocalDate.of(2019, 1, 1), roles.get(0).startDate());
            assertEquals("Analyst", roles.get(1).title());
            assertEquals("globex", roles.get(1).organizationKey());
            assertEquals("sales", roles.get(1).departmentKey());
            assertEquals(LocalDate.of(2018, 12, 1), roles.get(1).endDate());
            assertEquals(SeniorityTier.SENIOR, candidate.getSeniority());
        }

        @Test
        @DisplayName("Skills mentioned in role descriptions become keywords")
        void testDescriptionKeywords() {
            Map<String, Object> sections = new LinkedHashMap<>();
            sections.put("name", "Kim");
            sections.put("skills", "Go; Terraform");
            sections.put("experience", List.of(Map.of(
                    "company", "Acme",
                    "title", "Engineer",
                    "dates", "2020 - 2022",
                    "description", "Ran k8s clusters and wrote Terraform modules")));

            Candidate candidate = normalizer.normalize(RawResume.of("k", sections));

            assertEquals(List.of("kubernetes", "terraform"), candidate.getExperiences().get(0).keywords());
            assertTrue(candidate.getSkills().containsAll(Set.of("golang", "terraform", "kubernetes")));
        }

        @Test
        @DisplayName("Empty parser output is rejected")
        void testEmptyResume() {
            NormalizationException e = assertThrows(NormalizationException.class,
                    () -> normalizer.normalize(RawResume.unparseable("broken", "upload-7.pdf")));
            assertEquals("broken", e.getResumeLabel());
        }

        @Test
        @DisplayName("A resume with neither name nor datable experience is rejected")
        void testNoNameNoDates() {
            Map<String, Object> sections = new LinkedHashMap<>();
            sections.put("skills", "java");
            sections.put("experience", List.of(Map.of("company", "Acme", "dates", "someday")));

            assertThrows(NormalizationException.class, () -> normalizer.normalize(RawResume.of("x", sections)));
        }

        @Test
        @DisplayName("A nameless resume with a dated experience is accepted")
        void testNamelessButDated() {
            Map<String, Object> sections = new LinkedHashMap<>();
            sections.put("experience", List.of(Map.of("company", "Acme", "dates", "2019 - 2020")));

            Candidate candidate = normalizer.normalize(RawResume.of("y", sections));

            assertEquals("", candidate.getName());
            assertEquals(12, candidate.getTotalExperienceMonths());
        }
    }
}
