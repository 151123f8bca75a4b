package com.resume.network.llm;

import com.resume.network.core.model.SeniorityTier;
import com.resume.network.query.DateRange;
import com.resume.network.query.SkillMatchMode;
import com.resume.network.query.StructuredQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OracleResponseValidator Tests")
class OracleResponseValidatorTest {

    private final OracleResponseValidator validator = new OracleResponseValidator();

    private StructuredQuery validate(String content) {
        return validator.validate(new OracleResponse(content, "test"));
    }

    @Nested
    @DisplayName("Accepted responses")
    class Accepted {

        @Test
        @DisplayName("Should read every recognized field")
        void testAllFields() {
            StructuredQuery query = validate("""
                    {"organization": "Acme", "department": "Engineering",
                     "skills": ["python", "sql"], "skill_mode": "any",
                     "date_from": "2020-01-01", "date_to": "2021-01-01",
                     "seniority": "Mid-level", "min_experience_years": 3,
                     "terms": "engineer, backend"}
                    """);

            assertEquals("Acme", query.getOrganization());
            assertEquals("Engineering", query.getDepartment());
            assertEquals(Set.of("python", "sql"), query.getSkills());
            assertEquals(SkillMatchMode.ANY, query.getSkillMatchMode());
            assertEquals(DateRange.year(2020), query.getDateRange());
            assertEquals(SeniorityTier.MID, query.getSeniority());
            assertEquals(3, query.getMinExperienceYears());
            assertEquals(List.of("engineer", "backend"), query.getFreeTextTerms());
        }

        @Test
        @DisplayName("Should strip prose and code fences around the object")
        void testFencedResponse() {
            StructuredQuery query = validate("Here you go:\n```json\n{\"organization\": \"Globex\"}\n```");

            assertEquals("Globex", query.getOrganization());
        }

        @Test
        @DisplayName("Should ignore unrecognized fields and null values")
        void testIgnoresExtras() {
            StructuredQuery query = validate(
                    "{\"confidence\": 0.9, \"organization\": null, \"SENIORITY\": \"senior\", \"notes\": [1, 2]}");

            assertEquals(SeniorityTier.SENIOR, query.getSeniority());
            assertNull(query.getOrganization());
        }

        @Test
        @DisplayName("Should accept an open-ended date range")
        void testOpenRange() {
            StructuredQuery query = validate("{\"date_from\": \"2019\"}");

            assertEquals(DateRange.since(LocalDate.of(2019, 1, 1)), query.getDateRange());
        }
    }

    @Nested
    @DisplayName("Rejected responses")
    class Rejected {

        @ParameterizedTest
        @ValueSource(strings = {
                "I could not understand the request.",
                "{organization: }",
                "{\"foo\": \"bar\"}",
                "{\"organization\": 5}",
                "{\"organization\": \"!!!\", \"skills\": [\"python\"]}",
                "{\"department\": \"!!!\", \"skills\": [\"python\"]}",
                "{\"skills\": {\"python\": true}}",
                "{\"skills\": [\"python\", \" \"]}",
                "{\"skill_mode\": \"most\", \"skills\": [\"python\"]}",
                "{\"date_from\": \"whenever\"}",
                "{\"date_from\": \"2021-01-01\", \"date_to\": \"2020-01-01\"}",
                "{\"seniority\": \"wizard\"}",
                "{\"min_experience_years\": 2.5}",
                "{\"min_experience_years\": \"five\"}",
                "{\"min_experience_years\": 120}"
        })
        @DisplayName("Should reject malformed or invalid content")
        void testRejected(String content) {
            assertThrows(InvalidOracleResponseException.class, () -> validate(content));
        }

        @Test
        @DisplayName("Should name the organization that has no usable key")
        void testUnusableOrganizationMessage() {
            InvalidOracleResponseException e = assertThrows(InvalidOracleResponseException.class,
                    () -> validate("{\"organization\": \"!!!\"}"));

            assertTrue(e.getMessage().contains("organization has no usable name"));
        }

        @Test
        @DisplayName("Should report when no JSON object is present")
        void testNoObjectMessage() {
            InvalidOracleResponseException e = assertThrows(InvalidOracleResponseException.class,
                    () -> OracleResponseValidator.extractObject("no json here"));

            assertTrue(e.getMessage().contains("no JSON object"));
        }
    }
}
