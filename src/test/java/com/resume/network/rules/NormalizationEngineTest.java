package com.resume.network.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.createDefaultEngine();
    }

    @Nested
    @DisplayName("Organization keys")
    class OrganizationTests {

        @ParameterizedTest
        @CsvSource({
                "'Acme Corp.', acme",
                "'Acme, Inc.', acme",
                "'ACME Corporation', acme",
                "'The Acme Company', acme",
                "'Globex LLC', globex",
                "'Siemens AG', siemens",
                "'Costco', costco",
                "'Procter & Gamble', procter gamble"
        })
        @DisplayName("Should strip legal suffixes and case-fold")
        void testOrganizationKey(String input, String expected) {
            assertEquals(expected, engine.organizationKey(input));
        }

        @Test
        @DisplayName("Variants of one organization are the same organization")
        void testSameOrganization() {
            assertTrue(engine.sameOrganization("Acme Corp", "acme, inc."));
            assertFalse(engine.sameOrganization("Acme", "Globex"));
            assertFalse(engine.sameOrganization("", ""));
        }

        @Test
        @DisplayName("Blank input gives an empty key")
        void testBlank() {
            assertEquals("", engine.organizationKey(null));
            assertEquals("", engine.organizationKey("   "));
        }
    }

    @Nested
    @DisplayName("Department and title keys")
    class DepartmentTitleTests {

        @ParameterizedTest
        @CsvSource({
                "'Dept. of Engineering', engineering",
                "'Department of Sales', sales",
                "'Engineering Team', engineering",
                "'R&D Division', r d"
        })
        @DisplayName("Should strip department decorations")
        void testDepartmentKey(String input, String expected) {
            assertEquals(expected, engine.departmentKey(input));
        }

        @Test
        @DisplayName("Should expand title abbreviations")
        void testTitleKey() {
            assertEquals("senior engineer", engine.titleKey("Sr. Engineer"));
            assertEquals("engineering manager", engine.titleKey("Engineering Mgr"));
        }

        @Test
        @DisplayName("Organization rules do not touch titles")
        void testTargetsAreRespected() {
            assertEquals("head of co", engine.titleKey("Head of Co"));
        }
    }

    @Test
    @DisplayName("Custom rules can be added and removed")
    void testAddRemoveRule() {
        engine.addRule(NormalizationRule.builder()
                .name("org-holdings")
                .pattern("\\s+Holdings$")
                .targets(NormalizationTarget.ORGANIZATION)
                .priority(15)
                .build());
        assertEquals("initech", engine.organizationKey("Initech Holdings"));

        assertTrue(engine.removeRule("org-holdings"));
        assertEquals("initech holdings", engine.organizationKey("Initech Holdings"));
    }
}
