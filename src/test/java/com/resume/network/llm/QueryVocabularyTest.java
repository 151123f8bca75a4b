package com.resume.network.llm;

import com.resume.network.fixture.TestCandidates;
import com.resume.network.rules.DefaultNormalizationRules;
import com.resume.network.rules.SkillSynonyms;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryVocabulary Tests")
class QueryVocabularyTest {

    private final QueryVocabulary vocabulary = QueryVocabulary.from(TestCandidates.abcPool(),
            DefaultNormalizationRules.createDefaultEngine(), SkillSynonyms.defaults());

    @Test
    @DisplayName("Should know organizations by canonical key")
    void testOrganizations() {
        assertEquals("acme", vocabulary.organizationKey("ACME Inc."));
        assertNull(vocabulary.organizationKey("Initech"));
        assertEquals(Set.of("Acme", "Globex"), vocabulary.organizationNames());
        assertEquals(1, vocabulary.snapshotVersion());
    }

    @Test
    @DisplayName("Should fold plurals for departments and title words")
    void testPlurals() {
        assertEquals("sales", vocabulary.departmentKey("Sales"));
        assertEquals("manager", vocabulary.titleWord("Managers"));
        assertEquals("engineer", vocabulary.titleWord("engineers"));
        assertNull(vocabulary.titleWord("pilots"));
    }

    @Test
    @DisplayName("Should resolve skills through synonyms, including ones absent from the pool")
    void testSkills() {
        assertEquals("python", vocabulary.skill("py"));
        assertEquals("microsoft excel", vocabulary.skill("Excel"));
        assertEquals("kubernetes", vocabulary.skill("k8s"));
        assertNull(vocabulary.skill("underwater basket weaving"));
    }

    @Test
    @DisplayName("Should singularize without a vocabulary")
    void testFold() {
        assertEquals("company", QueryVocabulary.fold("companies"));
        assertEquals("wizard", QueryVocabulary.fold("wizards"));
        assertEquals("business", QueryVocabulary.fold("business"));
        assertEquals("aws", QueryVocabulary.fold("aws"));
    }
}
