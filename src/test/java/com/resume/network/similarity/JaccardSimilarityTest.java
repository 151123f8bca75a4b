package com.resume.network.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JaccardSimilarityTest {

    @Test
    @DisplayName("Should compute intersection over union")
    void testCompute() {
        assertEquals(1.0 / 3.0, JaccardSimilarity.compute(Set.of("python", "sql"), Set.of("python", "golang")), 1e-9);
        assertEquals(1.0, JaccardSimilarity.compute(Set.of("a", "b"), Set.of("b", "a")));
        assertEquals(0.0, JaccardSimilarity.compute(Set.of("a"), Set.of("b")));
    }

    @Test
    @DisplayName("Empty sets have no similarity, not even with each other")
    void testEmptySets() {
        assertEquals(0.0, JaccardSimilarity.compute(Set.of(), Set.of()));
        assertEquals(0.0, JaccardSimilarity.compute(Set.of("a"), Set.of()));
        assertEquals(0.0, JaccardSimilarity.compute(null, Set.of("a")));
    }

    @Test
    @DisplayName("Title tokens ignore case, punctuation and stop words")
    void testTokens() {
        JaccardSimilarity jaccard = new JaccardSimilarity();

        assertEquals(Set.of("head", "engineering"), jaccard.tokenize(List.of("Head of Engineering")));
        assertEquals(Set.of("c++", "developer"), jaccard.tokenize(List.of("C++ Developer")));
        assertEquals(1.0, jaccard.computeTokens(List.of("Senior Engineer"), List.of("engineer, senior")));
        assertEquals(1.0 / 3.0, jaccard.computeTokens(List.of("Data Engineer"), List.of("Data Analyst", "Analyst")), 1e-9);
    }
}
