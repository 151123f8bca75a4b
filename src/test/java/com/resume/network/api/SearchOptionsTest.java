package com.resume.network.api;

import com.resume.network.network.ColleagueEdgeOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SearchOptions Tests")
class SearchOptionsTest {

    @Test
    @DisplayName("Defaults should link colleagues by organization overlap alone and disable caching")
    void testDefaults() {
        SearchOptions options = SearchOptions.defaults();

        assertFalse(options.isRequireSameDepartment());
        assertEquals(0, options.getMinOverlapMonths());
        assertEquals(20, options.getDefaultSimilarityLimit());
        assertEquals(100, options.getMaxPageSize());
        assertEquals(Duration.ofSeconds(5), options.getOracleTimeout());
        assertFalse(options.getCacheConfig().enabled());
    }

    @Test
    @DisplayName("Presets should configure strict colleagues and caching")
    void testPresets() {
        ColleagueEdgeOptions strict = SearchOptions.strictColleagues().toColleagueEdgeOptions();

        assertTrue(strict.requireSameDepartment());
        assertEquals(3, strict.minOverlapMonths());
        assertTrue(strict.includeMentions());
        assertFalse(SearchOptions.builder().includeMentionedColleagues(false).build()
                .toColleagueEdgeOptions().includeMentions());
        assertTrue(SearchOptions.cached().getCacheConfig().enabled());
    }

    @Test
    @DisplayName("Builder should reject invalid values")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> SearchOptions.builder().defaultSimilarityLimit(0).build());
        assertThrows(IllegalArgumentException.class, () -> SearchOptions.builder().minSimilarityScore(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> SearchOptions.builder().minOverlapMonths(-1).build());
        assertThrows(IllegalArgumentException.class, () -> SearchOptions.builder().maxPageSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> SearchOptions.builder().oracleTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () -> SearchOptions.builder().similarityWeights(null).build());
    }
}
