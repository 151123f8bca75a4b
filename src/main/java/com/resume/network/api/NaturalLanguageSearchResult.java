package com.resume.network.api;

import com.resume.network.llm.TranslatedQuery;
import com.resume.network.query.QueryPage;

/**
 * Result of a natural-language search: how the text was translated and the resulting page.
 */
public record NaturalLanguageSearchResult(String text, TranslatedQuery translation, QueryPage page) {
}
