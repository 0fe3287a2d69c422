package com.nevis.hybrid.repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Term-density text rank for the in-memory backend. Like {@code plainto_tsquery}, a document only matches
 * when it contains every query term; the rank is the share of the document's tokens that are query terms.
 */
final class TextRanker {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TextRanker() {
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    static Set<String> queryTerms(String queryText) {
        return new LinkedHashSet<>(tokenize(queryText));
    }

    /**
     * @return the rank, or a negative value when the content does not match every term
     */
    static double rank(Set<String> queryTerms, String content) {
        if (queryTerms.isEmpty()) {
            return -1;
        }
        List<String> tokens = tokenize(content);
        if (tokens.isEmpty()) {
            return -1;
        }

        Map<String, Integer> frequencies = new HashMap<>();
        for (String token : tokens) {
            if (queryTerms.contains(token)) {
                frequencies.merge(token, 1, Integer::sum);
            }
        }
        if (frequencies.size() < queryTerms.size()) {
            return -1;
        }

        int matched = frequencies.values().stream().mapToInt(Integer::intValue).sum();
        return (double) matched / tokens.size();
    }
}
