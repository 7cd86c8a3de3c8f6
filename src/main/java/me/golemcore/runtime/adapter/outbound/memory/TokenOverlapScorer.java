package me.golemcore.runtime.adapter.outbound.memory;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lexical relevance score: distinct query tokens found in the document,
 * normalized by document length. Deterministic and allocation-light; no corpus
 * statistics are kept.
 */
final class TokenOverlapScorer {

    private static final int MIN_TOKEN_LENGTH = 2;

    private TokenOverlapScorer() {
    }

    static double score(String query, String document) {
        Set<String> queryTokens = tokens(query);
        Set<String> documentTokens = tokens(document);
        if (queryTokens.isEmpty() || documentTokens.isEmpty()) {
            return 0.0;
        }
        int overlap = 0;
        for (String token : queryTokens) {
            if (documentTokens.contains(token)) {
                overlap++;
            }
        }
        if (overlap == 0) {
            return 0.0;
        }
        return overlap / Math.sqrt(documentTokens.size());
    }

    static Set<String> tokens(String text) {
        Set<String> out = new HashSet<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        for (String raw : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (raw.length() >= MIN_TOKEN_LENGTH) {
                out.add(raw);
            }
        }
        return out;
    }
}
