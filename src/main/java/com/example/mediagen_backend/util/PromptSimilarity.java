package com.example.mediagen_backend.util;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Token-set (Jaccard) similarity between two prompts.
 */
public final class PromptSimilarity {

    private PromptSimilarity() {
    }

    public static double jaccard(String first, String second) {
        Set<String> a = tokens(first);
        Set<String> b = tokens(second);
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    // punctuation is treated as a separator
    static Set<String> tokens(String text) {
        if (text == null) {
            return Set.of();
        }
        String cleaned = text.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}_\\s]", " ").trim();
        if (cleaned.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(cleaned.split("\\s+"))
                .filter(token -> !token.isBlank())
                .collect(Collectors.toSet());
    }
}
