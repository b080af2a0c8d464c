package com.calor.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import lombok.experimental.UtilityClass;

/**
 * Edit-distance based "did you mean" lookup. The threshold is a heuristic, not a contract.
 */
@UtilityClass
public class FuzzyMatcher {

    /**
     * Closest candidate within the distance threshold, or null.
     */
    public String findClosest(String input, Collection<String> candidates) {
        List<String> similar = findSimilar(input, candidates, 1);
        return similar.isEmpty() ? null : similar.get(0);
    }

    /**
     * Up to {@code limit} candidates within the threshold, nearest first, ties broken alphabetically.
     */
    public List<String> findSimilar(String input, Collection<String> candidates, int limit) {
        if (input == null || input.isEmpty() || candidates == null) {
            return List.of();
        }
        int threshold = Math.max(2, input.length() / 3);
        String needle = input.toLowerCase(Locale.ROOT);

        List<Scored> scored = new ArrayList<>();
        for (String candidate : candidates) {
            if (candidate.equals(input)) {
                continue;
            }
            int distance = distance(needle, candidate.toLowerCase(Locale.ROOT));
            if (distance <= threshold) {
                scored.add(new Scored(candidate, distance));
            }
        }
        scored.sort(Comparator.comparingInt(Scored::distance).thenComparing(Scored::candidate));

        List<String> result = new ArrayList<>();
        for (Scored s : scored) {
            if (result.size() >= limit) {
                break;
            }
            result.add(s.candidate());
        }
        return result;
    }

    /**
     * Levenshtein distance.
     */
    public int distance(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    private record Scored(String candidate, int distance) {
    }
}
