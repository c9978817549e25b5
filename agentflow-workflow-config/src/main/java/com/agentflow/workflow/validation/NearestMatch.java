package com.agentflow.workflow.validation;

import java.util.Collection;
import java.util.Optional;
import java.util.TreeSet;

/** Typo suggestions by case-insensitive Levenshtein distance. */
public final class NearestMatch {

    public static final int DEFAULT_MAX_DISTANCE = 2;

    private NearestMatch() {
    }

    /** Closest candidate within {@link #DEFAULT_MAX_DISTANCE} edits; ties keep the first candidate. */
    public static Optional<String> find(String target, Collection<String> candidates) {
        return find(target, candidates, DEFAULT_MAX_DISTANCE);
    }

    public static Optional<String> find(String target, Collection<String> candidates, int maxDistance) {
        if (target == null || candidates == null) return Optional.empty();
        String best = null;
        int bestDistance = maxDistance + 1;
        String t = target.toLowerCase();
        for (String c : candidates) {
            if (c == null) continue;
            int d = distance(t, c.toLowerCase());
            if (d < bestDistance) {
                bestDistance = d;
                best = c;
            }
        }
        return Optional.ofNullable(best);
    }

    /** "Did you mean 'x'?" when a near match exists, otherwise a listing of the valid names. */
    public static String suggestion(String target, Collection<String> candidates, String validLabel) {
        return find(target, candidates)
                .map(m -> "Did you mean '" + m + "'?")
                .orElse(validLabel + ": " + new TreeSet<>(candidates));
    }

    static int distance(String a, String b) {
        if (a.length() < b.length()) return distance(b, a);
        if (b.isEmpty()) return a.length();
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) previous[j] = j;
        for (int i = 0; i < a.length(); i++) {
            current[0] = i + 1;
            for (int j = 0; j < b.length(); j++) {
                int cost = a.charAt(i) == b.charAt(j) ? 0 : 1;
                current[j + 1] = Math.min(Math.min(current[j] + 1, previous[j + 1] + 1), previous[j] + cost);
            }
            int[] tmp = previous;
            previous = current;
            current = tmp;
        }
        return previous[b.length()];
    }
}
