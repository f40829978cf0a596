package com.example.filingcontacts.service.contact;

/**
 * Normalized Levenshtein similarity, case-insensitive, in [0, 1].
 */
public final class StringSimilarity {

    private StringSimilarity() {
    }

    public static double similarity(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        String left = a.toLowerCase();
        String right = b.toLowerCase();
        if (left.equals(right)) {
            return 1.0;
        }
        int maxLength = Math.max(left.length(), right.length());
        return (maxLength - levenshtein(left, right)) / (double) maxLength;
    }

    public static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
