package com.mimecast.phishguard.signals.detect;

/**
 * Levenshtein edit distance.
 *
 * <p>Classic dynamic programming over two reused rows.
 * <br>Runs in O(n·m) time and O(min(n, m)) space and does not recurse, so long domains are fine.
 */
public final class Levenshtein {

    /**
     * Private constructor.
     */
    private Levenshtein() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Computes the edit distance between two strings.
     *
     * @param a First string.
     * @param b Second string.
     * @return Minimum number of single character insertions, deletions and substitutions.
     */
    public static int distance(String a, String b) {
        if (a == null) a = "";
        if (b == null) b = "";

        // Rows are sized on the shorter string.
        String longer = a.length() >= b.length() ? a : b;
        String shorter = a.length() >= b.length() ? b : a;

        if (shorter.isEmpty()) {
            return longer.length();
        }

        int[] previous = new int[shorter.length() + 1];
        int[] current = new int[shorter.length() + 1];
        for (int j = 0; j <= shorter.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= longer.length(); i++) {
            current[0] = i;
            char c1 = longer.charAt(i - 1);

            for (int j = 1; j <= shorter.length(); j++) {
                int cost = c1 == shorter.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(
                                previous[j] + 1,     // Deletion.
                                current[j - 1] + 1), // Insertion.
                        previous[j - 1] + cost);     // Substitution.
            }

            int[] swap = previous;
            previous = current;
            current = swap;
        }

        return previous[shorter.length()];
    }
}
