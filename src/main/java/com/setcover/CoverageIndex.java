package com.setcover;

import java.util.Arrays;

/**
 * Sparse coverage relation: for each element, the ascending indices of the
 * sets that contain it. Equivalent to a 0/1 element-by-set matrix, where a
 * set listing an element twice still yields a single entry.
 */
final class CoverageIndex {
    private static final int[] NONE = new int[0];

    private final int[][] covering;   // covering[e] = sets containing e

    private CoverageIndex(int[][] covering) {
        this.covering = covering;
    }

    /** Builds the index from a validated instance. */
    static CoverageIndex of(Instance instance) {
        final int n = instance.elementCount();
        final int m = instance.setCount();

        int[] counts = new int[n];
        int[] lastSeen = new int[n];
        Arrays.fill(lastSeen, -1);
        for (int s = 0; s < m; s++) {
            for (int e : instance.elementArray(s)) {
                if (lastSeen[e] == s) continue;   // duplicate inside set s
                lastSeen[e] = s;
                counts[e]++;
            }
        }

        int[][] covering = new int[n][];
        for (int e = 0; e < n; e++) covering[e] = counts[e] == 0 ? NONE : new int[counts[e]];

        int[] fill = new int[n];
        Arrays.fill(lastSeen, -1);
        for (int s = 0; s < m; s++) {
            for (int e : instance.elementArray(s)) {
                if (lastSeen[e] == s) continue;
                lastSeen[e] = s;
                covering[e][fill[e]++] = s;
            }
        }
        return new CoverageIndex(covering);
    }

    int elementCount() { return covering.length; }

    /** Sets containing {@code element}, ascending. Callers must not modify the array. */
    int[] coveringSets(int element) { return covering[element]; }

    int frequency(int element) { return covering[element].length; }

    /** The {@code f} in the f-approximation guarantee. */
    int maxFrequency() {
        int f = 0;
        for (int[] sets : covering) f = Math.max(f, sets.length);
        return f;
    }
}
