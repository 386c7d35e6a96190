package com.setcover;

import java.util.Arrays;

/**
 * Dual variables of one solve: {@code y[e]} per element and the accumulated
 * {@code slackUsed[s] = sum of y[e] over e in s} per set. Both only grow.
 */
final class DualState {
    private final double[] slackUsed;
    private final double[] y;

    DualState(int elements, int sets) {
        this.slackUsed = new double[sets];
        this.y = new double[elements];
    }

    /** Remaining headroom before the dual constraint of {@code set} becomes tight. */
    double gap(int set, double cost) {
        return cost - slackUsed[set];
    }

    /** Raises {@code y[element]} by {@code increment}, charging every covering set. */
    void raise(int element, double increment, int[] coveringSets) {
        y[element] += increment;
        for (int s : coveringSets) slackUsed[s] += increment;
    }

    boolean isTight(int set, double cost, double epsilon) {
        return Math.abs(cost - slackUsed[set]) < epsilon;
    }

    double slackUsed(int set) { return slackUsed[set]; }

    double[] dualValues() { return Arrays.copyOf(y, y.length); }

    double dualObjective() {
        double sum = 0;
        for (double v : y) sum += v;
        return sum;
    }
}
