package com.setcover;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link PrimalDualSolver#solve(Instance)}: the selected set
 * indices (ascending) together with the dual certificate that bounds them.
 */
public final class Cover {
    private final int[] sets;
    private final double cost;
    private final double[] dualValues;
    private final double dualBound;
    private final int frequency;

    Cover(int[] sets, double cost, double[] dualValues, double dualBound, int frequency) {
        this.sets = sets;
        this.cost = cost;
        this.dualValues = dualValues;
        this.dualBound = dualBound;
        this.frequency = frequency;
    }

    /** Selected set indices, ascending. */
    public List<Integer> sets() {
        List<Integer> out = new ArrayList<>(sets.length);
        for (int s : sets) out.add(s);
        return Collections.unmodifiableList(out);
    }

    public int[] setArray() { return sets.clone(); }

    public int size() { return sets.length; }

    public boolean contains(int set) {
        return Arrays.binarySearch(sets, set) >= 0;
    }

    /** Total cost of the selected sets. */
    public double cost() { return cost; }

    /** Sum of the element duals; no cover can cost less than this. */
    public double dualBound() { return dualBound; }

    /** Largest number of sets sharing one element. */
    public int frequency() { return frequency; }

    public double[] dualValues() { return dualValues.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cover)) return false;
        Cover other = (Cover) o;
        return Arrays.equals(sets, other.sets)
                && Double.compare(cost, other.cost) == 0
                && Double.compare(dualBound, other.dualBound) == 0
                && Arrays.equals(dualValues, other.dualValues)
                && frequency == other.frequency;
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(sets) + Arrays.hashCode(dualValues);
    }

    @Override
    public String toString() {
        return "*Totals: sets=" + sets.length +
                " cost=" + cost +
                " dual_bound=" + dualBound +
                " frequency=" + frequency;
    }
}
