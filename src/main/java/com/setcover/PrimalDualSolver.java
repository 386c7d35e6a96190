package com.setcover;

import java.util.Objects;

/**
 * Primal-dual f-approximation for weighted set cover.
 *
 * <p>Each element's dual variable is raised, in ascending element order, as far
 * as the tightest covering set allows. Sets whose dual constraint ends up
 * tight form the cover. Its cost is at most {@code f} times the optimum,
 * {@code f} being the largest number of sets sharing one element.
 *
 * <p>The cover is not minimal: a tight set may be redundant given the others.
 * No removal pass is run.
 */
public final class PrimalDualSolver {

    /** Tolerance for judging a dual constraint tight. */
    public static final double EPSILON = 1e-4;

    private PrimalDualSolver() {}

    /**
     * @throws StructuralException  if {@code instance} fails validation
     * @throws InfeasibleException if some element lies in no set
     */
    public static Cover solve(Instance instance) {
        return solve(instance, EPSILON);
    }

    static Cover solve(Instance instance, double epsilon) {
        Objects.requireNonNull(instance, "instance");
        instance.validate();

        final int n = instance.elementCount();
        final int m = instance.setCount();
        final double[] c = instance.costs();
        final CoverageIndex index = CoverageIndex.of(instance);
        final DualState dual = new DualState(n, m);

        for (int e = 0; e < n; e++) {
            int[] covering = index.coveringSets(e);
            if (covering.length == 0) throw new InfeasibleException(e);

            double increment = Double.POSITIVE_INFINITY;
            for (int s : covering) increment = Math.min(increment, dual.gap(s, c[s]));
            // a tight set may sit an ulp past its cost; duals never shrink
            dual.raise(e, Math.max(0.0, increment), covering);
        }

        int k = 0;
        int[] picked = new int[m];
        double cost = 0;
        for (int s = 0; s < m; s++) {
            if (dual.isTight(s, c[s], epsilon)) {
                picked[k++] = s;
                cost += c[s];
            }
        }
        int[] sets = new int[k];
        System.arraycopy(picked, 0, sets, 0, k);

        return new Cover(sets, cost, dual.dualValues(), dual.dualObjective(), index.maxFrequency());
    }
}
