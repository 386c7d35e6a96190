package com.setcover;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

/**
 * Seeded random instances small enough to brute-force the optimum.
 * Every element is put in at least one set, so all instances are feasible.
 */
public class PrimalDualPropertyTest {

    private static final int TRIALS = 300;

    private static Instance randomInstance(Random rnd, boolean integerCosts) {
        int n = 1 + rnd.nextInt(7);
        int m = 1 + rnd.nextInt(8);
        boolean[][] member = new boolean[m][n];
        for (int s = 0; s < m; s++)
            for (int e = 0; e < n; e++)
                member[s][e] = rnd.nextInt(3) == 0;
        for (int e = 0; e < n; e++) member[rnd.nextInt(m)][e] = true;

        Instance in = new Instance(n);
        for (int s = 0; s < m; s++) {
            int k = 0;
            int[] elems = new int[n];
            for (int e = 0; e < n; e++) if (member[s][e]) elems[k++] = e;
            int[] exact = new int[k];
            System.arraycopy(elems, 0, exact, 0, k);
            double cost = integerCosts ? rnd.nextInt(10) : rnd.nextDouble() * 10;
            in.addSet(cost, exact);
        }
        return in;
    }

    private static boolean covers(Instance in, int[] sets) {
        boolean[] seen = new boolean[in.elementCount()];
        for (int s : sets) for (int e : in.elements(s)) seen[e] = true;
        for (boolean b : seen) if (!b) return false;
        return true;
    }

    private static double optimum(Instance in) {
        int m = in.setCount();
        double best = Double.POSITIVE_INFINITY;
        for (int mask = 0; mask < (1 << m); mask++) {
            int[] sets = new int[Integer.bitCount(mask)];
            int k = 0;
            for (int s = 0; s < m; s++) if ((mask & (1 << s)) != 0) sets[k++] = s;
            if (covers(in, sets)) best = Math.min(best, in.totalCost(sets));
        }
        return best;
    }

    @Test
    public void everyElementIsCovered() {
        Random rnd = new Random(11);
        for (int t = 0; t < TRIALS; t++) {
            Instance in = randomInstance(rnd, t % 2 == 0);
            Cover cover = PrimalDualSolver.solve(in);
            assertTrue(covers(in, cover.setArray()), "uncovered element in " + in);
        }
    }

    @Test
    public void costWithinFrequencyTimesOptimum() {
        Random rnd = new Random(23);
        for (int t = 0; t < TRIALS; t++) {
            Instance in = randomInstance(rnd, t % 2 == 0);
            Cover cover = PrimalDualSolver.solve(in);
            double opt = optimum(in);
            assertTrue(cover.cost() <= cover.frequency() * opt + 1e-3,
                    "cost " + cover.cost() + " > f*opt for " + in);
            assertTrue(cover.dualBound() <= opt + 1e-9, "dual bound exceeds optimum for " + in);
            assertTrue(cover.cost() <= cover.frequency() * cover.dualBound() + 1e-3);
        }
    }

    @Test
    public void dualStaysFeasible() {
        Random rnd = new Random(37);
        for (int t = 0; t < TRIALS; t++) {
            Instance in = randomInstance(rnd, false);
            double[] y = PrimalDualSolver.solve(in).dualValues();
            for (int s = 0; s < in.setCount(); s++) {
                double load = 0;
                int prev = -1;
                for (int e : in.elements(s)) {
                    if (e == prev) continue;
                    load += y[e];
                    prev = e;
                }
                assertTrue(load <= in.cost(s) + 1e-9, "set " + s + " overloaded in " + in);
            }
            for (double v : y) assertTrue(v >= 0);
        }
    }

    @Test
    public void repeatedSolvesAgree() {
        Random rnd = new Random(5);
        for (int t = 0; t < 50; t++) {
            Instance in = randomInstance(rnd, false);
            assertEquals(PrimalDualSolver.solve(in), PrimalDualSolver.solve(in));
        }
    }

    @Test
    public void droppingAnElementsLastSetIsDetected() {
        Random rnd = new Random(91);
        for (int t = 0; t < 100; t++) {
            Instance base = randomInstance(rnd, true);
            int n = base.elementCount();
            int victim = rnd.nextInt(n);
            Instance in = new Instance(n);
            for (int s = 0; s < base.setCount(); s++) {
                List<Integer> kept = new ArrayList<>(base.elements(s));
                kept.removeIf(e -> e == victim);
                in.addSet(base.cost(s), kept);
            }
            InfeasibleException ex = assertThrows(InfeasibleException.class, () -> PrimalDualSolver.solve(in));
            assertEquals(victim, ex.element());
        }
    }
}
