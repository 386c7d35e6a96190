package com.setcover;

import java.io.FileNotFoundException;
import java.io.IOException;

public class Main {

    static final int EXIT_IO = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_STRUCTURAL = 3;
    static final int EXIT_INFEASIBLE = 4;

    private static void usage() {
        System.err.println(
                "Usage: setcover [options] [input-file]\n" +
                        "Without an input file the built-in 5-element example is solved.\n" +
                        "Options:\n" +
                        "  -dual         print the dual value of every element\n" +
                        "  -stats        print totals (cost, dual bound, frequency)\n" +
                        "  -time         print elapsed time\n"
        );
    }

    /** The four-set example: the cover is S_1, S_3. */
    static Instance exampleInstance() {
        Instance instance = new Instance(5);
        instance.addSet(50, 0, 1);
        instance.addSet(2, 1, 2, 3);
        instance.addSet(3, 3, 4);
        instance.addSet(2, 4, 0);
        return instance;
    }

    public static void main(String[] args) {
        int code = run(args);
        if (code != 0) System.exit(code);
    }

    static int run(String[] args) {
        OptionsParser.Parsed parsed;
        try {
            parsed = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage();
            System.err.println("Argument error: " + e.getMessage());
            return EXIT_USAGE;
        }

        SolverOptions opts = parsed.options;
        String filename = parsed.inputPath;

        long t0 = System.nanoTime();
        try {
            Instance instance = filename == null ? exampleInstance() : Instance.readFromFile(filename);
            Cover cover = PrimalDualSolver.solve(instance);

            StringBuilder sb = new StringBuilder("Using sets: ");
            for (int s : cover.setArray()) sb.append("S_").append(s).append('\t');
            System.out.println(sb);

            if (opts.printDual) {
                double[] y = cover.dualValues();
                for (int e = 0; e < y.length; e++) System.out.printf("y_%d=%s%n", e, y[e]);
            }
            if (opts.printStats) System.out.println(cover);
            if (opts.printTime) {
                double secs = (System.nanoTime() - t0) / 1_000_000_000.0;
                System.out.printf("*Time=%.3fs%n", secs);
            }
            return 0;

        } catch (FileNotFoundException e) {
            System.err.println("File not found: " + filename);
            return EXIT_IO;
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        } catch (StructuralException e) {
            System.err.println("Invalid instance: " + e.getMessage());
            return EXIT_STRUCTURAL;
        } catch (InfeasibleException e) {
            System.err.println(e.getMessage());
            return EXIT_INFEASIBLE;
        }
    }
}
