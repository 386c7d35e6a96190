package com.setcover;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A weighted set cover instance. Elements are {@code 0 .. elementCount-1},
 * sets are indexed by the order they were added.
 *
 * <p>Text form (lrs-like), one set per line with the cost first:
 * <pre>
 * example
 * begin
 * 5 4
 * 50 0 1
 * 2  1 2 3
 * 3  3 4
 * 2  4 0
 * end
 * </pre>
 * Lines starting with {@code *} or {@code #} are comments anywhere in the
 * file. The set count may be given as {@code *****}, in which case rows are read
 * until {@code end}.
 */
public final class Instance {
    private final int elementCount;
    private final List<int[]> sets = new ArrayList<>();
    private final List<Double> costs = new ArrayList<>();

    public Instance(int elementCount) {
        if (elementCount <= 0) {
            throw new IllegalArgumentException("Element count must be positive, got " + elementCount);
        }
        this.elementCount = elementCount;
    }

    public int elementCount() { return elementCount; }
    public int setCount() { return sets.size(); }

    /** Appends a set; its index is the number of sets added before it. */
    public void addSet(double cost, int... elements) {
        Objects.requireNonNull(elements, "elements");
        sets.add(elements.clone());
        costs.add(cost);
    }

    public void addSet(double cost, List<Integer> elements) {
        Objects.requireNonNull(elements, "elements");
        int[] a = new int[elements.size()];
        for (int i = 0; i < a.length; i++) a[i] = Objects.requireNonNull(elements.get(i), "element " + i);
        sets.add(a);
        costs.add(cost);
    }

    public double cost(int set) { return costs.get(set); }

    /** Elements of {@code set} in the order given, duplicates included. */
    public List<Integer> elements(int set) {
        int[] a = sets.get(set);
        List<Integer> out = new ArrayList<>(a.length);
        for (int e : a) out.add(e);
        return Collections.unmodifiableList(out);
    }

    int[] elementArray(int set) { return sets.get(set); }

    public double[] costs() {
        double[] c = new double[costs.size()];
        for (int i = 0; i < c.length; i++) c[i] = costs.get(i);
        return c;
    }

    public double totalCost(int... selected) {
        double sum = 0;
        for (int s : selected) sum += costs.get(s);
        return sum;
    }

    /**
     * Checks structural consistency.
     *
     * @throws StructuralException on misaligned costs, out-of-range elements,
     *         or a negative / non-finite cost
     */
    public void validate() {
        if (costs.size() != sets.size()) {
            throw new StructuralException("Cost count " + costs.size() + " != set count " + sets.size());
        }
        for (int s = 0; s < sets.size(); s++) {
            double c = costs.get(s);
            if (Double.isNaN(c) || Double.isInfinite(c) || c < 0) {
                throw new StructuralException("Set " + s + " has invalid cost " + c);
            }
            for (int e : sets.get(s)) {
                if (e < 0 || e >= elementCount) {
                    throw new StructuralException("Set " + s + " references element " + e
                            + " outside [0, " + elementCount + ")");
                }
            }
        }
    }

    public static Instance readFromFile(String filename) throws IOException {
        try (FileReader fr = new FileReader(filename)) {
            return read(fr);
        }
    }

    public static Instance read(Reader in) throws IOException {
        BufferedReader br = new BufferedReader(in);
        String line;

        // ---- skip name / comment lines up to 'begin' ----
        boolean sawBegin = false;
        while ((line = br.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty()) continue;
            if (line.startsWith("*") || line.startsWith("#")) continue;
            if (line.toLowerCase(Locale.ROOT).equals("begin")) { sawBegin = true; break; }
        }
        if (!sawBegin) throw new IOException("No 'begin' line found");

        line = nextNonEmpty(br);
        if (line == null) throw new IOException("Unexpected end of file");
        String[] header = line.split("\\s+");
        if (header.length < 2)
            throw new IOException("Expected '<elements> <sets>' or '<elements> *****', got: " + line);

        Instance instance;
        try {
            instance = new Instance(Integer.parseInt(header[0]));
        } catch (NumberFormatException e) {
            throw new IOException("Element count must be numeric, got: " + header[0]);
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage());
        }

        if (header[1].equals("*****")) {
            int row = 0;
            while ((line = nextNonEmpty(br)) != null) {
                if (line.equalsIgnoreCase("end")) return instance;
                parseRow(instance, line, ++row);
            }
            throw new IOException("Expected 'end' before end of file");
        }

        int m;
        try {
            m = Integer.parseInt(header[1]);
        } catch (NumberFormatException e) {
            throw new IOException("Set count must be numeric or '*****', got: " + header[1]);
        }
        if (m < 0) throw new IOException("Set count must be non-negative, got: " + header[1]);
        for (int i = 0; i < m; i++) {
            line = nextNonEmpty(br);
            if (line == null) throw new IOException("Unexpected end of file while reading set " + i);
            parseRow(instance, line, i + 1);
        }
        line = nextNonEmpty(br);
        if (line == null || !line.equalsIgnoreCase("end"))
            throw new IOException("Expected 'end', got: " + line);
        return instance;
    }

    /** Writes the starred form accepted by {@link #read(Reader)}. */
    public void write(PrintWriter out) {
        out.println("begin");
        out.printf("%d *****%n", elementCount);
        for (int s = 0; s < sets.size(); s++) {
            StringBuilder sb = new StringBuilder();
            sb.append(costs.get(s));
            for (int e : sets.get(s)) sb.append(' ').append(e);
            out.println(sb);
        }
        out.println("end");
    }

    private static void parseRow(Instance instance, String line, int row) throws IOException {
        String[] tokens = line.split("\\s+");
        try {
            double cost = Double.parseDouble(tokens[0]);
            int[] elements = new int[tokens.length - 1];
            for (int j = 1; j < tokens.length; j++) elements[j - 1] = Integer.parseInt(tokens[j]);
            instance.addSet(cost, elements);
        } catch (NumberFormatException e) {
            throw new IOException("Malformed set on line " + row + ": " + line);
        }
    }

    /** Next line that is neither blank nor a comment, trimmed; null at end of input. */
    private static String nextNonEmpty(BufferedReader br) throws IOException {
        String line;
        do {
            line = br.readLine();
            if (line == null) return null;
            line = line.trim();
        } while (line.isEmpty() || line.startsWith("*") || line.startsWith("#"));
        return line;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Instance[elements=").append(elementCount).append(", sets=");
        for (int s = 0; s < sets.size(); s++) {
            if (s > 0) sb.append(", ");
            sb.append("S_").append(s).append('(').append(costs.get(s)).append(')')
              .append(Arrays.toString(sets.get(s)));
        }
        return sb.append(']').toString();
    }
}
