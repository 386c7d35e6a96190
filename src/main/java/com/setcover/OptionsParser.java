package com.setcover;

public final class OptionsParser {

    public static final class Parsed {
        public final SolverOptions options;
        public final String inputPath;      // null: built-in example
        private Parsed(SolverOptions o, String p){ options=o; inputPath=p; }
    }

    private OptionsParser(){}

    public static Parsed parse(String[] args){
        SolverOptions.Builder b = new SolverOptions.Builder();
        String input = null;

        for (String a : args) {
            switch (a) {
                case "-dual": b.printDual(true); break;
                case "-stats": b.printStats(true); break;
                case "-time": b.printTime(true); break;
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (input != null) throw new IllegalArgumentException("Multiple inputs: " + a);
                    input = a;
            }
        }
        return new Parsed(b.build(), input);
    }
}
