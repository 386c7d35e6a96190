package com.setcover;

public final class SolverOptions {
    // output flags
    public final boolean printDual;         // per-element dual values
    public final boolean printStats;        // *Totals line
    public final boolean printTime;         // elapsed wall time

    private SolverOptions(Builder b) {
        this.printDual = b.printDual;
        this.printStats = b.printStats;
        this.printTime = b.printTime;
    }

    public static final class Builder {
        private boolean printDual, printStats, printTime;

        public Builder printDual(boolean v){ this.printDual=v; return this; }
        public Builder printStats(boolean v){ this.printStats=v; return this; }
        public Builder printTime(boolean v){ this.printTime=v; return this; }
        public SolverOptions build(){ return new SolverOptions(this); }
    }
}
