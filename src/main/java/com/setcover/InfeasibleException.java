package com.setcover;

/** Some element is contained in no set, so no cover exists. */
public class InfeasibleException extends SetCoverException {
    private final int element;

    public InfeasibleException(int element) {
        super("Infeasible! element " + element + " is covered by no set");
        this.element = element;
    }

    /** Index of the first uncoverable element in processing order. */
    public int element() { return element; }
}
