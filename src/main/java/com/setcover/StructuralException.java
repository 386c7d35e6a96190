package com.setcover;

/**
 * Instance data is internally inconsistent: costs and sets are misaligned,
 * a set names an element outside {@code [0, elementCount)}, or a cost is
 * negative or not finite. Raised by {@link Instance#validate()} before any
 * dual growth happens.
 */
public class StructuralException extends SetCoverException {
    public StructuralException(String message) {
        super(message);
    }
}
