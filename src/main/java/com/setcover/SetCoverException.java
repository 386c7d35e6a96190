package com.setcover;

/** Base class for failures that leave a solve call without a cover. */
public class SetCoverException extends RuntimeException {
    public SetCoverException(String message) {
        super(message);
    }
}
