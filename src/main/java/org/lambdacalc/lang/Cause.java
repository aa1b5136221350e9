package org.lambdacalc.lang;

/**
 * Reason a computation failed. Carried by {@link Result} instead of an exception.
 */
public interface Cause {
    /**
     * Human-readable description of the failure.
     */
    String message();
}
