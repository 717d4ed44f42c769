package io.sortview.core;

/**
 * Raised when a sorted projection detects that its internal bookkeeping no longer
 * agrees with its source, typically because the source reported an inconsistent splice.
 */
public class SortViewException extends RuntimeException {

    public SortViewException(String message) {
        super(message);
    }

}
