package com.raditha.extract.util;

/**
 * Thrown when a caller cancels an analysis. This is an outcome, not a validation failure,
 * and is never converted into an error message.
 */
public class ExtractionCancelledException extends RuntimeException {

    public ExtractionCancelledException(String message) {
        super(message);
    }
}
