package com.raditha.extract.validation;

/**
 * Outcome of one syntax gate stage.
 */
public enum StageStatus {
    /** The scaffold parsed cleanly. */
    ACCEPTED,
    /** The minimal scaffold failed; a richer one may still succeed. */
    RETRY_ADVISED,
    /** Errors remain after filtering the expected ones. */
    REJECTED,
    /** The stage could not run. */
    SKIPPED
}
