package com.di.silverline.coordinator;

/**
 * Result of one table within one run.
 */
public enum OutcomeStatus {
    /** The strategy ran; rows_affected may be 0 when nothing was new. */
    SUCCESS,
    /** Nothing to do: no files for the date, or no strategy configured for the table. */
    SKIPPED,
    /** A step failed; see errorKind and errorDetail. */
    FAILED
}
