package com.railplan.pipeline;

/** What happened to the optimization oracle's contribution in a pipeline run. */
public enum OracleOutcome {
    /** The oracle was not requested or none is configured. */
    DISABLED,
    /** There were no conflicts to send. */
    NOT_NEEDED,
    /** The oracle failed, timed out or reported failure; the run continued locally. */
    FAILED,
    /** The proposals were below the confidence threshold and ignored. */
    REJECTED_LOW_CONFIDENCE,
    /** The proposals made things worse and were undone. */
    ROLLED_BACK,
    APPLIED
}
