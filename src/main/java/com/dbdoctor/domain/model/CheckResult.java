package com.dbdoctor.domain.model;

/**
 * Terminal status of one health check run.
 */
public enum CheckResult {
    /** Nothing found, or everything found was resolved. */
    OK,
    /** The operator or the mode stopped before everything was resolved. */
    ABORTED
}
