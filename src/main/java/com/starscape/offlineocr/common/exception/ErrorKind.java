package com.starscape.offlineocr.common.exception;

/**
 * Failure taxonomy shared by intake, the artifact cache and job execution.
 */
public enum ErrorKind {
    /** Malformed submission; rejected at intake, no job is created. */
    INVALID_INPUT,
    /** Corrupt or unreadable imported artifact; registry unchanged. */
    INVALID_ARTIFACT,
    /** Cache miss and the fetch failed. Job-fatal. */
    ARTIFACT_FETCH_FAILED,
    /** The document could not be interpreted. Job-fatal. */
    UNSUPPORTED_FORMAT,
    /** A single page failed; job-fatal only when no page could be recognized. */
    PAGE_RECOGNITION_FAILED,
    /** Stopped by request. */
    CANCELLED,
    /** Anything else caught at the job boundary. */
    INTERNAL
}
