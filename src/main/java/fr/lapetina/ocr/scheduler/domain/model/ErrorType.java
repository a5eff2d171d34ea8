package fr.lapetina.ocr.scheduler.domain.model;

/**
 * Error taxonomy for job admission and execution.
 * Every failure surfaced to a caller or written to a status file carries one of these kinds.
 */
public enum ErrorType {
    /** Job queue is at capacity, submission rejected */
    QUEUE_FULL,

    /** Per-client request rate exceeded */
    RATE_LIMITED,

    /** Malformed input or options */
    VALIDATION_ERROR,

    /** Input exceeds the configured size ceiling */
    SIZE_LIMIT,

    /** Document exceeds the configured page ceiling */
    PAGE_LIMIT,

    /** Timed out waiting for the engine lock or a memory slot */
    TIMEOUT,

    /** Engine could not be constructed on any backend */
    ENGINE_LOAD_ERROR,

    /** Engine failed while converting a document */
    ENGINE_ERROR,

    /** Reading or writing job storage failed */
    STORAGE_ERROR,

    /** Publishing results to the configured backend failed */
    PUBLISH_ERROR,

    /** Download token unknown, expired or exhausted */
    TOKEN_INVALID,

    /** Path resolved outside the trusted storage root */
    PATH_VIOLATION,

    /** Missing or malformed API key */
    UNAUTHORIZED,

    /** API key not accepted */
    FORBIDDEN,

    /** Task or artifact does not exist */
    NOT_FOUND,

    /** Operation conflicts with the task's current state */
    CONFLICT,

    /** Internal system error */
    INTERNAL_ERROR
}
