package fr.lapetina.ocr.scheduler.domain.exception;

import fr.lapetina.ocr.scheduler.domain.model.ErrorType;

/**
 * Exception thrown when a submission is refused at admission.
 *
 * This occurs when:
 * - The job queue is at capacity
 * - The caller exceeded its request rate
 *
 * The job is never created in either case.
 */
public final class BackpressureException extends SchedulerException {

    private final BackpressureReason reason;

    public BackpressureException(BackpressureReason reason) {
        super(reason.getErrorType(), "Backpressure: " + reason.getMessage());
        this.reason = reason;
    }

    public BackpressureException(BackpressureReason reason, String details) {
        super(reason.getErrorType(), "Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public enum BackpressureReason {
        QUEUE_FULL("Job queue is full", ErrorType.QUEUE_FULL),
        RATE_LIMITED("Request rate limit exceeded", ErrorType.RATE_LIMITED);

        private final String message;
        private final ErrorType errorType;

        BackpressureReason(String message, ErrorType errorType) {
            this.message = message;
            this.errorType = errorType;
        }

        public String getMessage() {
            return message;
        }

        public ErrorType getErrorType() {
            return errorType;
        }
    }
}
