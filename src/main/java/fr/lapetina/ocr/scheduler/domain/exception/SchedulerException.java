package fr.lapetina.ocr.scheduler.domain.exception;

import fr.lapetina.ocr.scheduler.domain.model.ErrorType;

/**
 * Base class for every typed failure raised by the scheduler.
 * Callers branch on {@link #getErrorType()} rather than on the message text.
 */
public abstract class SchedulerException extends RuntimeException {

    private final ErrorType errorType;

    protected SchedulerException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected SchedulerException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public ErrorDescription describe() {
        return new ErrorDescription(errorType, getMessage());
    }
}
