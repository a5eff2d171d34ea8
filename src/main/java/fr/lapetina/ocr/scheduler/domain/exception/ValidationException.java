package fr.lapetina.ocr.scheduler.domain.exception;

import fr.lapetina.ocr.scheduler.domain.model.ErrorType;

/**
 * Input rejected before any engine work: oversized upload, too many pages,
 * unreadable source or malformed options.
 */
public final class ValidationException extends SchedulerException {

    public ValidationException(String message) {
        super(ErrorType.VALIDATION_ERROR, message);
    }

    public ValidationException(ErrorType errorType, String message) {
        super(errorType, message);
    }

    public ValidationException(ErrorType errorType, String message, Throwable cause) {
        super(errorType, message, cause);
    }

    public static ValidationException sizeLimit(long limitBytes) {
        return new ValidationException(ErrorType.SIZE_LIMIT,
                "File exceeds size limit of " + (limitBytes / (1024 * 1024)) + " MB");
    }

    public static ValidationException pageLimit(int pages, int maxPages) {
        return new ValidationException(ErrorType.PAGE_LIMIT,
                "Document has " + pages + " pages, limit is " + maxPages);
    }
}
