package fr.lapetina.ocr.scheduler.domain.exception;

import fr.lapetina.ocr.scheduler.domain.model.ErrorType;

/**
 * A path resolved outside the trusted storage root.
 */
public final class PathViolationException extends SchedulerException {

    public PathViolationException(String message) {
        super(ErrorType.PATH_VIOLATION, message);
    }
}
