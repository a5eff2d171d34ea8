package fr.lapetina.ocr.scheduler.domain.exception;

import fr.lapetina.ocr.scheduler.domain.model.ErrorType;

/**
 * The task exists but its state does not allow the requested operation.
 */
public final class TaskStateException extends SchedulerException {

    public TaskStateException(String message) {
        super(ErrorType.CONFLICT, message);
    }
}
