package fr.lapetina.ocr.scheduler.domain.exception;

import fr.lapetina.ocr.scheduler.domain.model.ErrorType;

/**
 * Publishing a job's results to the configured backend failed.
 */
public final class PublishException extends SchedulerException {

    public PublishException(String message, Throwable cause) {
        super(ErrorType.PUBLISH_ERROR, message + ": " + cause.getMessage(), cause);
    }
}
