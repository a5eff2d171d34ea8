package fr.lapetina.ocr.scheduler.domain.exception;

import fr.lapetina.ocr.scheduler.domain.model.ErrorType;

import java.io.IOException;

/**
 * Job storage or token persistence could not be read or written.
 */
public final class StorageException extends SchedulerException {

    public StorageException(String message, IOException cause) {
        super(ErrorType.STORAGE_ERROR, message + ": " + cause.getMessage(), cause);
    }
}
