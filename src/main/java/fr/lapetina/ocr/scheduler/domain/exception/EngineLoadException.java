package fr.lapetina.ocr.scheduler.domain.exception;

import fr.lapetina.ocr.scheduler.domain.model.ErrorType;

/**
 * Neither the primary nor the fallback backend could be constructed.
 */
public final class EngineLoadException extends SchedulerException {

    public EngineLoadException(String message, Throwable cause) {
        super(ErrorType.ENGINE_LOAD_ERROR, message, cause);
    }
}
