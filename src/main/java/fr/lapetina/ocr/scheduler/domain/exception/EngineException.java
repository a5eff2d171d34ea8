package fr.lapetina.ocr.scheduler.domain.exception;

import fr.lapetina.ocr.scheduler.domain.model.ErrorType;

/**
 * An inference call failed. Engines may throw this directly; any other
 * runtime failure from an engine is wrapped into it by the pipeline.
 */
public final class EngineException extends SchedulerException {

    public EngineException(String message) {
        super(ErrorType.ENGINE_ERROR, message);
    }

    public EngineException(String message, Throwable cause) {
        super(ErrorType.ENGINE_ERROR, message, cause);
    }
}
