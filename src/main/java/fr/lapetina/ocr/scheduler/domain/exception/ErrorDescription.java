package fr.lapetina.ocr.scheduler.domain.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.ocr.scheduler.domain.model.ErrorType;

/**
 * Stable, serializable form of a failure: its kind and a human-readable message.
 */
public record ErrorDescription(
        @JsonProperty("kind") ErrorType kind,
        @JsonProperty("message") String message
) {

    /**
     * Describes any throwable, typing unknown failures as {@link ErrorType#INTERNAL_ERROR}.
     */
    public static ErrorDescription of(Throwable error) {
        if (error instanceof SchedulerException se) {
            return se.describe();
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            message = error.getClass().getSimpleName();
        }
        return new ErrorDescription(ErrorType.INTERNAL_ERROR, message);
    }
}
