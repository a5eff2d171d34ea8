package fr.lapetina.ocr.scheduler.domain.exception;

import fr.lapetina.ocr.scheduler.domain.model.ErrorType;

/**
 * Request carried no usable API key ({@link ErrorType#UNAUTHORIZED}) or an unknown one
 * ({@link ErrorType#FORBIDDEN}).
 */
public final class AuthenticationException extends SchedulerException {

    private AuthenticationException(ErrorType errorType, String message) {
        super(errorType, message);
    }

    public static AuthenticationException unauthorized(String message) {
        return new AuthenticationException(ErrorType.UNAUTHORIZED, message);
    }

    public static AuthenticationException forbidden(String message) {
        return new AuthenticationException(ErrorType.FORBIDDEN, message);
    }
}
