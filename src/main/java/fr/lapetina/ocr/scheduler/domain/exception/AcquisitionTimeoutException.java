package fr.lapetina.ocr.scheduler.domain.exception;

import fr.lapetina.ocr.scheduler.domain.model.ErrorType;

import java.time.Duration;

/**
 * The engine could not be acquired within the caller's deadline, either because
 * another caller held the inference lock or the memory gate stayed closed.
 */
public final class AcquisitionTimeoutException extends SchedulerException {

    private final Duration timeout;

    public AcquisitionTimeoutException(String message, Duration timeout) {
        super(ErrorType.TIMEOUT, message + " (timeout=" + timeout.toSeconds() + "s)");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
