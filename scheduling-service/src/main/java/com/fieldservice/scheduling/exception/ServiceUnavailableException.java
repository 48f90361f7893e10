package com.fieldservice.scheduling.exception;

/**
 * The request could not be served right now: kill switch on, or the
 * recommendation batch timed out or was cancelled.
 */
public class ServiceUnavailableException extends SchedulingException {

    public ServiceUnavailableException(String code, String message) {
        super(code, message);
    }

    public ServiceUnavailableException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
