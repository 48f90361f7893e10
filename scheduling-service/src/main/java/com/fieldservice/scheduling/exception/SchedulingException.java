package com.fieldservice.scheduling.exception;

public class SchedulingException extends RuntimeException {

    private final String code;

    public SchedulingException(String code, String message) {
        super(message);
        this.code = code;
    }

    public SchedulingException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
