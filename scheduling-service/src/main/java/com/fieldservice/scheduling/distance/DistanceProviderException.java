package com.fieldservice.scheduling.distance;

public class DistanceProviderException extends RuntimeException {

    public DistanceProviderException(String message) {
        super(message);
    }

    public DistanceProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
