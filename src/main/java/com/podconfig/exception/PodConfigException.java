package com.podconfig.exception;

/**
 * Base exception for pod configuration handling.
 */
public class PodConfigException extends RuntimeException {

    public PodConfigException(String message) {
        super(message);
    }

    public PodConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
