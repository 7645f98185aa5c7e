package com.cyberx.vpnpool.api.exception;

/**
 * Exception thrown when a caller supplies an invalid argument, e.g. an unknown
 * assignment type or a blank naming pattern. Mapped to HTTP 400.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
