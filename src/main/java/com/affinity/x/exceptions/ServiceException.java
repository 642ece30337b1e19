package com.affinity.x.exceptions;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base for every exception that is allowed to reach the client as a structured error.
 * <p>
 * Carries a stable {@link ErrorCode} and the HTTP status the error is reported with.
 * The message must be safe to show to a client.
 * </p>
 */
@Getter
public abstract class ServiceException extends RuntimeException {
    private final ErrorCode errorCode;
    private final HttpStatus status;

    protected ServiceException(ErrorCode errorCode, HttpStatus status, String message) {
        super(message);
        this.errorCode = errorCode;
        this.status = status;
    }

    protected ServiceException(ErrorCode errorCode, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.status = status;
    }
}
