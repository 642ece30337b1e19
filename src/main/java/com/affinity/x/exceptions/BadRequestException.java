package com.affinity.x.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Custom exception thrown when a bad request is made (HTTP 400).
 * <p>
 * Signals malformed filters, self-comparison, missing ids or an oversized batch. Requests failing
 * this way are rejected before any computation is attempted.
 * </p>
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class BadRequestException extends ServiceException {

    /**
     * Constructs a new BadRequestException with the generic input error code.
     *
     * @param message the detail message which explains the cause of the exception.
     */
    public BadRequestException(String message) {
        this(ErrorCode.INVALID_INPUT, message);
    }

    /**
     * Constructs a new BadRequestException with a specific error code.
     *
     * @param errorCode the stable code reported to the client.
     * @param message   the detail message which explains the cause of the exception.
     */
    public BadRequestException(ErrorCode errorCode, String message) {
        super(errorCode, HttpStatus.BAD_REQUEST, message);
    }
}
