package com.affinity.x.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when the viewer is authenticated but not allowed to see data about the candidate.
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class ForbiddenException extends ServiceException {

    public ForbiddenException(String message) {
        super(ErrorCode.NOT_MATCHED, HttpStatus.FORBIDDEN, message);
    }
}
