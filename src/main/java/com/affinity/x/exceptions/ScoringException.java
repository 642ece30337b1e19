package com.affinity.x.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A grading collaborator failed while scoring a pair.
 */
@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class ScoringException extends ServiceException {

    public ScoringException(String message) {
        super(ErrorCode.SCORING_FAILED, HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public ScoringException(String message, Throwable cause) {
        super(ErrorCode.SCORING_FAILED, HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
