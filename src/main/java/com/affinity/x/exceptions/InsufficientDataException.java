package com.affinity.x.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Birth data or questionnaire answers are missing for one side of a pair, so no grade can be
 * computed. Reported explicitly for single requests; turned into a fallback score in batches.
 */
@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class InsufficientDataException extends ServiceException {

    public InsufficientDataException(String message) {
        super(ErrorCode.INSUFFICIENT_DATA, HttpStatus.UNPROCESSABLE_ENTITY, message);
    }
}
