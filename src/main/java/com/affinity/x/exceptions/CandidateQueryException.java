package com.affinity.x.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The candidate pool could not be queried. Always fatal to the request that needed it.
 */
@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class CandidateQueryException extends ServiceException {

    public CandidateQueryException(String message, Throwable cause) {
        super(ErrorCode.CANDIDATE_QUERY_FAILED, HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
