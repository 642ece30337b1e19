package com.affinity.x.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.UNAUTHORIZED)
public class UnauthorizedException extends ServiceException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHENTICATED, HttpStatus.UNAUTHORIZED, message);
    }
}
