package com.affinity.x.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ProfileNotFoundException extends ServiceException {

    public ProfileNotFoundException(UUID profileId) {
        super(ErrorCode.PROFILE_NOT_FOUND, HttpStatus.NOT_FOUND, "Profile not found: " + profileId);
    }
}
