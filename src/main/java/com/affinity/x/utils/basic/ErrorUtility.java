package com.affinity.x.utils.basic;

import com.affinity.x.exceptions.ErrorCode;
import com.affinity.x.models.Error;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.UUID;

public final class ErrorUtility {

    private ErrorUtility() {
        throw new UnsupportedOperationException("Not supported");
    }

    /**
     * Builds the client-facing error body.
     *
     * @param code     the stable error code
     * @param errorMsg the client-safe message
     * @param status   the status the error is reported with
     * @return the error, stamped with a fresh uid and the current instant
     */
    public static Error getError(ErrorCode code, String errorMsg, HttpStatus status) {
        return Error.builder()
                .uid(UUID.randomUUID().toString())
                .code(code)
                .status(status.value())
                .timestamp(Instant.now())
                .errorMsg(errorMsg)
                .build();
    }
}
