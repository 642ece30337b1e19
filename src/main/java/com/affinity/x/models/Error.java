package com.affinity.x.models;

import com.affinity.x.exceptions.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Error body of a failed {@code MatchResponse}. {@code uid} ties the response to the server log line.
 */
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class Error {
    private String uid;
    private ErrorCode code;
    private int status;
    private Instant timestamp;
    private String errorMsg;
}
