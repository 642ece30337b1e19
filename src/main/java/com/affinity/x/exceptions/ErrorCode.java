package com.affinity.x.exceptions;

/**
 * Stable, client-facing error identifiers. Names are part of the API contract.
 */
public enum ErrorCode {
    INVALID_INPUT,
    MISSING_CANDIDATE_IDS,
    SELF_COMPARISON,
    BATCH_TOO_LARGE,
    LOCATION_UNAVAILABLE,
    UNAUTHENTICATED,
    NOT_MATCHED,
    PROFILE_NOT_FOUND,
    INSUFFICIENT_DATA,
    SCORING_FAILED,
    SCORING_TIMEOUT,
    CANDIDATE_QUERY_FAILED,
    INTERNAL_ERROR
}
