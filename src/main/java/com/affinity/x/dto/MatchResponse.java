package com.affinity.x.dto;

import com.affinity.x.models.Error;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope returned by every matching operation, successful or not.
 */
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MatchResponse<T> {
    private boolean success;
    private T data;
    private Error error;
    private PerformanceBlock performance;

    public static <T> MatchResponse<T> ok(T data, PerformanceBlock performance) {
        return new MatchResponse<>(true, data, null, performance);
    }

    public static <T> MatchResponse<T> failure(Error error, PerformanceBlock performance) {
        return new MatchResponse<>(false, null, error, performance);
    }
}
