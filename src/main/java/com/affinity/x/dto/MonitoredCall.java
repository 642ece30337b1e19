package com.affinity.x.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of a monitored operation together with what the latency log needs to know about it.
 */
@Getter
@AllArgsConstructor
public class MonitoredCall<T> {
    private final T data;
    private final boolean cacheUsed;
    private final Integer batchSize;

    public static <T> MonitoredCall<T> of(T data) {
        return new MonitoredCall<>(data, false, null);
    }

    public static <T> MonitoredCall<T> of(T data, boolean cacheUsed, Integer batchSize) {
        return new MonitoredCall<>(data, cacheUsed, batchSize);
    }
}
