package com.affinity.x.monitoring;

import com.affinity.x.dto.MatchResponse;
import com.affinity.x.dto.MonitoredCall;
import com.affinity.x.dto.PerformanceBlock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Times matching operations against a latency target and wraps their results in the response envelope.
 * <p>
 * The target is an observability threshold, not a deadline: a slow call is logged, counted and
 * flagged in its performance block, and its result is still returned. Failures of the
 * timing side channel are logged and never reach the caller.
 * </p>
 */
@Slf4j
@Component
public class LatencyMonitor {
    private final MeterRegistry meterRegistry;
    private final long targetMs;

    public LatencyMonitor(MeterRegistry meterRegistry, @Value("${matching.latency.target-ms:500}") long targetMs) {
        this.meterRegistry = meterRegistry;
        this.targetMs = targetMs;
    }

    public <T> MatchResponse<T> monitor(String operation, UUID viewerId, Supplier<MonitoredCall<T>> call) {
        Timer.Sample sample = Timer.start(meterRegistry);
        MonitoredCall<T> result;
        try {
            result = call.get();
        } catch (RuntimeException e) {
            long elapsedMs = stop(sample, operation, "error");
            log.warn("operation={} failed for viewerId={} after {}ms: {}", operation, viewerId, elapsedMs, e.getMessage());
            throw e;
        }

        long elapsedMs = stop(sample, operation, "success");
        PerformanceBlock performance = PerformanceBlock.builder()
                .responseTimeMs(elapsedMs)
                .cacheUsed(result.isCacheUsed())
                .batchSize(result.getBatchSize())
                .build();
        if (elapsedMs > targetMs) {
            performance.setPerformanceWarning(String.format("Response time %dms exceeded target %dms", elapsedMs, targetMs));
            reportSlow(operation, viewerId, elapsedMs, result);
        } else {
            log.debug("operation={} viewerId={} completed in {}ms cacheUsed={} batchSize={}",
                    operation, viewerId, elapsedMs, result.isCacheUsed(), result.getBatchSize());
        }
        return MatchResponse.ok(result.getData(), performance);
    }

    private long stop(Timer.Sample sample, String operation, String outcome) {
        try {
            long nanos = sample.stop(meterRegistry.timer("match_request_duration", "operation", operation, "outcome", outcome));
            return TimeUnit.NANOSECONDS.toMillis(nanos);
        } catch (RuntimeException e) {
            log.debug("Failed to record latency for operation={}: {}", operation, e.getMessage());
            return 0L;
        }
    }

    private void reportSlow(String operation, UUID viewerId, long elapsedMs, MonitoredCall<?> result) {
        try {
            log.warn("Slow request operation={} viewerId={} elapsedMs={} targetMs={} cacheUsed={} batchSize={}",
                    operation, viewerId, elapsedMs, targetMs, result.isCacheUsed(), result.getBatchSize());
            meterRegistry.counter("match_slow_requests", "operation", operation).increment();
        } catch (RuntimeException e) {
            log.debug("Failed to report slow request for operation={}: {}", operation, e.getMessage());
        }
    }
}
