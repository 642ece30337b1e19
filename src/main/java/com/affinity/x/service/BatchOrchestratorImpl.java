package com.affinity.x.service;

import com.affinity.x.dto.BatchMetrics;
import com.affinity.x.dto.BatchOptions;
import com.affinity.x.dto.BatchResult;
import com.affinity.x.dto.BatchScoreResult;
import com.affinity.x.dto.enums.TruncationPolicy;
import com.affinity.x.exceptions.BadRequestException;
import com.affinity.x.exceptions.ErrorCode;
import com.affinity.x.exceptions.ServiceException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;


@Slf4j
@Service
public class BatchOrchestratorImpl implements BatchOrchestrator {
    private final CompatibilityScorer compatibilityScorer;
    private final ExecutorService scoringExecutor;
    private final MeterRegistry meterRegistry;
    private final int defaultMaxBatchSize;
    private final int hardMaxBatchSize;
    private final long defaultTaskTimeoutMs;
    private final int fallbackScore;

    public BatchOrchestratorImpl(
            CompatibilityScorer compatibilityScorer,
            @Qualifier("scoringExecutor") ExecutorService scoringExecutor,
            MeterRegistry meterRegistry,
            @Value("${matching.batch.default-max-size:50}") int defaultMaxBatchSize,
            @Value("${matching.batch.hard-max-size:100}") int hardMaxBatchSize,
            @Value("${matching.batch.task-timeout-ms:1000}") long defaultTaskTimeoutMs,
            @Value("${matching.batch.fallback-score:50}") int fallbackScore
    ) {
        this.compatibilityScorer = compatibilityScorer;
        this.scoringExecutor = scoringExecutor;
        this.meterRegistry = meterRegistry;
        this.defaultMaxBatchSize = defaultMaxBatchSize;
        this.hardMaxBatchSize = hardMaxBatchSize;
        this.defaultTaskTimeoutMs = defaultTaskTimeoutMs;
        this.fallbackScore = fallbackScore;
    }

    @Override
    public BatchScoreResult scoreBatch(UUID viewerId, List<UUID> candidateIds, BatchOptions options) {
        validate(viewerId, candidateIds);
        BatchOptions effective = options == null ? BatchOptions.defaults() : options;
        int maxBatchSize = resolveMaxBatchSize(effective.getMaxBatchSize());
        long timeoutMs = effective.getTimeoutMs() == null || effective.getTimeoutMs() <= 0
                ? defaultTaskTimeoutMs : effective.getTimeoutMs();
        TruncationPolicy policy = effective.getTruncationPolicy() == null
                ? TruncationPolicy.TRUNCATE : effective.getTruncationPolicy();

        List<UUID> toProcess = candidateIds;
        boolean truncated = false;
        if (candidateIds.size() > maxBatchSize) {
            if (policy == TruncationPolicy.REJECT) {
                throw new BadRequestException(ErrorCode.BATCH_TOO_LARGE,
                        String.format("Batch of %d candidates exceeds the maximum of %d", candidateIds.size(), maxBatchSize));
            }
            toProcess = List.copyOf(candidateIds.subList(0, maxBatchSize));
            truncated = true;
            log.info("Truncated batch for viewerId={} from {} to {} candidates", viewerId, candidateIds.size(), maxBatchSize);
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        Map<UUID, CompletableFuture<BatchResult>> tasks = new LinkedHashMap<>();
        for (UUID candidateId : toProcess) {
            tasks.computeIfAbsent(candidateId, id -> launch(viewerId, id, timeoutMs));
        }
        CompletableFuture.allOf(tasks.values().toArray(new CompletableFuture[0])).join();

        List<BatchResult> results = toProcess.stream()
                .map(candidateId -> tasks.get(candidateId).join())
                .toList();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(sample.stop(meterRegistry.timer("batch_scoring_duration")));

        int fallbacks = (int) results.stream().filter(BatchResult::isFallback).count();
        BatchMetrics metrics = BatchMetrics.builder()
                .requested(candidateIds.size())
                .processed(results.size())
                .succeeded(results.size() - fallbacks)
                .fallbacks(fallbacks)
                .elapsedMs(elapsedMs)
                .truncated(truncated)
                .build();
        log.info("Scored batch for viewerId={} processed={} succeeded={} fallbacks={} elapsedMs={}",
                viewerId, metrics.getProcessed(), metrics.getSucceeded(), fallbacks, elapsedMs);
        return BatchScoreResult.builder().results(results).metrics(metrics).build();
    }

    private void validate(UUID viewerId, List<UUID> candidateIds) {
        if (viewerId == null) {
            throw new BadRequestException(ErrorCode.INVALID_INPUT, "Viewer id is required");
        }
        if (candidateIds == null || candidateIds.isEmpty()) {
            throw new BadRequestException(ErrorCode.MISSING_CANDIDATE_IDS, "At least one candidate id is required");
        }
        if (candidateIds.stream().anyMatch(Objects::isNull)) {
            throw new BadRequestException(ErrorCode.INVALID_INPUT, "Candidate ids must not be null");
        }
        if (candidateIds.contains(viewerId)) {
            throw new BadRequestException(ErrorCode.SELF_COMPARISON, "Cannot score a viewer against themselves");
        }
    }

    private int resolveMaxBatchSize(Integer requested) {
        if (requested == null) {
            return Math.min(defaultMaxBatchSize, hardMaxBatchSize);
        }
        if (requested <= 0) {
            throw new BadRequestException(ErrorCode.INVALID_INPUT, "max_batch_size must be positive");
        }
        return Math.min(requested, hardMaxBatchSize);
    }

    // an abandoned task keeps its executor thread until the scorer returns
    private CompletableFuture<BatchResult> launch(UUID viewerId, UUID candidateId, long timeoutMs) {
        return CompletableFuture
                .supplyAsync(() -> BatchResult.scored(candidateId, compatibilityScorer.score(viewerId, candidateId)), scoringExecutor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(t -> fallback(viewerId, candidateId, t));
    }

    private BatchResult fallback(UUID viewerId, UUID candidateId, Throwable throwable) {
        Throwable cause = unwrap(throwable);
        ErrorCode code;
        if (cause instanceof TimeoutException) {
            code = ErrorCode.SCORING_TIMEOUT;
        } else if (cause instanceof ServiceException serviceException) {
            code = serviceException.getErrorCode();
        } else {
            code = ErrorCode.SCORING_FAILED;
        }
        meterRegistry.counter("batch_scoring_fallbacks", "reason", code.name()).increment();
        log.warn("Fallback score for viewerId={} candidateId={} code={}: {}", viewerId, candidateId, code, cause.getMessage());
        return BatchResult.fallback(candidateId, fallbackScore, code, fallbackMessage(code));
    }

    // client-facing text; the detailed cause stays in the log
    private static String fallbackMessage(ErrorCode code) {
        return switch (code) {
            case SCORING_TIMEOUT -> "Scoring did not complete in time";
            case INSUFFICIENT_DATA -> "Not enough profile data to score this candidate";
            case PROFILE_NOT_FOUND -> "Candidate profile not found";
            default -> "Scoring failed";
        };
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
