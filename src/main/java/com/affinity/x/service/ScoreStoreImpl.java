package com.affinity.x.service;

import com.affinity.x.dto.ScoreResult;
import com.affinity.x.models.CompatibilityScoreEntity;
import com.affinity.x.repo.CompatibilityScoreRepository;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;


@Slf4j
@Service
public class ScoreStoreImpl implements ScoreStore {
    private final CompatibilityScoreRepository compatibilityScoreRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration retention;

    public ScoreStoreImpl(
            CompatibilityScoreRepository compatibilityScoreRepository,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${matching.score-store.retention-hours:24}") long retentionHours
    ) {
        this.compatibilityScoreRepository = compatibilityScoreRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.retention = Duration.ofHours(retentionHours);
    }

    @CircuitBreaker(name = "scoreStore", fallbackMethod = "saveFallback")
    @Override
    public void save(UUID viewerId, UUID candidateId, ScoreResult score) {
        Instant now = clock.instant();
        CompatibilityScoreEntity entity = CompatibilityScoreEntity.builder()
                .viewerId(viewerId)
                .candidateId(candidateId)
                .astrologicalGrade(score.getAstrologicalGrade())
                .questionnaireGrade(score.getQuestionnaireGrade())
                .combinedScore(score.getCombinedScore())
                .breakdown(score.getBreakdown())
                .computedAt(now)
                .expiresAt(now.plus(retention))
                .build();
        compatibilityScoreRepository.save(entity);
        meterRegistry.counter("score_store_writes").increment();
        log.debug("Stored score={} for viewerId={} candidateId={} until {}", score.getCombinedScore(), viewerId, candidateId, entity.getExpiresAt());
    }

    public void saveFallback(UUID viewerId, UUID candidateId, ScoreResult score, Throwable t) {
        log.warn("Score store unavailable, skipping write for viewerId={} candidateId={}: {}", viewerId, candidateId, t.getMessage());
        meterRegistry.counter("score_store_errors").increment();
    }
}
