package com.affinity.x.service;

import com.affinity.x.cache.CandidateListCache;
import com.affinity.x.dto.BatchOptions;
import com.affinity.x.dto.BatchMetrics;
import com.affinity.x.dto.BatchResult;
import com.affinity.x.dto.BatchScoreResult;
import com.affinity.x.dto.CandidateFilters;
import com.affinity.x.dto.CandidateSummary;
import com.affinity.x.dto.CompatibilityDetails;
import com.affinity.x.dto.MatchResponse;
import com.affinity.x.dto.MonitoredCall;
import com.affinity.x.dto.PotentialMatchOptions;
import com.affinity.x.dto.PotentialMatchesResult;
import com.affinity.x.dto.ScoreResult;
import com.affinity.x.dto.SingleCompatibilityResult;
import com.affinity.x.dto.enums.TruncationPolicy;
import com.affinity.x.exceptions.BadRequestException;
import com.affinity.x.exceptions.ErrorCode;
import com.affinity.x.exceptions.ForbiddenException;
import com.affinity.x.monitoring.LatencyMonitor;
import com.affinity.x.repo.CandidateRepository;
import com.affinity.x.repo.MatchRelationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;


@Slf4j
@Service
public class MatchServiceImpl implements MatchService {
    private final CompatibilityScorer compatibilityScorer;
    private final BatchOrchestrator batchOrchestrator;
    private final CandidateRepository candidateRepository;
    private final CandidateListCache candidateListCache;
    private final MatchRelationRepository matchRelationRepository;
    private final LatencyMonitor latencyMonitor;
    private final int defaultLimit;
    private final int maxLimit;
    private final int defaultMinCompatibility;

    public MatchServiceImpl(
            CompatibilityScorer compatibilityScorer,
            BatchOrchestrator batchOrchestrator,
            CandidateRepository candidateRepository,
            CandidateListCache candidateListCache,
            MatchRelationRepository matchRelationRepository,
            LatencyMonitor latencyMonitor,
            @Value("${matching.potential-matches.default-limit:20}") int defaultLimit,
            @Value("${matching.potential-matches.max-limit:100}") int maxLimit,
            @Value("${matching.potential-matches.min-compatibility:60}") int defaultMinCompatibility
    ) {
        this.compatibilityScorer = compatibilityScorer;
        this.batchOrchestrator = batchOrchestrator;
        this.candidateRepository = candidateRepository;
        this.candidateListCache = candidateListCache;
        this.matchRelationRepository = matchRelationRepository;
        this.latencyMonitor = latencyMonitor;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
        this.defaultMinCompatibility = defaultMinCompatibility;
    }

    @Override
    public MatchResponse<SingleCompatibilityResult> getSingleCompatibility(UUID viewerId, UUID candidateId) {
        return latencyMonitor.monitor("single_compatibility", viewerId, () -> {
            requirePair(viewerId, candidateId);
            ScoreResult score = compatibilityScorer.score(viewerId, candidateId);
            return MonitoredCall.of(SingleCompatibilityResult.of(candidateId, score), false, 1);
        });
    }

    @Override
    public MatchResponse<BatchScoreResult> getBatchCompatibility(UUID viewerId, List<UUID> candidateIds, BatchOptions options) {
        return latencyMonitor.monitor("batch_compatibility", viewerId, () -> {
            BatchScoreResult result = batchOrchestrator.scoreBatch(viewerId, candidateIds, options);
            return MonitoredCall.of(result, false, result.getMetrics().getProcessed());
        });
    }

    @Override
    public MatchResponse<PotentialMatchesResult> getPotentialMatches(UUID viewerId, CandidateFilters filters, PotentialMatchOptions options) {
        return latencyMonitor.monitor("potential_matches", viewerId, () -> {
            if (viewerId == null) {
                throw new BadRequestException(ErrorCode.INVALID_INPUT, "Viewer id is required");
            }
            CandidateFilters effectiveFilters = filters == null ? CandidateFilters.none() : filters;
            effectiveFilters.validate();
            PotentialMatchOptions effectiveOptions = options == null ? PotentialMatchOptions.defaults() : options;
            int limit = resolveLimit(effectiveOptions.getLimit());
            int offset = resolveOffset(effectiveOptions.getOffset());

            int minCompatibility = effectiveOptions.getMinCompatibility() == null
                    ? defaultMinCompatibility : effectiveOptions.getMinCompatibility();
            // the threshold filters a pool of up to twice the page
            int fetchLimit = limit * 2;

            Optional<List<UUID>> cached = Boolean.FALSE.equals(effectiveOptions.getUseCache())
                    ? Optional.empty()
                    : readCandidateList(viewerId, effectiveFilters, limit, offset);
            boolean cacheUsed = cached.isPresent();
            List<UUID> candidateIds;
            if (cacheUsed) {
                candidateIds = cached.get();
            } else {
                candidateIds = candidateRepository.findCandidates(viewerId, effectiveFilters, fetchLimit, offset).stream()
                        .map(CandidateSummary::getId)
                        .toList();
                writeCandidateList(viewerId, effectiveFilters, limit, offset, candidateIds);
            }

            if (candidateIds.isEmpty()) {
                log.info("No potential matches for viewerId={} cacheUsed={}", viewerId, cacheUsed);
                PotentialMatchesResult empty = PotentialMatchesResult.builder()
                        .matches(List.of())
                        .metrics(BatchMetrics.builder().build())
                        .fromCache(cacheUsed)
                        .limit(limit)
                        .offset(offset)
                        .build();
                return MonitoredCall.of(empty, cacheUsed, 0);
            }

            BatchOptions batchOptions = BatchOptions.builder()
                    .maxBatchSize(effectiveOptions.getMaxBatchSize() == null ? candidateIds.size() : effectiveOptions.getMaxBatchSize())
                    .timeoutMs(effectiveOptions.getTimeoutMs())
                    .truncationPolicy(TruncationPolicy.TRUNCATE)
                    .build();
            BatchScoreResult scored = batchOrchestrator.scoreBatch(viewerId, candidateIds, batchOptions);
            List<BatchResult> matches = fillPage(scored.getResults(), minCompatibility, limit);

            PotentialMatchesResult result = PotentialMatchesResult.builder()
                    .matches(matches)
                    .metrics(scored.getMetrics())
                    .fromCache(cacheUsed)
                    .limit(limit)
                    .offset(offset)
                    .build();
            log.info("Served {} potential matches for viewerId={} cacheUsed={}", matches.size(), viewerId, cacheUsed);
            return MonitoredCall.of(result, cacheUsed, scored.getMetrics().getProcessed());
        });
    }

    @Override
    public MatchResponse<CompatibilityDetails> getCompatibilityDetails(UUID viewerId, UUID candidateId) {
        return latencyMonitor.monitor("compatibility_details", viewerId, () -> {
            requirePair(viewerId, candidateId);
            if (!matchRelationRepository.isActiveMatch(viewerId, candidateId)) {
                log.warn("Denied compatibility details for viewerId={} candidateId={}: not matched", viewerId, candidateId);
                throw new ForbiddenException("Compatibility details are only available for matched users");
            }
            ScoreResult score = compatibilityScorer.score(viewerId, candidateId);
            CompatibilityDetails details = CompatibilityDetails.builder()
                    .candidateId(candidateId)
                    .overallPercentage(score.getCombinedScore())
                    .astrological(CompatibilityDetails.GradeDetail.of(score.getAstrologicalGrade()))
                    .questionnaire(CompatibilityDetails.GradeDetail.of(score.getQuestionnaireGrade()))
                    .build();
            return MonitoredCall.of(details, false, 1);
        });
    }

    private void requirePair(UUID viewerId, UUID candidateId) {
        if (viewerId == null) {
            throw new BadRequestException(ErrorCode.INVALID_INPUT, "Viewer id is required");
        }
        if (candidateId == null) {
            throw new BadRequestException(ErrorCode.MISSING_CANDIDATE_IDS, "Candidate id is required");
        }
        if (viewerId.equals(candidateId)) {
            throw new BadRequestException(ErrorCode.SELF_COMPARISON, "Cannot score a viewer against themselves");
        }
    }

    private int resolveLimit(Integer requested) {
        if (requested == null) {
            return defaultLimit;
        }
        if (requested <= 0) {
            throw new BadRequestException(ErrorCode.INVALID_INPUT, "limit must be positive");
        }
        return Math.min(requested, maxLimit);
    }

    private int resolveOffset(Integer requested) {
        if (requested == null) {
            return 0;
        }
        if (requested < 0) {
            throw new BadRequestException(ErrorCode.INVALID_INPUT, "offset must not be negative");
        }
        return requested;
    }

    private Optional<List<UUID>> readCandidateList(UUID viewerId, CandidateFilters filters, int limit, int offset) {
        try {
            return candidateListCache.get(viewerId, filters, limit, offset);
        } catch (RuntimeException e) {
            log.warn("Candidate list cache read failed for viewerId={}, querying repository: {}", viewerId, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCandidateList(UUID viewerId, CandidateFilters filters, int limit, int offset, List<UUID> candidateIds) {
        if (candidateIds.isEmpty()) {
            return;
        }
        try {
            candidateListCache.put(viewerId, filters, limit, offset, candidateIds, candidateListCache.defaultTtl());
        } catch (RuntimeException e) {
            log.warn("Candidate list cache write failed for viewerId={}: {}", viewerId, e.getMessage());
        }
    }

    private static List<BatchResult> fillPage(List<BatchResult> results, int minCompatibility, int limit) {
        return results.stream()
                .filter(result -> result.getCombinedScore() >= minCompatibility)
                .limit(limit)
                .toList();
    }
}
