package com.affinity.x.service;

import com.affinity.x.cache.CandidateListCache;
import com.affinity.x.dto.BatchMetrics;
import com.affinity.x.dto.BatchOptions;
import com.affinity.x.dto.BatchResult;
import com.affinity.x.dto.BatchScoreResult;
import com.affinity.x.dto.CandidateFilters;
import com.affinity.x.dto.CandidateSummary;
import com.affinity.x.dto.CompatibilityDetails;
import com.affinity.x.dto.MatchResponse;
import com.affinity.x.dto.PotentialMatchOptions;
import com.affinity.x.dto.PotentialMatchesResult;
import com.affinity.x.dto.ScoreResult;
import com.affinity.x.dto.SingleCompatibilityResult;
import com.affinity.x.dto.enums.Grade;
import com.affinity.x.exceptions.BadRequestException;
import com.affinity.x.exceptions.CandidateQueryException;
import com.affinity.x.exceptions.ErrorCode;
import com.affinity.x.exceptions.ForbiddenException;
import com.affinity.x.monitoring.LatencyMonitor;
import com.affinity.x.repo.CandidateRepository;
import com.affinity.x.repo.MatchRelationRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MatchServiceImplTest {

    @Mock private CompatibilityScorer scorer;
    @Mock private BatchOrchestrator batchOrchestrator;
    @Mock private CandidateRepository candidateRepository;
    @Mock private CandidateListCache candidateListCache;
    @Mock private MatchRelationRepository matchRelationRepository;

    private MatchServiceImpl service;

    private final UUID viewerId = UUID.randomUUID();
    private final UUID c1 = UUID.randomUUID();
    private final UUID c2 = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        LatencyMonitor latencyMonitor = new LatencyMonitor(new SimpleMeterRegistry(), 500);
        service = new MatchServiceImpl(scorer, batchOrchestrator, candidateRepository, candidateListCache,
                matchRelationRepository, latencyMonitor, 20, 100, 60);
    }

    @Test
    void shouldServeIdsFromCacheOnSecondCall_butRescoreBothTimes() {
        // Given
        CandidateFilters filters = CandidateFilters.builder().zodiacSign("Leo").build();
        when(candidateListCache.get(viewerId, filters, 20, 0))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(List.of(c1, c2)));
        when(candidateListCache.defaultTtl()).thenReturn(Duration.ofMinutes(5));
        when(candidateRepository.findCandidates(viewerId, filters, 40, 0)).thenReturn(List.of(summary(c1), summary(c2)));
        when(batchOrchestrator.scoreBatch(eq(viewerId), eq(List.of(c1, c2)), any()))
                .thenReturn(batch(scored(c1, 88), scored(c2, 70)))
                .thenReturn(batch(scored(c1, 91), scored(c2, 70)));

        // When
        MatchResponse<PotentialMatchesResult> first = service.getPotentialMatches(viewerId, filters, null);
        MatchResponse<PotentialMatchesResult> second = service.getPotentialMatches(viewerId, filters, null);

        // Then
        assertThat(first.getPerformance().isCacheUsed()).isFalse();
        assertThat(first.getData().isFromCache()).isFalse();
        assertThat(second.getPerformance().isCacheUsed()).isTrue();
        assertThat(second.getData().isFromCache()).isTrue();
        assertThat(first.getData().getMatches().get(0).getCombinedScore()).isEqualTo(88);
        assertThat(second.getData().getMatches().get(0).getCombinedScore()).isEqualTo(91);
        verify(candidateRepository, times(1)).findCandidates(any(), any(), anyInt(), anyInt());
        verify(batchOrchestrator, times(2)).scoreBatch(eq(viewerId), any(), any());
        verify(candidateListCache).put(viewerId, filters, 20, 0, List.of(c1, c2), Duration.ofMinutes(5));
    }

    @Test
    void shouldQueryRepository_whenCacheReadFails() {
        // Given
        when(candidateListCache.get(any(), any(), anyInt(), anyInt()))
                .thenThrow(new RedisConnectionFailureException("down"));
        when(candidateListCache.defaultTtl()).thenReturn(Duration.ofMinutes(5));
        when(candidateRepository.findCandidates(eq(viewerId), any(), eq(40), eq(0))).thenReturn(List.of(summary(c1)));
        when(batchOrchestrator.scoreBatch(eq(viewerId), eq(List.of(c1)), any())).thenReturn(batch(scored(c1, 80)));

        // When
        MatchResponse<PotentialMatchesResult> response = service.getPotentialMatches(viewerId, null, null);

        // Then
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getData().getMatches()).hasSize(1);
        assertThat(response.getPerformance().isCacheUsed()).isFalse();
    }

    @Test
    void shouldStillAnswer_whenCacheWriteFails() {
        when(candidateListCache.get(any(), any(), anyInt(), anyInt())).thenReturn(Optional.empty());
        when(candidateListCache.defaultTtl()).thenReturn(Duration.ofMinutes(5));
        doThrow(new RedisConnectionFailureException("down"))
                .when(candidateListCache).put(any(), any(), anyInt(), anyInt(), any(), any());
        when(candidateRepository.findCandidates(eq(viewerId), any(), anyInt(), anyInt())).thenReturn(List.of(summary(c1)));
        when(batchOrchestrator.scoreBatch(eq(viewerId), any(), any())).thenReturn(batch(scored(c1, 80)));

        MatchResponse<PotentialMatchesResult> response = service.getPotentialMatches(viewerId, null, null);

        assertThat(response.getData().getMatches()).extracting(BatchResult::getCandidateId).containsExactly(c1);
    }

    @Test
    void shouldFailRequest_whenCandidateQueryFails() {
        when(candidateListCache.get(any(), any(), anyInt(), anyInt())).thenReturn(Optional.empty());
        when(candidateRepository.findCandidates(eq(viewerId), any(), anyInt(), anyInt()))
                .thenThrow(new CandidateQueryException("Failed to fetch candidates", new DataAccessResourceFailureException("db")));

        assertThatThrownBy(() -> service.getPotentialMatches(viewerId, null, null))
                .isInstanceOf(CandidateQueryException.class);
        verifyNoInteractions(batchOrchestrator);
    }

    @Test
    void shouldSkipScoringAndCaching_whenNoCandidates() {
        when(candidateListCache.get(any(), any(), anyInt(), anyInt())).thenReturn(Optional.empty());
        when(candidateRepository.findCandidates(eq(viewerId), any(), anyInt(), anyInt())).thenReturn(List.of());

        MatchResponse<PotentialMatchesResult> response = service.getPotentialMatches(viewerId, null, null);

        assertThat(response.getData().getMatches()).isEmpty();
        verifyNoInteractions(batchOrchestrator);
        verify(candidateListCache, never()).put(any(), any(), anyInt(), anyInt(), any(), any());
    }

    @Test
    void shouldDropMatchesBelowMinimumCompatibility() {
        when(candidateListCache.get(any(), any(), anyInt(), anyInt())).thenReturn(Optional.of(List.of(c1, c2)));
        when(batchOrchestrator.scoreBatch(eq(viewerId), any(), any()))
                .thenReturn(batch(scored(c1, 88), BatchResult.fallback(c2, 50, ErrorCode.SCORING_TIMEOUT, "late")));

        MatchResponse<PotentialMatchesResult> response = service.getPotentialMatches(viewerId, null,
                PotentialMatchOptions.builder().minCompatibility(60).build());

        assertThat(response.getData().getMatches()).extracting(BatchResult::getCandidateId).containsExactly(c1);
    }

    @Test
    void shouldCapLimit_andFetchTwiceThePage() {
        // Given
        when(candidateListCache.get(any(), any(), anyInt(), anyInt())).thenReturn(Optional.empty());
        when(candidateListCache.defaultTtl()).thenReturn(Duration.ofMinutes(5));
        when(candidateRepository.findCandidates(eq(viewerId), any(), eq(200), eq(40))).thenReturn(List.of(summary(c1), summary(c2)));
        when(batchOrchestrator.scoreBatch(eq(viewerId), any(), any())).thenReturn(batch(scored(c1, 80), scored(c2, 75)));

        // When
        MatchResponse<PotentialMatchesResult> response = service.getPotentialMatches(viewerId, null,
                PotentialMatchOptions.builder().limit(500).offset(40).build());

        // Then
        ArgumentCaptor<BatchOptions> options = ArgumentCaptor.forClass(BatchOptions.class);
        verify(batchOrchestrator).scoreBatch(eq(viewerId), eq(List.of(c1, c2)), options.capture());
        assertThat(options.getValue().getMaxBatchSize()).isEqualTo(2);
        assertThat(response.getData().getLimit()).isEqualTo(100);
        assertThat(response.getData().getOffset()).isEqualTo(40);
    }

    @Test
    void shouldKeepPageFull_whenThresholdDropsSomeCandidates() {
        // Given
        UUID c3 = UUID.randomUUID();
        UUID c4 = UUID.randomUUID();
        when(candidateListCache.get(any(), any(), anyInt(), anyInt())).thenReturn(Optional.empty());
        when(candidateListCache.defaultTtl()).thenReturn(Duration.ofMinutes(5));
        when(candidateRepository.findCandidates(eq(viewerId), any(), eq(4), eq(0)))
                .thenReturn(List.of(summary(c1), summary(c2), summary(c3), summary(c4)));
        when(batchOrchestrator.scoreBatch(eq(viewerId), eq(List.of(c1, c2, c3, c4)), any()))
                .thenReturn(batch(scored(c1, 40), scored(c2, 88), scored(c3, 55), scored(c4, 91)));

        // When
        MatchResponse<PotentialMatchesResult> response = service.getPotentialMatches(viewerId, null,
                PotentialMatchOptions.builder().limit(2).minCompatibility(60).build());

        // Then
        assertThat(response.getData().getMatches()).extracting(BatchResult::getCandidateId).containsExactly(c2, c4);
    }

    @Test
    void shouldTrimToLimit_whenMoreCandidatesPassThreshold() {
        UUID c3 = UUID.randomUUID();
        when(candidateListCache.get(any(), any(), anyInt(), anyInt())).thenReturn(Optional.of(List.of(c1, c2, c3)));
        when(batchOrchestrator.scoreBatch(eq(viewerId), any(), any()))
                .thenReturn(batch(scored(c1, 70), scored(c2, 88), scored(c3, 91)));

        MatchResponse<PotentialMatchesResult> response = service.getPotentialMatches(viewerId, null,
                PotentialMatchOptions.builder().limit(2).build());

        assertThat(response.getData().getMatches()).extracting(BatchResult::getCandidateId).containsExactly(c1, c2);
    }

    @Test
    void shouldApplyDefaultThreshold_whenNoneRequested() {
        when(candidateListCache.get(any(), any(), anyInt(), anyInt())).thenReturn(Optional.of(List.of(c1, c2)));
        when(batchOrchestrator.scoreBatch(eq(viewerId), any(), any()))
                .thenReturn(batch(scored(c1, 59), BatchResult.fallback(c2, 50, ErrorCode.SCORING_TIMEOUT, "late")));

        MatchResponse<PotentialMatchesResult> defaulted = service.getPotentialMatches(viewerId, null, null);

        assertThat(defaulted.getData().getMatches()).isEmpty();
    }

    @Test
    void shouldKeepEveryScore_whenThresholdIsZero() {
        when(candidateListCache.get(any(), any(), anyInt(), anyInt())).thenReturn(Optional.of(List.of(c1, c2)));
        when(batchOrchestrator.scoreBatch(eq(viewerId), any(), any()))
                .thenReturn(batch(scored(c1, 12), BatchResult.fallback(c2, 50, ErrorCode.SCORING_TIMEOUT, "late")));

        MatchResponse<PotentialMatchesResult> response = service.getPotentialMatches(viewerId, null,
                PotentialMatchOptions.builder().minCompatibility(0).build());

        assertThat(response.getData().getMatches()).extracting(BatchResult::getCandidateId).containsExactly(c1, c2);
    }

    @Test
    void shouldSkipListCacheRead_whenCacheDisabled() {
        // Given
        when(candidateListCache.defaultTtl()).thenReturn(Duration.ofMinutes(5));
        when(candidateRepository.findCandidates(eq(viewerId), any(), eq(40), eq(0))).thenReturn(List.of(summary(c1)));
        when(batchOrchestrator.scoreBatch(eq(viewerId), eq(List.of(c1)), any())).thenReturn(batch(scored(c1, 80)));

        // When
        MatchResponse<PotentialMatchesResult> response = service.getPotentialMatches(viewerId, null,
                PotentialMatchOptions.builder().useCache(false).build());

        // Then
        verify(candidateListCache, never()).get(any(), any(), anyInt(), anyInt());
        verify(candidateListCache).put(eq(viewerId), any(), eq(20), eq(0), eq(List.of(c1)), eq(Duration.ofMinutes(5)));
        assertThat(response.getPerformance().isCacheUsed()).isFalse();
        assertThat(response.getData().getMatches()).hasSize(1);
    }

    @Test
    void shouldRejectInvertedAgeRange_beforeQuerying() {
        CandidateFilters filters = CandidateFilters.builder().minAge(40).maxAge(30).build();

        assertThatThrownBy(() -> service.getPotentialMatches(viewerId, filters, null))
                .isInstanceOf(BadRequestException.class);
        verifyNoInteractions(candidateListCache, candidateRepository, batchOrchestrator);
    }

    @Test
    void shouldComputeSingleScoreFreshEveryTime() {
        // Given
        when(scorer.score(viewerId, c1)).thenReturn(score(Grade.A, Grade.B, 88));

        // When
        MatchResponse<SingleCompatibilityResult> first = service.getSingleCompatibility(viewerId, c1);
        MatchResponse<SingleCompatibilityResult> second = service.getSingleCompatibility(viewerId, c1);

        // Then
        assertThat(first.getData().getCombinedScore()).isEqualTo(88);
        assertThat(second.getData().getCombinedScore()).isEqualTo(88);
        assertThat(first.getPerformance().isCacheUsed()).isFalse();
        assertThat(second.getPerformance().isCacheUsed()).isFalse();
        verify(scorer, times(2)).score(viewerId, c1);
        verifyNoInteractions(candidateListCache);
    }

    @Test
    void shouldRejectSelfComparison() {
        assertThatThrownBy(() -> service.getSingleCompatibility(viewerId, viewerId))
                .isInstanceOf(BadRequestException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.SELF_COMPARISON);
        verifyNoInteractions(scorer);
    }

    @Test
    void shouldDelegateBatchToOrchestrator() {
        BatchOptions options = BatchOptions.builder().maxBatchSize(10).build();
        when(batchOrchestrator.scoreBatch(viewerId, List.of(c1, c2), options)).thenReturn(batch(scored(c1, 80), scored(c2, 75)));

        MatchResponse<BatchScoreResult> response = service.getBatchCompatibility(viewerId, List.of(c1, c2), options);

        assertThat(response.getData().getResults()).hasSize(2);
        assertThat(response.getPerformance().getBatchSize()).isEqualTo(2);
    }

    @Test
    void shouldRefuseDetails_whenUsersAreNotMatched() {
        when(matchRelationRepository.isActiveMatch(viewerId, c1)).thenReturn(false);

        assertThatThrownBy(() -> service.getCompatibilityDetails(viewerId, c1))
                .isInstanceOf(ForbiddenException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.NOT_MATCHED);
        verifyNoInteractions(scorer);
    }

    @Test
    void shouldDescribeGrades_forMatchedUsers() {
        when(matchRelationRepository.isActiveMatch(viewerId, c1)).thenReturn(true);
        when(scorer.score(viewerId, c1)).thenReturn(score(Grade.A_MINUS, Grade.D_PLUS, 75));

        MatchResponse<CompatibilityDetails> response = service.getCompatibilityDetails(viewerId, c1);

        CompatibilityDetails details = response.getData();
        assertThat(details.getOverallPercentage()).isEqualTo(75);
        assertThat(details.getAstrological().getDescription()).isEqualTo("Excellent");
        assertThat(details.getQuestionnaire().getDescription()).isEqualTo("Below Average");
    }

    private static CandidateSummary summary(UUID id) {
        return CandidateSummary.builder().id(id).build();
    }

    private static ScoreResult score(Grade astro, Grade questionnaire, int combined) {
        return ScoreResult.builder().astrologicalGrade(astro).questionnaireGrade(questionnaire).combinedScore(combined).build();
    }

    private static BatchResult scored(UUID id, int combined) {
        return BatchResult.scored(id, score(Grade.B, Grade.B, combined));
    }

    private static BatchScoreResult batch(BatchResult... results) {
        return BatchScoreResult.builder()
                .results(List.of(results))
                .metrics(BatchMetrics.builder().requested(results.length).processed(results.length).succeeded(results.length).build())
                .build();
    }
}
