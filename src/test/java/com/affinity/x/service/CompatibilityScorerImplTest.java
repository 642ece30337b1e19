package com.affinity.x.service;

import com.affinity.x.dto.ScoreResult;
import com.affinity.x.dto.enums.Grade;
import com.affinity.x.dto.enums.ZodiacSign;
import com.affinity.x.exceptions.ErrorCode;
import com.affinity.x.exceptions.InsufficientDataException;
import com.affinity.x.exceptions.ProfileNotFoundException;
import com.affinity.x.exceptions.ScoringException;
import com.affinity.x.models.Profile;
import com.affinity.x.processors.GradeCombiner;
import com.affinity.x.repo.ProfileRepository;
import com.affinity.x.support.Profiles;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompatibilityScorerImplTest {

    @Mock private ProfileRepository profileRepository;
    @Mock private AstrologicalCompatibilityCalculator astrologicalCalculator;
    @Mock private QuestionnaireCompatibilityCalculator questionnaireCalculator;
    @Mock private ScoreStore scoreStore;

    private MeterRegistry meterRegistry;
    private CompatibilityScorerImpl scorer;

    private final UUID viewerId = UUID.randomUUID();
    private final UUID candidateId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        scorer = new CompatibilityScorerImpl(profileRepository, astrologicalCalculator, questionnaireCalculator,
                new GradeCombiner(), scoreStore, meterRegistry);
    }

    @Test
    void shouldCombineGradesAndStoreResult() {
        // Given
        stubProfiles(Profiles.scoreable(viewerId, ZodiacSign.ARIES, 3), Profiles.scoreable(candidateId, ZodiacSign.LEO, 3));
        when(astrologicalCalculator.calculate(any(), any())).thenReturn(Grade.A);
        when(questionnaireCalculator.calculate(any(), any())).thenReturn(Grade.B);

        // When
        ScoreResult result = scorer.score(viewerId, candidateId);

        // Then
        assertThat(result.getCombinedScore()).isEqualTo(88);
        assertThat(result.getAstrologicalGrade()).isEqualTo(Grade.A);
        assertThat(result.getQuestionnaireGrade()).isEqualTo(Grade.B);
        assertThat(result.getBreakdown().getAstrologicalSubScore()).isEqualTo(95);
        verify(scoreStore).save(viewerId, candidateId, result);
    }

    @Test
    void shouldComputeAgainOnEveryCall() {
        // Given
        stubProfiles(Profiles.scoreable(viewerId, ZodiacSign.ARIES, 3), Profiles.scoreable(candidateId, ZodiacSign.LEO, 3));
        when(astrologicalCalculator.calculate(any(), any())).thenReturn(Grade.A);
        when(questionnaireCalculator.calculate(any(), any())).thenReturn(Grade.B);

        // When
        ScoreResult first = scorer.score(viewerId, candidateId);
        ScoreResult second = scorer.score(viewerId, candidateId);

        // Then
        assertThat(second.getCombinedScore()).isEqualTo(first.getCombinedScore());
        verify(astrologicalCalculator, times(2)).calculate(any(), any());
        verify(questionnaireCalculator, times(2)).calculate(any(), any());
        verify(scoreStore, times(2)).save(eq(viewerId), eq(candidateId), any());
    }

    @Test
    void shouldThrowProfileNotFound_whenCandidateMissing() {
        when(profileRepository.findWithAnswersById(viewerId)).thenReturn(Optional.of(Profiles.scoreable(viewerId, ZodiacSign.ARIES, 3)));
        when(profileRepository.findWithAnswersById(candidateId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> scorer.score(viewerId, candidateId)).isInstanceOf(ProfileNotFoundException.class);
        verifyNoInteractions(astrologicalCalculator, questionnaireCalculator, scoreStore);
    }

    @Test
    void shouldReportInsufficientData_beforeCallingCollaborators() {
        // Given
        Profile candidate = Profiles.scoreable(candidateId, ZodiacSign.LEO, 3);
        candidate.setQuestionnaireAnswers(List.of());
        stubProfiles(Profiles.scoreable(viewerId, ZodiacSign.ARIES, 3), candidate);

        // When / Then
        assertThatThrownBy(() -> scorer.score(viewerId, candidateId))
                .isInstanceOf(InsufficientDataException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.INSUFFICIENT_DATA);
        verifyNoInteractions(astrologicalCalculator, questionnaireCalculator, scoreStore);
        assertThat(meterRegistry.counter("compatibility_score_errors", "reason", "INSUFFICIENT_DATA").count()).isEqualTo(1.0);
    }

    @Test
    void shouldReportInsufficientData_whenBirthDataMissing() {
        Profile viewer = Profiles.scoreable(viewerId, ZodiacSign.ARIES, 3);
        viewer.setNatalPlacements(null);
        stubProfiles(viewer, Profiles.scoreable(candidateId, ZodiacSign.LEO, 3));

        assertThatThrownBy(() -> scorer.score(viewerId, candidateId)).isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void shouldWrapCollaboratorFailure_withoutFallback() {
        // Given
        stubProfiles(Profiles.scoreable(viewerId, ZodiacSign.ARIES, 3), Profiles.scoreable(candidateId, ZodiacSign.LEO, 3));
        when(astrologicalCalculator.calculate(any(), any())).thenThrow(new IllegalStateException("ephemeris offline"));

        // When / Then
        assertThatThrownBy(() -> scorer.score(viewerId, candidateId))
                .isInstanceOf(ScoringException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        verifyNoInteractions(scoreStore);
    }

    @Test
    void shouldReturnScore_whenScoreStoreWriteFails() {
        // Given
        stubProfiles(Profiles.scoreable(viewerId, ZodiacSign.ARIES, 3), Profiles.scoreable(candidateId, ZodiacSign.LEO, 3));
        when(astrologicalCalculator.calculate(any(), any())).thenReturn(Grade.C);
        when(questionnaireCalculator.calculate(any(), any())).thenReturn(Grade.C);
        doThrow(new DataAccessResourceFailureException("db down")).when(scoreStore).save(any(), any(), any());

        // When
        ScoreResult result = scorer.score(viewerId, candidateId);

        // Then
        assertThat(result.getCombinedScore()).isEqualTo(73);
        assertThat(meterRegistry.counter("score_store_errors").count()).isEqualTo(1.0);
    }

    private void stubProfiles(Profile viewer, Profile candidate) {
        when(profileRepository.findWithAnswersById(viewerId)).thenReturn(Optional.of(viewer));
        when(profileRepository.findWithAnswersById(candidateId)).thenReturn(Optional.of(candidate));
    }
}
