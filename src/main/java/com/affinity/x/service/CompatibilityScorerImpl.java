package com.affinity.x.service;

import com.affinity.x.dto.ScoreResult;
import com.affinity.x.dto.enums.Grade;
import com.affinity.x.exceptions.InsufficientDataException;
import com.affinity.x.exceptions.ProfileNotFoundException;
import com.affinity.x.exceptions.ScoringException;
import com.affinity.x.exceptions.ServiceException;
import com.affinity.x.models.Profile;
import com.affinity.x.processors.GradeCombiner;
import com.affinity.x.repo.ProfileRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.function.Supplier;


@Slf4j
@Service
@RequiredArgsConstructor
public class CompatibilityScorerImpl implements CompatibilityScorer {
    private final ProfileRepository profileRepository;
    private final AstrologicalCompatibilityCalculator astrologicalCompatibilityCalculator;
    private final QuestionnaireCompatibilityCalculator questionnaireCompatibilityCalculator;
    private final GradeCombiner gradeCombiner;
    private final ScoreStore scoreStore;
    private final MeterRegistry meterRegistry;

    @Override
    public ScoreResult score(UUID viewerId, UUID candidateId) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Profile viewer = load(viewerId);
            Profile candidate = load(candidateId);
            requireScoringData(viewer);
            requireScoringData(candidate);

            Grade astrologicalGrade = grade("astrological", viewerId, candidateId,
                    () -> astrologicalCompatibilityCalculator.calculate(viewer, candidate));
            Grade questionnaireGrade = grade("questionnaire", viewerId, candidateId,
                    () -> questionnaireCompatibilityCalculator.calculate(viewer, candidate));

            ScoreResult result = ScoreResult.builder()
                    .astrologicalGrade(astrologicalGrade)
                    .questionnaireGrade(questionnaireGrade)
                    .combinedScore(gradeCombiner.combine(astrologicalGrade, questionnaireGrade))
                    .breakdown(gradeCombiner.breakdown(astrologicalGrade, questionnaireGrade))
                    .build();
            store(viewerId, candidateId, result);
            log.debug("Scored viewerId={} candidateId={} astro={} questionnaire={} combined={}",
                    viewerId, candidateId, astrologicalGrade.getLabel(), questionnaireGrade.getLabel(), result.getCombinedScore());
            return result;
        } catch (ServiceException e) {
            meterRegistry.counter("compatibility_score_errors", "reason", e.getErrorCode().name()).increment();
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("compatibility_score_duration"));
        }
    }

    private Profile load(UUID profileId) {
        try {
            return profileRepository.findWithAnswersById(profileId)
                    .orElseThrow(() -> new ProfileNotFoundException(profileId));
        } catch (ServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to load profileId={} for scoring", profileId, e);
            throw new ScoringException("Failed to load profile for scoring", e);
        }
    }

    private void requireScoringData(Profile profile) {
        if (!profile.hasBirthData()) {
            throw new InsufficientDataException("Birth data missing for profile " + profile.getId());
        }
        if (!profile.hasQuestionnaireAnswers()) {
            throw new InsufficientDataException("Questionnaire answers missing for profile " + profile.getId());
        }
    }

    private Grade grade(String dimension, UUID viewerId, UUID candidateId, Supplier<Grade> calculation) {
        Grade grade;
        try {
            grade = calculation.get();
        } catch (ServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("{} grading failed for viewerId={} candidateId={}: {}", dimension, viewerId, candidateId, e.getMessage());
            throw new ScoringException("Failed to compute " + dimension + " grade", e);
        }
        if (grade == null) {
            throw new ScoringException("No " + dimension + " grade returned");
        }
        return grade;
    }

    private void store(UUID viewerId, UUID candidateId, ScoreResult result) {
        try {
            scoreStore.save(viewerId, candidateId, result);
        } catch (RuntimeException e) {
            meterRegistry.counter("score_store_errors").increment();
            log.warn("Score store write failed for viewerId={} candidateId={}: {}", viewerId, candidateId, e.getMessage());
        }
    }
}
