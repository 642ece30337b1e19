package com.affinity.x.processors;

import com.affinity.x.dto.enums.Grade;
import com.affinity.x.models.ScoreBreakdown;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Merges the astrological and questionnaire grades into one 0-100 score.
 * <p>
 * Each grade is taken at its value on the fixed numeric scale and weighted 0.4 / 0.6.
 * The result is rounded to the nearest integer and clamped, so improving either grade
 * can never lower the combined score.
 * </p>
 */
@Component
public class GradeCombiner {
    public static final double ASTROLOGICAL_WEIGHT = 0.4;
    public static final double QUESTIONNAIRE_WEIGHT = 0.6;
    private static final int MIN_SCORE = 0;
    private static final int MAX_SCORE = 100;

    public int combine(Grade astrologicalGrade, Grade questionnaireGrade) {
        Objects.requireNonNull(astrologicalGrade, "astrologicalGrade");
        Objects.requireNonNull(questionnaireGrade, "questionnaireGrade");
        double weighted = ASTROLOGICAL_WEIGHT * astrologicalGrade.getNumericValue()
                + QUESTIONNAIRE_WEIGHT * questionnaireGrade.getNumericValue();
        long rounded = Math.round(weighted);
        return (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, rounded));
    }

    public ScoreBreakdown breakdown(Grade astrologicalGrade, Grade questionnaireGrade) {
        return ScoreBreakdown.builder()
                .astrologicalSubScore(astrologicalGrade.getNumericValue())
                .questionnaireSubScore(questionnaireGrade.getNumericValue())
                .astrologicalWeight(ASTROLOGICAL_WEIGHT)
                .questionnaireWeight(QUESTIONNAIRE_WEIGHT)
                .build();
    }
}
