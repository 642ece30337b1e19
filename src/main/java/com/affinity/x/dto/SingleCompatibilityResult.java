package com.affinity.x.dto;

import com.affinity.x.dto.enums.Grade;
import com.affinity.x.models.ScoreBreakdown;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SingleCompatibilityResult {
    private UUID candidateId;
    private int combinedScore;
    private Grade astrologicalGrade;
    private Grade questionnaireGrade;
    private ScoreBreakdown breakdown;

    public static SingleCompatibilityResult of(UUID candidateId, ScoreResult score) {
        return SingleCompatibilityResult.builder()
                .candidateId(candidateId)
                .combinedScore(score.getCombinedScore())
                .astrologicalGrade(score.getAstrologicalGrade())
                .questionnaireGrade(score.getQuestionnaireGrade())
                .breakdown(score.getBreakdown())
                .build();
    }
}
