package com.affinity.x.dto;

import com.affinity.x.dto.enums.Grade;
import com.affinity.x.exceptions.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Outcome for one candidate of a batch. Fallback entries carry the neutral score and the
 * reason scoring failed; grades are absent for them.
 */
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchResult {
    private UUID candidateId;
    private int combinedScore;
    private Grade astrologicalGrade;
    private Grade questionnaireGrade;
    private boolean fallback;
    private ErrorCode errorCode;
    private String errorMessage;

    public static BatchResult scored(UUID candidateId, ScoreResult score) {
        return BatchResult.builder()
                .candidateId(candidateId)
                .combinedScore(score.getCombinedScore())
                .astrologicalGrade(score.getAstrologicalGrade())
                .questionnaireGrade(score.getQuestionnaireGrade())
                .fallback(false)
                .build();
    }

    public static BatchResult fallback(UUID candidateId, int fallbackScore, ErrorCode errorCode, String errorMessage) {
        return BatchResult.builder()
                .candidateId(candidateId)
                .combinedScore(fallbackScore)
                .fallback(true)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
    }
}
