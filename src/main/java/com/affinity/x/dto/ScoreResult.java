package com.affinity.x.dto;

import com.affinity.x.dto.enums.Grade;
import com.affinity.x.models.ScoreBreakdown;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreResult {
    private Grade astrologicalGrade;
    private Grade questionnaireGrade;
    private int combinedScore;
    private ScoreBreakdown breakdown;
}
