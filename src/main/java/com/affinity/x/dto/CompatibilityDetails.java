package com.affinity.x.dto;

import com.affinity.x.dto.enums.Grade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Explained compatibility between two matched users.
 */
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompatibilityDetails {
    private UUID candidateId;
    private int overallPercentage;
    private GradeDetail astrological;
    private GradeDetail questionnaire;

    @Builder
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GradeDetail {
        private Grade grade;
        private int numericValue;
        private String description;

        public static GradeDetail of(Grade grade) {
            return new GradeDetail(grade, grade.getNumericValue(), describe(grade));
        }

        static String describe(Grade grade) {
            return switch (grade.letter()) {
                case 'A' -> "Excellent";
                case 'B' -> "Good";
                case 'C' -> "Average";
                case 'D' -> "Below Average";
                default -> "Poor";
            };
        }
    }
}
