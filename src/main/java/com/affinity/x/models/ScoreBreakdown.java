package com.affinity.x.models;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw components a combined score was computed from. Opaque to API callers.
 */
@Embeddable
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBreakdown {
    @Column(name = "astrological_sub_score")
    private int astrologicalSubScore;

    @Column(name = "questionnaire_sub_score")
    private int questionnaireSubScore;

    @Column(name = "astrological_weight")
    private double astrologicalWeight;

    @Column(name = "questionnaire_weight")
    private double questionnaireWeight;
}
