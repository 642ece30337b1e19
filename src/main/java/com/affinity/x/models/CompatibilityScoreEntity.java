package com.affinity.x.models;

import com.affinity.x.dto.enums.Grade;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit copy of a freshly computed score. Upserted on every computation, expires 24h later,
 * and never read back to answer a live request.
 */
@Entity
@Table(name = "compatibility_scores", indexes = {
        @Index(name = "idx_compatibility_scores_expires_at", columnList = "expires_at")
})
@IdClass(CompatibilityScoreId.class)
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class CompatibilityScoreEntity {
    @Id
    @Column(name = "viewer_id")
    private UUID viewerId;

    @Id
    @Column(name = "candidate_id")
    private UUID candidateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "astrological_grade", nullable = false)
    private Grade astrologicalGrade;

    @Enumerated(EnumType.STRING)
    @Column(name = "questionnaire_grade", nullable = false)
    private Grade questionnaireGrade;

    @Column(name = "combined_score", nullable = false)
    private int combinedScore;

    @Column(name = "computed_at", nullable = false)
    private Instant computedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Embedded
    private ScoreBreakdown breakdown;
}
