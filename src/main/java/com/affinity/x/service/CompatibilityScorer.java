package com.affinity.x.service;

import com.affinity.x.dto.ScoreResult;

import java.util.UUID;

public interface CompatibilityScorer {

    /**
     * Computes a fresh score for the pair and records it in the score store.
     *
     * @throws com.affinity.x.exceptions.ProfileNotFoundException  when either profile is missing
     * @throws com.affinity.x.exceptions.InsufficientDataException when birth or questionnaire data is missing
     * @throws com.affinity.x.exceptions.ScoringException          when a grading collaborator fails
     */
    ScoreResult score(UUID viewerId, UUID candidateId);
}
