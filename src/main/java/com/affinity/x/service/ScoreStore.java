package com.affinity.x.service;

import com.affinity.x.dto.ScoreResult;

import java.util.UUID;

/**
 * Write-only audit store for computed scores. Nothing in this service reads it back.
 */
public interface ScoreStore {
    void save(UUID viewerId, UUID candidateId, ScoreResult score);
}
