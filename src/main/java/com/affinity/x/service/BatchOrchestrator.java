package com.affinity.x.service;

import com.affinity.x.dto.BatchOptions;
import com.affinity.x.dto.BatchScoreResult;

import java.util.List;
import java.util.UUID;

public interface BatchOrchestrator {

    /**
     * Scores every candidate concurrently and returns one result per requested position, in input order.
     * A candidate whose scoring fails or times out gets the neutral fallback score instead of failing the batch.
     */
    BatchScoreResult scoreBatch(UUID viewerId, List<UUID> candidateIds, BatchOptions options);
}
