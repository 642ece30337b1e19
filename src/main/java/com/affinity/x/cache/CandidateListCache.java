package com.affinity.x.cache;

import com.affinity.x.dto.CandidateFilters;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Short-lived store of candidate id lists keyed by viewer and normalized filters.
 * Both operations fail open: a broken store reads as a miss and a failed write is skipped.
 */
public interface CandidateListCache {
    Optional<List<UUID>> get(UUID viewerId, CandidateFilters filters, int limit, int offset);
    void put(UUID viewerId, CandidateFilters filters, int limit, int offset, List<UUID> candidateIds, Duration ttl);
    Duration defaultTtl();
}
