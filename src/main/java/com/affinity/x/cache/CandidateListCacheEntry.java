package com.affinity.x.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CandidateListCacheEntry {
    private List<UUID> candidateIds;
    private Instant cachedAt;
    private Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return expiresAt == null || !now.isBefore(expiresAt);
    }
}
