package com.affinity.x.service;

import com.affinity.x.dto.BatchOptions;
import com.affinity.x.dto.BatchScoreResult;
import com.affinity.x.dto.CandidateFilters;
import com.affinity.x.dto.CompatibilityDetails;
import com.affinity.x.dto.MatchResponse;
import com.affinity.x.dto.PotentialMatchOptions;
import com.affinity.x.dto.PotentialMatchesResult;
import com.affinity.x.dto.SingleCompatibilityResult;

import java.util.List;
import java.util.UUID;

public interface MatchService {
    MatchResponse<SingleCompatibilityResult> getSingleCompatibility(UUID viewerId, UUID candidateId);
    MatchResponse<BatchScoreResult> getBatchCompatibility(UUID viewerId, List<UUID> candidateIds, BatchOptions options);
    MatchResponse<PotentialMatchesResult> getPotentialMatches(UUID viewerId, CandidateFilters filters, PotentialMatchOptions options);
    MatchResponse<CompatibilityDetails> getCompatibilityDetails(UUID viewerId, UUID candidateId);
}
