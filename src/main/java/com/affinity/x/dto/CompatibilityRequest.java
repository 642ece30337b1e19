package com.affinity.x.dto;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Body of the compatibility endpoint. A single candidate id wins over a candidate list;
 * with neither, the request asks for potential matches.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompatibilityRequest {
    private UUID singleCandidateId;
    private List<UUID> candidateIds;

    @Valid
    private CandidateFilters filters;

    @Valid
    private RequestOptions options;
}
