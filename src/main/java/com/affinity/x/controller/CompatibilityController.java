package com.affinity.x.controller;

import com.affinity.x.auth.ViewerIdentityResolver;
import com.affinity.x.dto.CompatibilityDetails;
import com.affinity.x.dto.CompatibilityRequest;
import com.affinity.x.dto.MatchResponse;
import com.affinity.x.dto.RequestOptions;
import com.affinity.x.service.MatchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/compatibility")
@RequiredArgsConstructor
@Tag(name = "Compatibility API", description = "Compatibility scores and potential matches for the calling viewer")
public class CompatibilityController {
    private final MatchService matchService;
    private final ViewerIdentityResolver viewerIdentityResolver;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Score candidates",
            description = "single_candidate_id scores one candidate, candidate_ids scores a batch, "
                    + "and a body with neither returns filtered potential matches with fresh scores")
    public ResponseEntity<MatchResponse<?>> compatibility(@Valid @RequestBody CompatibilityRequest request,
                                                          HttpServletRequest httpRequest) {
        UUID viewerId = viewerIdentityResolver.resolve(httpRequest);
        RequestOptions options = request.getOptions() == null ? new RequestOptions() : request.getOptions();

        if (request.getSingleCandidateId() != null) {
            return ResponseEntity.ok(matchService.getSingleCompatibility(viewerId, request.getSingleCandidateId()));
        }
        if (request.getCandidateIds() != null) {
            return ResponseEntity.ok(matchService.getBatchCompatibility(viewerId, request.getCandidateIds(), options.toBatchOptions()));
        }
        return ResponseEntity.ok(matchService.getPotentialMatches(viewerId, request.getFilters(), options.toPotentialMatchOptions()));
    }

    @GetMapping(value = "/{candidateId}/details", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Compatibility details", description = "Explained grades for a user the viewer is matched with")
    public ResponseEntity<MatchResponse<CompatibilityDetails>> details(@PathVariable UUID candidateId,
                                                                       HttpServletRequest httpRequest) {
        UUID viewerId = viewerIdentityResolver.resolve(httpRequest);
        return ResponseEntity.ok(matchService.getCompatibilityDetails(viewerId, candidateId));
    }
}
