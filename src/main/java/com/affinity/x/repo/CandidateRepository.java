package com.affinity.x.repo;

import com.affinity.x.dto.CandidateFilters;
import com.affinity.x.dto.CandidateSummary;

import java.util.List;
import java.util.UUID;

public interface CandidateRepository {

    /**
     * Returns one page of candidates the viewer may be shown, premium members first and then by id.
     * <p>
     * Gender preference is checked in both directions. Users the viewer already swiped on, users
     * blocked either way and users already matched with the viewer are never returned. Zodiac, age,
     * distance and activity filters apply only when supplied.
     * </p>
     *
     * @throws com.affinity.x.exceptions.ProfileNotFoundException when the viewer has no profile
     * @throws com.affinity.x.exceptions.BadRequestException      when a distance filter is given but the viewer has no location
     * @throws com.affinity.x.exceptions.CandidateQueryException  when the query itself fails
     */
    List<CandidateSummary> findCandidates(UUID viewerId, CandidateFilters filters, int limit, int offset);
}
