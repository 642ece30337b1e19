package com.affinity.x.repo;

import com.affinity.x.dto.CandidateFilters;
import com.affinity.x.dto.CandidateSummary;
import com.affinity.x.dto.enums.Gender;
import com.affinity.x.dto.enums.MatchStatus;
import com.affinity.x.exceptions.BadRequestException;
import com.affinity.x.exceptions.CandidateQueryException;
import com.affinity.x.exceptions.ErrorCode;
import com.affinity.x.exceptions.ProfileNotFoundException;
import com.affinity.x.exceptions.ServiceException;
import com.affinity.x.models.Profile;
import com.affinity.x.utils.basic.GeoUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;


@Slf4j
@Repository
public class CandidateRepositoryImpl implements CandidateRepository {
    private static final String BASE_QUERY = """
            SELECT c FROM Profile c
            WHERE c.id <> :viewerId
              AND c.onboardingCompleted = true
              AND c.birthDate IS NOT NULL
              AND c.id NOT IN (SELECT s.swipedId FROM Swipe s WHERE s.swiperId = :viewerId)
              AND c.id NOT IN (SELECT b.blockedId FROM UserBlock b WHERE b.blockerId = :viewerId)
              AND c.id NOT IN (SELECT b.blockerId FROM UserBlock b WHERE b.blockedId = :viewerId)
              AND NOT EXISTS (SELECT m.id FROM MatchRelation m
                              WHERE m.status = :activeStatus
                                AND ((m.user1Id = :viewerId AND m.user2Id = c.id)
                                  OR (m.user2Id = :viewerId AND m.user1Id = c.id)))
            """;

    private static final String DISTANCE_PREDICATE = String.format(Locale.ROOT, """
              AND c.latitude IS NOT NULL AND c.longitude IS NOT NULL
              AND 2 * %.1f * asin(sqrt(power(sin(radians(c.latitude - :viewerLat) / 2), 2)
                  + cos(radians(:viewerLat)) * cos(radians(c.latitude))
                  * power(sin(radians(c.longitude - :viewerLon) / 2), 2))) <= :maxDistanceKm
            """, GeoUtils.EARTH_RADIUS_KM);

    private static final String ORDERING = " ORDER BY c.premium DESC, c.id ASC";

    private final EntityManager entityManager;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int fetchSize;

    public CandidateRepositoryImpl(
            EntityManager entityManager,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${matching.candidates.fetch-size:100}") int fetchSize
    ) {
        this.entityManager = entityManager;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.fetchSize = fetchSize;
    }

    @Override
    @Transactional(readOnly = true)
    public List<CandidateSummary> findCandidates(UUID viewerId, CandidateFilters filters, int limit, int offset) {
        CandidateFilters effective = filters == null ? CandidateFilters.none() : filters;
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Profile viewer = entityManager.find(Profile.class, viewerId);
            if (viewer == null) {
                throw new ProfileNotFoundException(viewerId);
            }
            LocalDate today = LocalDate.now(clock);
            CandidateQuery candidateQuery = buildQuery(viewer, effective, today);

            TypedQuery<Profile> query = entityManager.createQuery(candidateQuery.jpql(), Profile.class)
                    .setFirstResult(offset)
                    .setMaxResults(limit)
                    .setHint("org.hibernate.readOnly", true)
                    .setHint("org.hibernate.fetchSize", fetchSize);
            candidateQuery.parameters().forEach((name, value) -> query.setParameter(name, value));

            List<CandidateSummary> result = query.getResultList().stream()
                    .map(candidate -> toSummary(viewer, candidate, today))
                    .toList();
            log.info("Fetched {} candidates for viewerId={} limit={} offset={}", result.size(), viewerId, limit, offset);
            meterRegistry.counter("candidates_fetched_total").increment(result.size());
            return result;
        } catch (ServiceException e) {
            throw e;
        } catch (Exception e) {
            meterRegistry.counter("candidate_query_errors").increment();
            log.error("Failed to fetch candidates for viewerId={}", viewerId, e);
            throw new CandidateQueryException("Failed to fetch candidates", e);
        } finally {
            sample.stop(meterRegistry.timer("candidate_query_duration"));
        }
    }

    CandidateQuery buildQuery(Profile viewer, CandidateFilters filters, LocalDate today) {
        StringBuilder jpql = new StringBuilder(BASE_QUERY);
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("viewerId", viewer.getId());
        parameters.put("activeStatus", MatchStatus.ACTIVE);

        Set<Gender> viewerPreference = filters.genders().isEmpty() ? viewer.getLookingFor() : filters.genders();
        if (viewerPreference != null && !viewerPreference.isEmpty()) {
            jpql.append("  AND c.gender IN :viewerPreference\n");
            parameters.put("viewerPreference", viewerPreference);
        }
        if (viewer.getGender() != null) {
            jpql.append("  AND (c.lookingFor IS EMPTY OR :viewerGender MEMBER OF c.lookingFor)\n");
            parameters.put("viewerGender", viewer.getGender());
        } else {
            jpql.append("  AND c.lookingFor IS EMPTY\n");
        }

        filters.zodiac().ifPresent(sign -> {
            jpql.append("  AND c.natalPlacements.sunSign = :zodiacSign\n");
            parameters.put("zodiacSign", sign);
        });

        // age N means born on or before today minus N years, and after today minus N+1 years
        if (filters.getMinAge() != null) {
            jpql.append("  AND c.birthDate <= :latestBirthDate\n");
            parameters.put("latestBirthDate", today.minusYears(filters.getMinAge()));
        }
        if (filters.getMaxAge() != null) {
            jpql.append("  AND c.birthDate > :earliestBirthDate\n");
            parameters.put("earliestBirthDate", today.minusYears(filters.getMaxAge() + 1L));
        }

        if (filters.getMaxDistanceKm() != null) {
            if (!viewer.hasCoordinates()) {
                throw new BadRequestException(ErrorCode.LOCATION_UNAVAILABLE,
                        "A distance filter needs the viewer's current location");
            }
            jpql.append(DISTANCE_PREDICATE);
            parameters.put("viewerLat", viewer.getLatitude());
            parameters.put("viewerLon", viewer.getLongitude());
            parameters.put("maxDistanceKm", filters.getMaxDistanceKm().doubleValue());
        }

        filters.activity().ifPresent(activity -> {
            jpql.append("  AND EXISTS (SELECT p.id FROM Profile p JOIN p.activityPreferences a\n")
                    .append("              WHERE p.id = c.id AND lower(a) = :activityType)\n");
            parameters.put("activityType", activity);
        });

        jpql.append(ORDERING);
        return new CandidateQuery(jpql.toString(), parameters);
    }

    private CandidateSummary toSummary(Profile viewer, Profile candidate, LocalDate today) {
        Double distanceKm = null;
        if (viewer.hasCoordinates() && candidate.hasCoordinates()) {
            double km = GeoUtils.haversineKm(viewer.getLatitude(), viewer.getLongitude(),
                    candidate.getLatitude(), candidate.getLongitude());
            distanceKm = Math.round(km * 10.0) / 10.0;
        }
        return CandidateSummary.builder()
                .id(candidate.getId())
                .displayName(candidate.getDisplayName())
                .premium(candidate.isPremium())
                .sunSign(candidate.getNatalPlacements() == null ? null : candidate.getNatalPlacements().getSunSign())
                .age(candidate.getBirthDate() == null ? null : Period.between(candidate.getBirthDate(), today).getYears())
                .distanceKm(distanceKm)
                .build();
    }

    record CandidateQuery(String jpql, Map<String, Object> parameters) {
    }
}
