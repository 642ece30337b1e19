package com.affinity.x.dto;

import com.affinity.x.dto.enums.Gender;
import com.affinity.x.dto.enums.ZodiacSign;
import com.affinity.x.exceptions.BadRequestException;
import com.affinity.x.exceptions.ErrorCode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Optional constraints on the candidate pool. Blank values and the wildcards "any", "all"
 * and "any date" mean the constraint was not supplied.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CandidateFilters {
    private static final Set<String> WILDCARDS = Set.of("any", "all", "any date");

    @Builder.Default
    private Set<Gender> genderPreference = new HashSet<>();

    private String zodiacSign;

    @Min(value = 18, message = "min_age must be at least 18")
    @Max(value = 120, message = "min_age must not exceed 120")
    private Integer minAge;

    @Min(value = 18, message = "max_age must be at least 18")
    @Max(value = 120, message = "max_age must not exceed 120")
    private Integer maxAge;

    @Positive(message = "max_distance_km must be positive")
    @Max(value = 20037, message = "max_distance_km must not exceed half the earth's circumference")
    private Integer maxDistanceKm;

    private String activityType;

    public static CandidateFilters none() {
        return new CandidateFilters();
    }

    public static boolean isUnspecified(String value) {
        return StringUtils.isBlank(value) || WILDCARDS.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    public Set<Gender> genders() {
        return genderPreference == null || genderPreference.isEmpty()
                ? EnumSet.noneOf(Gender.class)
                : EnumSet.copyOf(genderPreference);
    }

    public Optional<ZodiacSign> zodiac() {
        if (isUnspecified(zodiacSign)) {
            return Optional.empty();
        }
        return Optional.of(ZodiacSign.fromName(zodiacSign)
                .orElseThrow(() -> new BadRequestException(ErrorCode.INVALID_INPUT, "Unknown zodiac sign: " + zodiacSign)));
    }

    public Optional<String> activity() {
        return isUnspecified(activityType)
                ? Optional.empty()
                : Optional.of(activityType.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Rejects combinations field constraints cannot express.
     */
    public void validate() {
        if (minAge != null && maxAge != null && minAge > maxAge) {
            throw new BadRequestException(ErrorCode.INVALID_INPUT, "min_age must not exceed max_age");
        }
        zodiac();
    }

    /**
     * Canonical text form of the normalized filters plus the page. Two requests that mean the
     * same thing produce the same signature whatever order their values arrived in.
     */
    public String signature(int limit, int offset) {
        Map<String, String> parts = new TreeMap<>();
        Set<Gender> genders = genders();
        if (!genders.isEmpty()) {
            parts.put("gender", genders.stream().map(Enum::name).sorted().collect(Collectors.joining(",")));
        }
        zodiac().ifPresent(sign -> parts.put("zodiac", sign.name()));
        if (minAge != null) {
            parts.put("min_age", minAge.toString());
        }
        if (maxAge != null) {
            parts.put("max_age", maxAge.toString());
        }
        if (maxDistanceKm != null) {
            parts.put("max_distance_km", maxDistanceKm.toString());
        }
        activity().ifPresent(activity -> parts.put("activity", activity));
        parts.put("limit", Integer.toString(limit));
        parts.put("offset", Integer.toString(offset));
        return parts.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
    }
}
