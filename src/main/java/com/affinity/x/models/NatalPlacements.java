package com.affinity.x.models;

import com.affinity.x.dto.enums.ZodiacSign;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sun, Moon and rising placements derived from birth data by the chart collaborator.
 * Degrees are positions within the sign (0 to 30) and may be absent when the birth time is unknown.
 */
@Embeddable
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NatalPlacements {
    @Enumerated(EnumType.STRING)
    @Column(name = "sun_sign")
    private ZodiacSign sunSign;

    @Column(name = "sun_degree")
    private Double sunDegree;

    @Enumerated(EnumType.STRING)
    @Column(name = "moon_sign")
    private ZodiacSign moonSign;

    @Column(name = "moon_degree")
    private Double moonDegree;

    @Enumerated(EnumType.STRING)
    @Column(name = "rising_sign")
    private ZodiacSign risingSign;

    @Column(name = "rising_degree")
    private Double risingDegree;
}
