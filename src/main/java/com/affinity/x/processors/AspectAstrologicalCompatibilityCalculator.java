package com.affinity.x.processors;

import com.affinity.x.dto.enums.Grade;
import com.affinity.x.dto.enums.ZodiacSign;
import com.affinity.x.exceptions.InsufficientDataException;
import com.affinity.x.models.NatalPlacements;
import com.affinity.x.models.Profile;
import com.affinity.x.service.AstrologicalCompatibilityCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Grades synastry from the aspects formed between the Sun, Moon and Ascendant of two charts.
 * <p>
 * Each unordered pair of body names is checked once, viewer body first, against the major aspects.
 * Placements without a known degree take no part. A matching aspect contributes its harmony value
 * times a weight that grows with how exact the aspect is. The weighted mean harmony maps onto 0-100
 * around a neutral 50, then onto a letter grade.
 * </p>
 */
@Slf4j
@Component
public class AspectAstrologicalCompatibilityCalculator implements AstrologicalCompatibilityCalculator {
    private static final double NEUTRAL_SCORE = 50.0;
    private static final double HARMONY_SCALE = 25.0;
    private static final double LUMINARY_WEIGHT = 1.5;
    private static final double SUN_MOON_WEIGHT = 2.0;
    private static final double TIGHTNESS_BONUS = 0.5;

    enum Aspect {
        QUINCUNX(150.0, 3.0, -0.3),
        SEXTILE(60.0, 6.0, 0.7),
        SQUARE(90.0, 8.0, -0.7),
        CONJUNCTION(0.0, 8.0, 0.3),
        TRINE(120.0, 8.0, 1.0),
        OPPOSITION(180.0, 8.0, -0.5);

        final double angle;
        final double orb;
        final double harmony;

        Aspect(double angle, double orb, double harmony) {
            this.angle = angle;
            this.orb = orb;
            this.harmony = harmony;
        }
    }

    enum Body { SUN, MOON, ASCENDANT }

    record Placement(Body body, double absoluteDegree) {
    }

    @Override
    public Grade calculate(Profile viewer, Profile candidate) {
        return Grade.fromScore(score(viewer, candidate));
    }

    double score(Profile viewer, Profile candidate) {
        List<Placement> first = placements(viewer);
        List<Placement> second = placements(candidate);

        double harmony = 0.0;
        double totalWeight = 0.0;
        for (Placement a : first) {
            for (Placement b : second) {
                // Sun-Moon and Moon-Sun are the same pairing
                if (b.body().ordinal() < a.body().ordinal()) {
                    continue;
                }
                double separation = separation(a.absoluteDegree(), b.absoluteDegree());
                for (Aspect aspect : Aspect.values()) {
                    double deviation = Math.abs(separation - aspect.angle);
                    if (deviation <= aspect.orb) {
                        double tightness = Math.max(0.0, Math.min(1.0, 1.0 - deviation / aspect.orb));
                        double weight = baseWeight(a.body(), b.body()) * (1.0 + tightness * TIGHTNESS_BONUS);
                        harmony += aspect.harmony * weight;
                        totalWeight += weight;
                        break;
                    }
                }
            }
        }
        if (totalWeight == 0.0) {
            log.debug("No aspects between viewerId={} and candidateId={}", viewer.getId(), candidate.getId());
            return NEUTRAL_SCORE;
        }
        return Math.max(0.0, Math.min(100.0, NEUTRAL_SCORE + harmony / totalWeight * HARMONY_SCALE));
    }

    private List<Placement> placements(Profile profile) {
        NatalPlacements natal = profile.getNatalPlacements();
        if (natal == null || natal.getSunSign() == null) {
            throw new InsufficientDataException("Birth chart unavailable for profile " + profile.getId());
        }
        List<Placement> placements = new ArrayList<>(3);
        addPlacement(placements, Body.SUN, natal.getSunSign(), natal.getSunDegree());
        addPlacement(placements, Body.MOON, natal.getMoonSign(), natal.getMoonDegree());
        addPlacement(placements, Body.ASCENDANT, natal.getRisingSign(), natal.getRisingDegree());
        return placements;
    }

    private static void addPlacement(List<Placement> placements, Body body, ZodiacSign sign, Double degreeInSign) {
        if (sign == null || degreeInSign == null || degreeInSign.isNaN()) {
            return;
        }
        placements.add(new Placement(body, sign.startDegree() + Math.max(0.0, Math.min(30.0, degreeInSign))));
    }

    private static double separation(double first, double second) {
        double diff = Math.abs(first - second) % 360.0;
        return diff > 180.0 ? 360.0 - diff : diff;
    }

    private static double baseWeight(Body first, Body second) {
        if ((first == Body.SUN && second == Body.MOON) || (first == Body.MOON && second == Body.SUN)) {
            return SUN_MOON_WEIGHT;
        }
        return LUMINARY_WEIGHT;
    }
}
