package com.affinity.x.support;

import com.affinity.x.dto.enums.Gender;
import com.affinity.x.dto.enums.ZodiacSign;
import com.affinity.x.models.NatalPlacements;
import com.affinity.x.models.Profile;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;

public final class Profiles {

    private Profiles() {
    }

    public static Profile scoreable(UUID id, ZodiacSign sun, int answer) {
        return Profile.builder()
                .id(id)
                .displayName("user-" + id)
                .gender(Gender.FEMALE)
                .lookingFor(new HashSet<>())
                .birthDate(LocalDate.of(1994, 6, 1))
                .natalPlacements(NatalPlacements.builder().sunSign(sun).sunDegree(10.0).build())
                .questionnaireAnswers(answers(answer))
                .onboardingCompleted(true)
                .build();
    }

    public static List<Integer> answers(int value) {
        return new ArrayList<>(Collections.nCopies(25, value));
    }
}
