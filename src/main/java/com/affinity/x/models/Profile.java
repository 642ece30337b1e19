package com.affinity.x.models;

import com.affinity.x.dto.enums.Gender;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "profiles", indexes = {
        @Index(name = "idx_profiles_sun_sign", columnList = "sun_sign"),
        @Index(name = "idx_profiles_birth_date", columnList = "birth_date"),
        @Index(name = "idx_profiles_location", columnList = "latitude,longitude")
})
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Profile {
    @Id
    private UUID id;

    @Column(name = "display_name")
    private String displayName;

    @Enumerated(EnumType.STRING)
    private Gender gender;

    @Builder.Default
    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "profile_looking_for", joinColumns = @JoinColumn(name = "profile_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "gender")
    private Set<Gender> lookingFor = new HashSet<>();

    @Column(name = "birth_date")
    private LocalDate birthDate;

    @Column(name = "birth_time")
    private LocalTime birthTime;

    @Column(name = "birth_location")
    private String birthLocation;

    @Embedded
    private NatalPlacements natalPlacements;

    @Builder.Default
    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "profile_questionnaire_answers", joinColumns = @JoinColumn(name = "profile_id"))
    @OrderColumn(name = "question_index")
    @Column(name = "answer")
    private List<Integer> questionnaireAnswers = new ArrayList<>();

    private Double latitude;
    private Double longitude;

    @Column(name = "min_age_preference")
    private Integer minAgePreference;

    @Column(name = "max_age_preference")
    private Integer maxAgePreference;

    @Column(name = "max_distance_km")
    private Integer maxDistanceKm;

    @Builder.Default
    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "profile_activity_preferences", joinColumns = @JoinColumn(name = "profile_id"))
    @Column(name = "activity")
    private Set<String> activityPreferences = new HashSet<>();

    @Column(name = "onboarding_completed")
    private boolean onboardingCompleted;

    private boolean premium;

    @Column(name = "last_active_at")
    private LocalDateTime lastActiveAt;

    public boolean hasBirthData() {
        return birthDate != null && natalPlacements != null && natalPlacements.getSunSign() != null;
    }

    public boolean hasQuestionnaireAnswers() {
        return questionnaireAnswers != null && !questionnaireAnswers.isEmpty();
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
