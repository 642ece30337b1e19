package com.affinity.x.repo;

import com.affinity.x.models.Profile;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProfileRepository extends JpaRepository<Profile, UUID> {

    /**
     * Loads a profile with its questionnaire answers so it can be scored off the request thread.
     */
    @EntityGraph(attributePaths = {"questionnaireAnswers"})
    Optional<Profile> findWithAnswersById(UUID id);
}
