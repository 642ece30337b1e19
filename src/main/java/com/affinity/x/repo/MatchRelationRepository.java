package com.affinity.x.repo;

import com.affinity.x.dto.enums.MatchStatus;
import com.affinity.x.models.MatchRelation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface MatchRelationRepository extends JpaRepository<MatchRelation, UUID> {

    @Query("""
           SELECT COUNT(m) > 0
           FROM MatchRelation m
           WHERE m.status = :status
             AND ((m.user1Id = :first AND m.user2Id = :second)
               OR (m.user1Id = :second AND m.user2Id = :first))
           """)
    boolean existsBetween(@Param("first") UUID first, @Param("second") UUID second, @Param("status") MatchStatus status);

    default boolean isActiveMatch(UUID first, UUID second) {
        return existsBetween(first, second, MatchStatus.ACTIVE);
    }
}
