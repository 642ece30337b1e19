package com.affinity.x.repo;

import com.affinity.x.models.CompatibilityScoreEntity;
import com.affinity.x.models.CompatibilityScoreId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CompatibilityScoreRepository extends JpaRepository<CompatibilityScoreEntity, CompatibilityScoreId> {
}
