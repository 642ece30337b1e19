package com.affinity.x.models;

import com.affinity.x.dto.enums.MatchStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A confirmed match between two users. Pair order is not meaningful.
 */
@Entity
@Table(name = "matches", indexes = {
        @Index(name = "idx_matches_user1_user2", columnList = "user1_id,user2_id")
})
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatchRelation {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user1_id", nullable = false)
    private UUID user1Id;

    @Column(name = "user2_id", nullable = false)
    private UUID user2Id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MatchStatus status;

    @Column(name = "matched_at")
    private LocalDateTime matchedAt;
}
