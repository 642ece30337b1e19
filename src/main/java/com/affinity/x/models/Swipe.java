package com.affinity.x.models;

import com.affinity.x.dto.enums.SwipeDirection;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "swipes", indexes = {
        @Index(name = "idx_swipes_swiper_swiped", columnList = "swiper_id,swiped_id", unique = true)
})
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Swipe {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "swiper_id", nullable = false)
    private UUID swiperId;

    @Column(name = "swiped_id", nullable = false)
    private UUID swipedId;

    @Enumerated(EnumType.STRING)
    private SwipeDirection direction;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
