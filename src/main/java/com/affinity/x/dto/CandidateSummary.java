package com.affinity.x.dto;

import com.affinity.x.dto.enums.ZodiacSign;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CandidateSummary {
    private UUID id;
    private String displayName;
    private boolean premium;
    private ZodiacSign sunSign;
    private Integer age;
    private Double distanceKm;
}
