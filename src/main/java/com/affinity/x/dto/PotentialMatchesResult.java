package com.affinity.x.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PotentialMatchesResult {
    private List<BatchResult> matches;
    private BatchMetrics metrics;
    private boolean fromCache;
    private int limit;
    private int offset;
}
