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
public class BatchScoreResult {
    private List<BatchResult> results;
    private BatchMetrics metrics;
}
