package com.affinity.x.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchMetrics {
    private int requested;
    private int processed;
    private int succeeded;
    private int fallbacks;
    private long elapsedMs;
    private boolean truncated;
}
