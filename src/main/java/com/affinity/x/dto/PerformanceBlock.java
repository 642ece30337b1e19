package com.affinity.x.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceBlock {
    private long responseTimeMs;
    private boolean cacheUsed;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Integer batchSize;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String performanceWarning;
}
