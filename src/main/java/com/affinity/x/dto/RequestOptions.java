package com.affinity.x.dto;

import com.affinity.x.dto.enums.TruncationPolicy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestOptions {
    @Positive(message = "max_batch_size must be positive")
    private Integer maxBatchSize;

    @Positive(message = "timeout_ms must be positive")
    @Max(value = 30000, message = "timeout_ms must not exceed 30000")
    private Long timeoutMs;

    private TruncationPolicy truncationPolicy;

    @Positive(message = "limit must be positive")
    private Integer limit;

    @Min(value = 0, message = "offset must not be negative")
    private Integer offset;

    @Min(value = 0, message = "min_compatibility must be between 0 and 100")
    @Max(value = 100, message = "min_compatibility must be between 0 and 100")
    private Integer minCompatibility;

    private Boolean useCache;

    public BatchOptions toBatchOptions() {
        return BatchOptions.builder()
                .maxBatchSize(maxBatchSize)
                .timeoutMs(timeoutMs)
                .truncationPolicy(truncationPolicy)
                .build();
    }

    public PotentialMatchOptions toPotentialMatchOptions() {
        return PotentialMatchOptions.builder()
                .limit(limit)
                .offset(offset)
                .minCompatibility(minCompatibility)
                .maxBatchSize(maxBatchSize)
                .timeoutMs(timeoutMs)
                .useCache(useCache)
                .build();
    }
}
