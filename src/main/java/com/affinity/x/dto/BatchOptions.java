package com.affinity.x.dto;

import com.affinity.x.dto.enums.TruncationPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-call batch limits. Null fields fall back to the configured defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchOptions {
    private Integer maxBatchSize;
    private Long timeoutMs;
    private TruncationPolicy truncationPolicy;

    public static BatchOptions defaults() {
        return new BatchOptions();
    }
}
