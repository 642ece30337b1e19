package com.affinity.x.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PotentialMatchOptions {
    private Integer limit;
    private Integer offset;
    private Integer minCompatibility;
    private Integer maxBatchSize;
    private Long timeoutMs;
    private Boolean useCache;

    public static PotentialMatchOptions defaults() {
        return new PotentialMatchOptions();
    }
}
