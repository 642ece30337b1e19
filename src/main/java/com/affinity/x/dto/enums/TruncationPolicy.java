package com.affinity.x.dto.enums;

/**
 * What the batch orchestrator does with candidate lists longer than the allowed batch size.
 */
public enum TruncationPolicy {
    /** Score the first {@code maxBatchSize} ids and flag the response as truncated. */
    TRUNCATE,
    /** Refuse the whole batch as an input error. */
    REJECT
}
