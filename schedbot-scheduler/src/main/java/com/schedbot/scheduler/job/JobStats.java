package com.schedbot.scheduler.job;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-job execution counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStats {
    private long executionCount;
    private Instant lastExecuted;
    private Instant createdAt;
}
