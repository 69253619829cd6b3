package com.sluice.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PoolStats {
    int totalCandidates;
    int workingCount;
    int failedCount;
    int untestedCount;
    long totalAttempts;
    long successfulAttempts;
    long failedAttempts;
}
