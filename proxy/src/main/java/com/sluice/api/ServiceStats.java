package com.sluice.api;

import com.sluice.metrics.DispatchMetrics;
import com.sluice.model.PoolStats;

import java.util.Locale;

public record ServiceStats(
        long uptimeSeconds,
        long totalRequests,
        int workingProxies,
        int failedProxies,
        int untestedProxies,
        int totalProxies,
        String successRate,
        long totalAttempts,
        long successfulAttempts,
        long failedAttempts,
        long directFallbacks
) {

    public static ServiceStats of(PoolStats pool, DispatchMetrics metrics) {
        String successRate = pool.getTotalCandidates() == 0
                ? "0%"
                : String.format(Locale.ROOT, "%.1f%%", pool.getWorkingCount() * 100.0 / pool.getTotalCandidates());

        return new ServiceStats(
                metrics.getUptime().toSeconds(),
                metrics.getDispatchCalls(),
                pool.getWorkingCount(),
                pool.getFailedCount(),
                pool.getUntestedCount(),
                pool.getTotalCandidates(),
                successRate,
                pool.getTotalAttempts(),
                pool.getSuccessfulAttempts(),
                pool.getFailedAttempts(),
                metrics.getDirectFallbacks()
        );
    }
}
