package com.sluice.websocket;

import com.sluice.model.PoolStats;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PoolStatsMessage {
    long timestamp;
    PoolStats pool;
    List<ProxyView> proxies;
    long dispatchCalls;
    long directFallbacks;
    double averageAttemptLatencyMs;

    @Value
    @Builder
    public static class ProxyView {
        String address;
        String classification;
        long successCount;
        long attemptCount;
        double successRatio;
        Boolean lastProbeSucceeded;
    }
}
