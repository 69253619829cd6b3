package com.sluice.websocket;

import com.sluice.metrics.DispatchMetrics;
import com.sluice.pool.ProxyRecord;
import com.sluice.pool.ProxyRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class PoolStatsBroadcaster {

    private final PoolStatsWebSocketHandler webSocketHandler;
    private final ProxyRecordStore store;
    private final DispatchMetrics metrics;

    @Scheduled(fixedDelayString = "${sluice.stats.broadcastInterval:5000}")
    public void broadcast() {
        if (webSocketHandler.getActiveConnections() == 0) {
            return;
        }
        try {
            webSocketHandler.broadcast(snapshot());
        } catch (RuntimeException e) {
            log.error("Failed to broadcast pool stats", e);
        }
    }

    PoolStatsMessage snapshot() {
        var proxies = store.getPool().getAll().stream()
                .map(PoolStatsBroadcaster::toView)
                .toList();

        return PoolStatsMessage.builder()
                .timestamp(System.currentTimeMillis())
                .pool(store.snapshotStats())
                .proxies(proxies)
                .dispatchCalls(metrics.getDispatchCalls())
                .directFallbacks(metrics.getDirectFallbacks())
                .averageAttemptLatencyMs(metrics.getAverageAttemptLatencyMs())
                .build();
    }

    private static PoolStatsMessage.ProxyView toView(ProxyRecord record) {
        return PoolStatsMessage.ProxyView.builder()
                .address(record.getEndpoint().toString())
                .classification(record.getClassification().name())
                .successCount(record.getSuccessCount())
                .attemptCount(record.getAttemptCount())
                .successRatio(record.getSuccessRatio())
                .lastProbeSucceeded(record.getLastProbeSucceeded())
                .build();
    }
}
