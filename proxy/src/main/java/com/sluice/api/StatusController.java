package com.sluice.api;

import com.sluice.metrics.DispatchMetrics;
import com.sluice.model.PoolStats;
import com.sluice.pool.ProxyRecord;
import com.sluice.pool.ProxyRecordStore;
import com.sluice.websocket.WebSocketConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class StatusController {

    static final String SERVICE_NAME = "Sluice Proxy API";
    static final String VERSION = "1.0.0";
    private static final int PROXY_DETAIL_LIMIT = 5;

    private final ProxyRecordStore store;
    private final DispatchMetrics metrics;

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> home() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("/", "API documentation (this page)");
        endpoints.put("/search", "POST - Search the web, body {\"query\": \"...\"}");
        endpoints.put("/read", "POST - Read URL content, body {\"url\": \"https://...\"}");
        endpoints.put("/health", "GET - Health check and statistics");
        endpoints.put("/stats", "GET - Detailed statistics");
        endpoints.put(WebSocketConfig.POOL_STATS_PATH, "WebSocket - Live proxy pool statistics");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", SERVICE_NAME);
        body.put("version", VERSION);
        body.put("description", "Forwards content and search requests through a rotating proxy pool");
        body.put("features", List.of(
                "Automatic proxy rotation",
                "Fallback to direct connection",
                "Background proxy health probing",
                "Request statistics"));
        body.put("endpoints", endpoints);
        body.put("stats", serviceStats());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        ServiceStats stats = serviceStats();
        String status = store.getPool().getSelectable().isEmpty() ? "degraded" : "healthy";
        return ResponseEntity.ok(new HealthResponse(status, Instant.now(), SERVICE_NAME + " v" + VERSION, stats));
    }

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> stats() {
        List<ProxyRecord> working = store.getPool().getWorking();
        List<String> sample = working.stream()
                .limit(PROXY_DETAIL_LIMIT)
                .map(record -> record.getEndpoint().toString())
                .toList();

        ProxyDetails details = new ProxyDetails(
                working.size(),
                store.getPool().getFailed().size(),
                sample,
                Instant.now());
        return ResponseEntity.ok(new StatsResponse(serviceStats(), details));
    }

    private ServiceStats serviceStats() {
        PoolStats poolStats = store.snapshotStats();
        return ServiceStats.of(poolStats, metrics);
    }

    public record HealthResponse(String status, Instant timestamp, String service, ServiceStats stats) {}

    public record StatsResponse(ServiceStats serviceStats, ProxyDetails proxyDetails) {}

    public record ProxyDetails(int workingCount, int failedCount, List<String> workingProxies, Instant lastUpdated) {}
}
