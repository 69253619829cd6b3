package com.sluice.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class SluiceProperties {

    private PoolProperties pool = new PoolProperties();
    private ProbeProperties probe = new ProbeProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private ContentProperties content = new ContentProperties();
    private StatsProperties stats = new StatsProperties();

    @Data
    public static class PoolProperties {
        private List<String> candidates = new ArrayList<>();
        private int minSampleSize = 5;
        private double evictionFloor = 0.2;
        private boolean selectUntested = true;
    }

    @Data
    public static class ProbeProperties {
        private boolean enabled = true;
        private String targetUrl = "http://httpbin.org/ip";
        private int fastStartCount = 20;
        private long fastStartTimeout = 5000;
        private long sweepTimeout = 10000;
        private long sweepDelay = 1000;
        private long sweepInterval = 30000;
    }

    @Data
    public static class DispatchProperties {
        private boolean useProxies = true;
        private int maxAttempts = 3;
        private long attemptTimeout = 15000;
        private long callTimeout = 60000;
        private long connectTimeout = 5000;
        private int maxCachedClients = 64;
        private long backoffBase = 1000;
        private long backoffJitter = 2000;
    }

    @Data
    public static class ContentProperties {
        private String readerUrl = "https://r.jina.ai/";
        private String searchUrl = "https://s.jina.ai/";
    }

    @Data
    public static class StatsProperties {
        private long broadcastInterval = 5000;
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
