package com.sluice.config;

import com.sluice.metrics.DispatchMetrics;
import com.sluice.model.ProxyEndpoint;
import com.sluice.pool.PoolStateMachine;
import com.sluice.pool.ProxyPool;
import com.sluice.pool.ProxyRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
public class SluiceConfig {

    @Bean
    @ConfigurationProperties(prefix = "sluice")
    public SluiceProperties sluiceProperties() {
        return new SluiceProperties();
    }

    @Bean
    public ProxyPool proxyPool(SluiceProperties properties) {
        return new ProxyPool(properties.getPool().isSelectUntested());
    }

    @Bean
    public PoolStateMachine poolStateMachine(ProxyPool proxyPool, SluiceProperties properties) {
        return new PoolStateMachine(proxyPool,
                properties.getPool().getMinSampleSize(),
                properties.getPool().getEvictionFloor());
    }

    @Bean
    public ProxyRecordStore proxyRecordStore(ProxyPool proxyPool, PoolStateMachine stateMachine,
                                             DispatchMetrics dispatchMetrics, SluiceProperties properties) {
        ProxyRecordStore store = new ProxyRecordStore(proxyPool, stateMachine, dispatchMetrics);
        int added = store.addCandidates(parseCandidates(properties.getPool().getCandidates()));

        log.info("Initialized proxy pool with {} candidates", added);
        return store;
    }

    static List<ProxyEndpoint> parseCandidates(List<String> candidates) {
        List<ProxyEndpoint> endpoints = new ArrayList<>();
        if (candidates == null) {
            return endpoints;
        }
        for (String candidate : candidates) {
            try {
                endpoints.add(ProxyEndpoint.parse(candidate));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping invalid proxy candidate '{}': {}", candidate, e.getMessage());
            }
        }
        return endpoints;
    }
}
