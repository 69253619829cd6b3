package com.sluice.pool;

import com.sluice.model.ProxyClassification;
import com.sluice.model.ProxyEndpoint;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;

@Slf4j
public class PoolStateMachine {

    // sole writer: probes always win, live traffic only demotes
    private final ProxyPool pool;
    @Getter
    private final int minSampleSize;
    @Getter
    private final double evictionFloor;

    public PoolStateMachine(ProxyPool pool, int minSampleSize, double evictionFloor) {
        if (minSampleSize < 1) {
            throw new IllegalArgumentException("minSampleSize must be at least 1");
        }
        if (evictionFloor < 0.0 || evictionFloor > 1.0) {
            throw new IllegalArgumentException("evictionFloor must be within [0, 1]");
        }
        this.pool = pool;
        this.minSampleSize = minSampleSize;
        this.evictionFloor = evictionFloor;
    }

    public synchronized int register(Collection<ProxyEndpoint> endpoints) {
        int added = 0;
        for (ProxyEndpoint endpoint : endpoints) {
            if (pool.add(endpoint) != null) {
                added++;
            }
        }
        if (added > 0) {
            log.debug("Registered {} new proxy candidates ({} total)", added, pool.size());
        }
        return added;
    }

    public synchronized ProxyClassification onLiveOutcome(ProxyEndpoint endpoint, boolean success) {
        ProxyRecord record = require(endpoint);
        record.recordAttempt(success);

        ProxyClassification current = record.getClassification();
        if (!success && current != ProxyClassification.FAILED && isBelowFloor(record)) {
            pool.reclassify(record, ProxyClassification.FAILED);
            log.info("Evicted proxy {}: success ratio {} over {} attempts is below {}",
                    endpoint.address(),
                    String.format("%.2f", record.getSuccessRatio()),
                    record.getAttemptCount(),
                    evictionFloor);
        }
        return record.getClassification();
    }

    public synchronized ProxyClassification onProbeResult(ProxyEndpoint endpoint, boolean success) {
        ProxyRecord record = require(endpoint);
        record.recordProbe(success);

        ProxyClassification previous = record.getClassification();
        ProxyClassification next = success ? ProxyClassification.WORKING : ProxyClassification.FAILED;
        if (previous != next) {
            pool.reclassify(record, next);
            if (previous == ProxyClassification.FAILED) {
                log.info("Proxy recovered: {} {} -> {}", endpoint.address(), previous, next);
            } else {
                log.info("Proxy classified: {} {} -> {}", endpoint.address(), previous, next);
            }
        }
        return next;
    }

    boolean isBelowFloor(ProxyRecord record) {
        return record.getAttemptCount() >= minSampleSize && record.getSuccessRatio() < evictionFloor;
    }

    private ProxyRecord require(ProxyEndpoint endpoint) {
        return pool.get(endpoint)
                .orElseThrow(() -> new IllegalArgumentException("Unknown proxy endpoint: " + endpoint));
    }
}
