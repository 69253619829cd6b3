package com.sluice.probe;

import com.sluice.config.SluiceProperties;
import com.sluice.model.ProxyClassification;
import com.sluice.model.ProxyEndpoint;
import com.sluice.pool.ProxyPool;
import com.sluice.pool.ProxyRecord;
import com.sluice.pool.ProxyRecordStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Component
public class HealthProber implements SmartInitializingSingleton {

    private static final int MAX_FAST_START_THREADS = 20;

    private final ProxyPool pool;
    private final ProxyRecordStore store;
    private final HealthProbe probe;
    private final SluiceProperties.ProbeProperties properties;

    private volatile boolean stopped;

    public HealthProber(ProxyPool pool, ProxyRecordStore store, HealthProbe probe, SluiceProperties properties) {
        this.pool = pool;
        this.store = store;
        this.probe = probe;
        this.properties = properties.getProbe();
    }

    @Override
    public void afterSingletonsInstantiated() {
        if (!properties.isEnabled()) {
            log.info("Proxy probing disabled; all {} candidates stay untested", pool.size());
            return;
        }
        fastStart();
    }

    public void fastStart() {
        List<ProxyRecord> prefix = pool.getAll().stream()
                .limit(Math.max(0, properties.getFastStartCount()))
                .toList();
        if (prefix.isEmpty()) {
            log.warn("No proxy candidates to probe at startup");
            return;
        }

        Duration timeout = Duration.ofMillis(properties.getFastStartTimeout());
        log.info("Fast-start probing {} of {} proxy candidates ({}ms timeout)",
                prefix.size(), pool.size(), timeout.toMillis());

        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(prefix.size(), MAX_FAST_START_THREADS), threadFactory("sluice-fast-start"));
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (ProxyRecord record : prefix) {
                tasks.add(() -> probeAndRecord(record.getEndpoint(), timeout));
            }
            long waitMs = timeout.toMillis() * (1 + prefix.size() / MAX_FAST_START_THREADS) + 1000;
            executor.invokeAll(tasks, waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Fast-start probing interrupted");
        } finally {
            executor.shutdownNow();
        }

        log.info("Fast-start complete: {} working, {} failed, {} untested",
                pool.getWorking().size(), pool.getFailed().size(), pool.getUntested().size());
    }

    @Scheduled(fixedDelayString = "${sluice.probe.sweepInterval:30000}")
    public void sweep() {
        if (stopped || !properties.isEnabled()) {
            return;
        }

        List<ProxyRecord> targets = pool.getAll().stream()
                .filter(record -> !record.isWorking())
                .toList();
        if (targets.isEmpty()) {
            log.debug("Sweep skipped: every proxy is working");
            return;
        }

        Duration timeout = Duration.ofMillis(properties.getSweepTimeout());
        AtomicInteger promoted = new AtomicInteger();
        int probed = 0;

        for (ProxyRecord record : targets) {
            if (stopped || Thread.currentThread().isInterrupted()) {
                log.info("Sweep stopped after {} of {} probes", probed, targets.size());
                return;
            }
            if (record.isWorking()) {
                continue;
            }
            if (probeAndRecord(record.getEndpoint(), timeout)) {
                promoted.incrementAndGet();
            }
            probed++;

            if (!pause()) {
                log.info("Sweep interrupted after {} of {} probes", probed, targets.size());
                return;
            }
        }

        log.info("Sweep probed {} proxies, {} now working ({} working, {} failed in pool)",
                probed, promoted.get(), pool.getWorking().size(), pool.getFailed().size());
    }

    @PreDestroy
    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    private boolean probeAndRecord(ProxyEndpoint endpoint, Duration timeout) {
        boolean success;
        try {
            success = probe.probe(endpoint, timeout);
        } catch (RuntimeException e) {
            log.warn("Probe of {} raised an error: {}", endpoint.address(), e.getMessage());
            success = false;
        }
        ProxyClassification classification = store.recordProbe(endpoint, success);
        log.debug("Probe result for {}: success={}, now {}", endpoint.address(), success, classification);
        return success;
    }

    private boolean pause() {
        long delay = properties.getSweepDelay();
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ThreadFactory threadFactory(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
