package com.sluice.pool;

import com.sluice.model.ProxyClassification;
import com.sluice.model.ProxyEndpoint;
import lombok.Getter;

import java.time.Instant;

@Getter
public class ProxyRecord {

    private final ProxyEndpoint endpoint;
    private volatile ProxyClassification classification;
    private volatile long successCount;
    private volatile long attemptCount;
    private volatile long probeCount;
    private volatile Boolean lastProbeSucceeded;
    private volatile Instant lastProbeAt;
    private volatile Instant lastStateChange;

    ProxyRecord(ProxyEndpoint endpoint) {
        this.endpoint = endpoint;
        this.classification = ProxyClassification.UNTESTED;
        this.lastStateChange = Instant.now();
    }

    public double getSuccessRatio() {
        long attempts = attemptCount;
        if (attempts == 0) {
            return 1.0;
        }
        return (double) successCount / attempts;
    }

    public boolean isWorking() {
        return classification == ProxyClassification.WORKING;
    }

    public boolean isFailed() {
        return classification == ProxyClassification.FAILED;
    }

    void recordAttempt(boolean success) {
        attemptCount++;
        if (success) {
            successCount++;
        }
    }

    void recordProbe(boolean success) {
        probeCount++;
        lastProbeSucceeded = success;
        lastProbeAt = Instant.now();
    }

    void transitionTo(ProxyClassification newClassification) {
        if (classification != newClassification) {
            classification = newClassification;
            lastStateChange = Instant.now();
        }
    }

    @Override
    public String toString() {
        return endpoint.address() + "[" + classification + ", " + successCount + "/" + attemptCount + "]";
    }
}
