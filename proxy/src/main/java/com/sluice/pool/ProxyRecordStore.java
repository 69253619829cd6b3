package com.sluice.pool;

import com.sluice.metrics.DispatchMetrics;
import com.sluice.model.PoolStats;
import com.sluice.model.ProxyClassification;
import com.sluice.model.ProxyEndpoint;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

@Slf4j
public class ProxyRecordStore {

    private final ProxyPool pool;
    private final PoolStateMachine stateMachine;
    private final DispatchMetrics dispatchMetrics;

    public ProxyRecordStore(ProxyPool pool, PoolStateMachine stateMachine, DispatchMetrics dispatchMetrics) {
        this.pool = pool;
        this.stateMachine = stateMachine;
        this.dispatchMetrics = dispatchMetrics;
    }

    public int addCandidates(List<ProxyEndpoint> endpoints) {
        int added = stateMachine.register(endpoints);
        if (added < endpoints.size()) {
            log.debug("Ignored {} duplicate proxy candidates", endpoints.size() - added);
        }
        return added;
    }

    public Optional<ProxyRecord> get(ProxyEndpoint endpoint) {
        return pool.get(endpoint);
    }

    public ProxyClassification recordOutcome(ProxyEndpoint endpoint, boolean success) {
        return stateMachine.onLiveOutcome(endpoint, success);
    }

    public ProxyClassification recordProbe(ProxyEndpoint endpoint, boolean success) {
        return stateMachine.onProbeResult(endpoint, success);
    }

    public PoolStats snapshotStats() {
        ProxyPool.PoolView view = pool.view();
        return PoolStats.builder()
                .totalCandidates(pool.size())
                .workingCount(view.working().size())
                .failedCount(view.failed().size())
                .untestedCount(view.untested().size())
                .totalAttempts(dispatchMetrics.getIssuedAttempts())
                .successfulAttempts(dispatchMetrics.getSuccessfulAttempts())
                .failedAttempts(dispatchMetrics.getFailedAttempts())
                .build();
    }

    public ProxyPool getPool() {
        return pool;
    }
}
