package com.sluice.pool;

import com.sluice.metrics.DispatchMetrics;
import com.sluice.model.ProxyEndpoint;

import java.util.Arrays;
import java.util.List;

/**
 * Wires a pool, state machine and store the way the application context does.
 */
public final class PoolFixture {

    public final ProxyPool pool;
    public final PoolStateMachine stateMachine;
    public final DispatchMetrics metrics;
    public final ProxyRecordStore store;

    public PoolFixture() {
        this(true, 5, 0.2);
    }

    public PoolFixture(boolean selectUntested, int minSampleSize, double evictionFloor) {
        this.pool = new ProxyPool(selectUntested);
        this.stateMachine = new PoolStateMachine(pool, minSampleSize, evictionFloor);
        this.metrics = new DispatchMetrics();
        this.store = new ProxyRecordStore(pool, stateMachine, metrics);
    }

    public PoolFixture seed(String... addresses) {
        store.addCandidates(endpoints(addresses));
        return this;
    }

    public ProxyRecord record(String address) {
        return pool.get(ProxyEndpoint.parse(address)).orElseThrow();
    }

    public static List<ProxyEndpoint> endpoints(String... addresses) {
        return Arrays.stream(addresses).map(ProxyEndpoint::parse).toList();
    }
}
