package com.sluice.pool;

import com.sluice.model.PoolStats;
import com.sluice.model.ProxyClassification;
import com.sluice.model.ProxyEndpoint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProxyRecordStoreTest {

    @Test
    void addCandidatesIsIdempotent() {
        PoolFixture fixture = new PoolFixture();
        List<ProxyEndpoint> seed = PoolFixture.endpoints("10.0.0.1:80", "10.0.0.2:80", "10.0.0.3:80");

        assertEquals(3, fixture.store.addCandidates(seed));
        fixture.store.recordProbe(seed.get(0), true);
        fixture.store.recordProbe(seed.get(1), false);

        assertEquals(0, fixture.store.addCandidates(seed));
        assertEquals(3, fixture.pool.size());
        assertEquals(ProxyClassification.WORKING, fixture.record("10.0.0.1:80").getClassification());
        assertEquals(ProxyClassification.FAILED, fixture.record("10.0.0.2:80").getClassification());
        assertEquals(ProxyClassification.UNTESTED, fixture.record("10.0.0.3:80").getClassification());
    }

    @Test
    void ignoresDuplicatesWithinOneList() {
        PoolFixture fixture = new PoolFixture();

        int added = fixture.store.addCandidates(
                PoolFixture.endpoints("10.0.0.1:80", "http://10.0.0.1:80", "10.0.0.2:80"));

        assertEquals(2, added);
        assertEquals(2, fixture.pool.size());
    }

    @Test
    void freshRecordIsUntestedWithFullRatio() {
        PoolFixture fixture = new PoolFixture().seed("10.0.0.1:80");

        ProxyRecord record = fixture.store.get(ProxyEndpoint.parse("10.0.0.1:80")).orElseThrow();

        assertEquals(ProxyClassification.UNTESTED, record.getClassification());
        assertEquals(0, record.getAttemptCount());
        assertEquals(1.0, record.getSuccessRatio(), 1e-9);
    }

    @Test
    void snapshotStatsReflectsClassificationCounts() {
        PoolFixture fixture = new PoolFixture().seed("10.0.0.1:80", "10.0.0.2:80", "10.0.0.3:80", "10.0.0.4:80");
        fixture.store.recordProbe(ProxyEndpoint.parse("10.0.0.1:80"), true);
        fixture.store.recordProbe(ProxyEndpoint.parse("10.0.0.2:80"), false);
        fixture.store.recordProbe(ProxyEndpoint.parse("10.0.0.3:80"), false);

        PoolStats stats = fixture.store.snapshotStats();

        assertEquals(4, stats.getTotalCandidates());
        assertEquals(1, stats.getWorkingCount());
        assertEquals(2, stats.getFailedCount());
        assertEquals(1, stats.getUntestedCount());
        assertEquals(0, stats.getTotalAttempts());
    }

    @Test
    void indexesKeepSeedOrder() {
        PoolFixture fixture = new PoolFixture().seed("10.0.0.3:80", "10.0.0.1:80", "10.0.0.2:80");
        fixture.store.recordProbe(ProxyEndpoint.parse("10.0.0.2:80"), true);
        fixture.store.recordProbe(ProxyEndpoint.parse("10.0.0.3:80"), true);

        List<String> working = fixture.pool.getWorking().stream()
                .map(record -> record.getEndpoint().address())
                .toList();

        assertEquals(List.of("10.0.0.3:80", "10.0.0.2:80"), working);
        assertTrue(fixture.pool.getSelectable().containsAll(fixture.pool.getUntested()));
    }
}
