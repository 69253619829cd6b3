package com.sluice.pool;

import com.sluice.model.ProxyEndpoint;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoundRobinSelectorTest {

    @Test
    void returnsEachWorkingProxyOncePerCycleInSeedOrder() {
        PoolFixture fixture = new PoolFixture().seed("10.0.0.1:80", "10.0.0.2:80", "10.0.0.3:80");
        fixture.pool.getAll().forEach(record -> fixture.store.recordProbe(record.getEndpoint(), true));
        RoundRobinSelector selector = new RoundRobinSelector(fixture.pool);

        List<String> picks = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            picks.add(selector.next().orElseThrow().getEndpoint().address());
        }

        assertEquals(List.of(
                "10.0.0.1:80", "10.0.0.2:80", "10.0.0.3:80",
                "10.0.0.1:80", "10.0.0.2:80", "10.0.0.3:80"), picks);
    }

    @Test
    void returnsEmptyWhenNothingSelectable() {
        PoolFixture fixture = new PoolFixture().seed("10.0.0.1:80");
        fixture.store.recordProbe(ProxyEndpoint.parse("10.0.0.1:80"), false);

        assertTrue(new RoundRobinSelector(fixture.pool).next().isEmpty());
        assertTrue(new RoundRobinSelector(new ProxyPool(true)).next().isEmpty());
    }

    @Test
    void skipsFailedProxies() {
        PoolFixture fixture = new PoolFixture().seed("10.0.0.1:80", "10.0.0.2:80", "10.0.0.3:80");
        fixture.store.recordProbe(ProxyEndpoint.parse("10.0.0.1:80"), true);
        fixture.store.recordProbe(ProxyEndpoint.parse("10.0.0.2:80"), false);
        fixture.store.recordProbe(ProxyEndpoint.parse("10.0.0.3:80"), true);
        RoundRobinSelector selector = new RoundRobinSelector(fixture.pool);

        for (int i = 0; i < 10; i++) {
            assertTrue(selector.next().orElseThrow().isWorking());
        }
    }

    @Test
    void untestedProxiesAreSelectableOnlyWhenEnabled() {
        PoolFixture provisional = new PoolFixture(true, 5, 0.2).seed("10.0.0.1:80");
        PoolFixture strict = new PoolFixture(false, 5, 0.2).seed("10.0.0.1:80");

        assertTrue(new RoundRobinSelector(provisional.pool).next().isPresent());
        assertTrue(new RoundRobinSelector(strict.pool).next().isEmpty());
    }

    @Test
    void toleratesConcurrentEvictionAndRecovery() throws Exception {
        String[] addresses = new String[20];
        for (int i = 0; i < addresses.length; i++) {
            addresses[i] = "10.0.1." + (i + 1) + ":80";
        }
        PoolFixture fixture = new PoolFixture().seed(addresses);
        RoundRobinSelector selector = new RoundRobinSelector(fixture.pool);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 3; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 5_000; i++) {
                        Optional<ProxyRecord> selected = selector.next();
                        selected.ifPresent(record -> assertTrue(record.getEndpoint().port() == 80));
                    }
                    return null;
                }));
            }
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 2_000; i++) {
                    ProxyEndpoint endpoint = ProxyEndpoint.parse(addresses[i % addresses.length]);
                    fixture.store.recordProbe(endpoint, i % 3 == 0);
                }
                return null;
            }));

            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
