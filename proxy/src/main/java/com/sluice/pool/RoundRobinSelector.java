package com.sluice.pool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class RoundRobinSelector {

    private final ProxyPool pool;
    private final AtomicLong cursor = new AtomicLong(0);

    public RoundRobinSelector(ProxyPool pool) {
        this.pool = pool;
    }

    public Optional<ProxyRecord> next() {
        List<ProxyRecord> candidates = pool.getSelectable();

        if (candidates.isEmpty()) {
            log.warn("No working proxies available");
            return Optional.empty();
        }

        int index = (int) Math.floorMod(cursor.getAndIncrement(), (long) candidates.size());
        ProxyRecord selected = candidates.get(index);
        log.debug("Selected proxy {} ({} of {})", selected.getEndpoint().address(), index + 1, candidates.size());
        return Optional.of(selected);
    }
}
