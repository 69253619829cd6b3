package com.sluice.dispatch;

import com.sluice.config.SluiceProperties;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

@Getter
@Component
public class BackoffPolicy {

    private final long baseMs;
    private final long jitterMs;

    @Autowired
    public BackoffPolicy(SluiceProperties properties) {
        this(properties.getDispatch().getBackoffBase(), properties.getDispatch().getBackoffJitter());
    }

    public BackoffPolicy(long baseMs, long jitterMs) {
        this.baseMs = Math.max(0, baseMs);
        this.jitterMs = Math.max(0, jitterMs);
    }

    public static BackoffPolicy none() {
        return new BackoffPolicy(0, 0);
    }

    public Duration nextDelay() {
        long jitter = jitterMs == 0 ? 0 : ThreadLocalRandom.current().nextLong(jitterMs + 1);
        return Duration.ofMillis(baseMs + jitter);
    }
}
