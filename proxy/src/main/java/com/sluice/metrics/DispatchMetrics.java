package com.sluice.metrics;

import com.sluice.model.DispatchAttempt;
import com.sluice.model.DispatchResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.LongAdder;

@Slf4j
@Component
public class DispatchMetrics {

    private final LongAdder dispatchCalls = new LongAdder();
    private final LongAdder issuedAttempts = new LongAdder();
    private final LongAdder successfulAttempts = new LongAdder();
    private final LongAdder failedAttempts = new LongAdder();
    private final LongAdder proxiedAttempts = new LongAdder();
    private final LongAdder directAttempts = new LongAdder();
    private final LongAdder directFallbacks = new LongAdder();
    private final LongAdder terminalFailures = new LongAdder();
    private final LongAdder attemptLatencyMs = new LongAdder();
    @Getter
    private final Instant startTime = Instant.now();

    public void recordCall() {
        dispatchCalls.increment();
    }

    public void recordAttempt(DispatchAttempt attempt) {
        issuedAttempts.increment();
        attemptLatencyMs.add(attempt.getLatencyMs());

        if (attempt.isDirect()) {
            directAttempts.increment();
        } else {
            proxiedAttempts.increment();
        }

        if (attempt.isSuccess()) {
            successfulAttempts.increment();
        } else {
            failedAttempts.increment();
        }
    }

    public void recordDirectFallback() {
        directFallbacks.increment();
    }

    public void recordResult(DispatchResult result) {
        if (!result.isSuccess()) {
            terminalFailures.increment();
        }

        if (log.isDebugEnabled()) {
            log.debug("Dispatch finished: success={}, attempts={}, direct={}, issued={}, failed={}",
                    result.isSuccess(), result.getAttempts(), result.isDirect(),
                    issuedAttempts.sum(), failedAttempts.sum());
        }
    }

    public long getDispatchCalls() {
        return dispatchCalls.sum();
    }

    public long getIssuedAttempts() {
        return issuedAttempts.sum();
    }

    public long getSuccessfulAttempts() {
        return successfulAttempts.sum();
    }

    public long getFailedAttempts() {
        return failedAttempts.sum();
    }

    public long getProxiedAttempts() {
        return proxiedAttempts.sum();
    }

    public long getDirectAttempts() {
        return directAttempts.sum();
    }

    public long getDirectFallbacks() {
        return directFallbacks.sum();
    }

    public long getTerminalFailures() {
        return terminalFailures.sum();
    }

    public double getAverageAttemptLatencyMs() {
        long issued = issuedAttempts.sum();
        return issued == 0 ? 0.0 : (double) attemptLatencyMs.sum() / issued;
    }

    public Duration getUptime() {
        return Duration.between(startTime, Instant.now());
    }
}
