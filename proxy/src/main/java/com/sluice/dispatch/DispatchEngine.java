package com.sluice.dispatch;

import com.sluice.config.SluiceProperties;
import com.sluice.http.BrowserHeaders;
import com.sluice.http.OutboundClient;
import com.sluice.metrics.DispatchMetrics;
import com.sluice.model.AttemptFailure;
import com.sluice.model.DispatchAttempt;
import com.sluice.model.DispatchErrorKind;
import com.sluice.model.DispatchResult;
import com.sluice.model.ProxyEndpoint;
import com.sluice.pool.ProxyRecord;
import com.sluice.pool.ProxyRecordStore;
import com.sluice.pool.RoundRobinSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Slf4j
@Component
public class DispatchEngine {

    private final RoundRobinSelector selector;
    private final ProxyRecordStore store;
    private final OutboundClient outboundClient;
    private final BrowserHeaders browserHeaders;
    private final BackoffPolicy backoffPolicy;
    private final DispatchMetrics metrics;
    private final SluiceProperties.DispatchProperties properties;

    public DispatchEngine(RoundRobinSelector selector,
                          ProxyRecordStore store,
                          OutboundClient outboundClient,
                          BrowserHeaders browserHeaders,
                          BackoffPolicy backoffPolicy,
                          DispatchMetrics metrics,
                          SluiceProperties properties) {
        this.selector = selector;
        this.store = store;
        this.outboundClient = outboundClient;
        this.browserHeaders = browserHeaders;
        this.backoffPolicy = backoffPolicy;
        this.metrics = metrics;
        this.properties = properties.getDispatch();
    }

    public DispatchResult fetch(String url) {
        return fetch(url, properties.getMaxAttempts());
    }

    public DispatchResult fetch(String url, int maxAttempts) {
        return fetch(url, maxAttempts, Duration.ofMillis(properties.getCallTimeout()));
    }

    public DispatchResult fetch(String url, int maxAttempts, Duration budget) {
        metrics.recordCall();

        int proxiedAttempts = properties.isUseProxies() ? Math.max(0, maxAttempts) : 0;
        DispatchCall call = new DispatchCall(url, proxiedAttempts, Instant.now().plus(budget));
        DispatchResult result = call.run();

        metrics.recordResult(result);
        if (result.isSuccess()) {
            log.info("Fetched {} via {} after {} attempts", url,
                    result.getServedByOptional().map(ProxyEndpoint::address).orElse("direct"),
                    result.getAttempts());
        } else {
            log.warn("Dispatch of {} failed ({}) after {} attempts: {}",
                    url, result.getErrorKind(), result.getAttempts(), result.getErrorMessage());
        }
        return result;
    }

    private enum Phase {
        PROXIED,
        DIRECT
    }

    private final class DispatchCall {

        private final String url;
        private final int maxProxiedAttempts;
        private final Instant deadline;

        private Phase phase;
        private int attempts;
        private int proxiedAttempts;
        private boolean proxyUnavailable;
        private DispatchAttempt lastAttempt;

        private DispatchCall(String url, int maxProxiedAttempts, Instant deadline) {
            this.url = url;
            this.maxProxiedAttempts = maxProxiedAttempts;
            this.deadline = deadline;
            this.phase = maxProxiedAttempts > 0 ? Phase.PROXIED : Phase.DIRECT;
        }

        DispatchResult run() {
            while (phase == Phase.PROXIED) {
                Optional<ProxyRecord> selected = selector.next();
                if (selected.isEmpty()) {
                    proxyUnavailable = true;
                    phase = Phase.DIRECT;
                    break;
                }

                Optional<DispatchResult> terminal = attemptThrough(selected.get().getEndpoint());
                if (terminal.isPresent()) {
                    return terminal.get();
                }

                if (proxiedAttempts >= maxProxiedAttempts) {
                    phase = Phase.DIRECT;
                }
                if (!backoff()) {
                    return cancelled();
                }
            }
            return attemptDirect();
        }

        private Optional<DispatchResult> attemptThrough(ProxyEndpoint endpoint) {
            Duration timeout = nextTimeout();
            if (timeout == null) {
                return Optional.of(deadlineExceeded());
            }

            DispatchAttempt attempt = execute(endpoint, timeout);
            proxiedAttempts++;

            if (Thread.currentThread().isInterrupted()) {
                return Optional.of(cancelled());
            }
            if (attempt.getFailure() == AttemptFailure.INVALID_REQUEST) {
                return Optional.of(invalidRequest(attempt));
            }
            if (countsAgainstProxy(attempt, timeout)) {
                store.recordOutcome(endpoint, attempt.isSuccess());
            } else {
                log.debug("Not reporting {}: attempt timeout was cut to {}ms by the call budget",
                        endpoint.address(), timeout.toMillis());
            }
            if (attempt.isSuccess()) {
                return Optional.of(DispatchResult.success(attempt, attempts, proxyUnavailable));
            }

            log.warn("Attempt {}/{} for {} failed: {}", proxiedAttempts, maxProxiedAttempts, url, attempt.describe());
            return Optional.empty();
        }

        // timeouts only count when the proxy had the full attempt timeout
        private boolean countsAgainstProxy(DispatchAttempt attempt, Duration timeout) {
            return attempt.getFailure() != AttemptFailure.TIMEOUT
                    || timeout.toMillis() >= properties.getAttemptTimeout();
        }

        private DispatchResult attemptDirect() {
            metrics.recordDirectFallback();
            if (proxyUnavailable) {
                log.warn("No proxies available for {}, attempting direct connection", url);
            } else {
                log.info("Attempting direct connection (no proxy) for {}", url);
            }

            Duration timeout = nextTimeout();
            if (timeout == null) {
                return deadlineExceeded();
            }

            DispatchAttempt attempt = execute(null, timeout);
            if (Thread.currentThread().isInterrupted()) {
                return cancelled();
            }
            if (attempt.getFailure() == AttemptFailure.INVALID_REQUEST) {
                return invalidRequest(attempt);
            }
            if (attempt.isSuccess()) {
                return DispatchResult.success(attempt, attempts, proxyUnavailable);
            }
            return DispatchResult.failure(DispatchErrorKind.ALL_ATTEMPTS_EXHAUSTED, attempt, attempts,
                    proxyUnavailable, "All attempts failed, last: " + attempt.describe());
        }

        private DispatchAttempt execute(ProxyEndpoint endpoint, Duration timeout) {
            DispatchAttempt attempt = outboundClient.get(url, endpoint, timeout, browserHeaders.next());
            attempts++;
            lastAttempt = attempt;
            metrics.recordAttempt(attempt);
            return attempt;
        }

        // null once the budget is spent
        private Duration nextTimeout() {
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                return null;
            }
            Duration attemptTimeout = Duration.ofMillis(properties.getAttemptTimeout());
            return remaining.compareTo(attemptTimeout) < 0 ? remaining : attemptTimeout;
        }

        private boolean backoff() {
            Duration delay = backoffPolicy.nextDelay();
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (delay.compareTo(remaining) > 0) {
                delay = remaining.isNegative() ? Duration.ZERO : remaining;
            }
            if (delay.isZero()) {
                return true;
            }
            try {
                Thread.sleep(delay.toMillis());
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }

        private DispatchResult deadlineExceeded() {
            return DispatchResult.failure(DispatchErrorKind.DEADLINE_EXCEEDED, lastAttempt, attempts,
                    proxyUnavailable, "Call budget exhausted after " + attempts + " attempts");
        }

        private DispatchResult invalidRequest(DispatchAttempt attempt) {
            Throwable cause = attempt.getCause();
            return DispatchResult.failure(DispatchErrorKind.INVALID_REQUEST, attempt, attempts, proxyUnavailable,
                    "Invalid request for " + url + (cause != null ? ": " + cause.getMessage() : ""));
        }

        private DispatchResult cancelled() {
            return DispatchResult.failure(DispatchErrorKind.CANCELLED, lastAttempt, attempts,
                    proxyUnavailable, "Dispatch cancelled after " + attempts + " attempts");
        }
    }
}
