package com.sluice.http;

import com.sluice.config.SluiceProperties;
import com.sluice.model.AttemptFailure;
import com.sluice.model.DispatchAttempt;
import com.sluice.model.ProxyEndpoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
public class HttpOutboundClient implements OutboundClient {

    private final Duration connectTimeout;
    private final HttpClient directClient;
    private final Map<ProxyEndpoint, HttpClient> proxiedClients;

    public HttpOutboundClient(SluiceProperties properties) {
        this.connectTimeout = Duration.ofMillis(properties.getDispatch().getConnectTimeout());
        this.directClient = newClient(null);

        // each HttpClient owns a selector thread; evicted clients stop once unreachable
        int maxClients = Math.max(1, properties.getDispatch().getMaxCachedClients());
        this.proxiedClients = Collections.synchronizedMap(new LinkedHashMap<ProxyEndpoint, HttpClient>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<ProxyEndpoint, HttpClient> eldest) {
                return size() > maxClients;
            }
        });

        log.info("HttpOutboundClient initialized with {}ms connect timeout, {} cached proxy clients max",
                connectTimeout.toMillis(), maxClients);
    }

    @Override
    public DispatchAttempt get(String url, ProxyEndpoint via, Duration timeout, Map<String, String> headers) {
        Instant start = Instant.now();
        DispatchAttempt.DispatchAttemptBuilder attempt = DispatchAttempt.builder()
                .targetUrl(url)
                .endpoint(via)
                .timeout(timeout)
                .timestamp(start);

        HttpRequest request;
        try {
            HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .GET();
            headers.forEach(requestBuilder::header);
            request = requestBuilder.build();
        } catch (IllegalArgumentException e) {
            log.debug("Rejected request to {}: {}", url, e.getMessage());
            return attempt.failure(AttemptFailure.INVALID_REQUEST).cause(e).build();
        }

        try {
            HttpResponse<byte[]> response = clientFor(via).send(request, HttpResponse.BodyHandlers.ofByteArray());

            int status = response.statusCode();
            return attempt
                    .latencyMs(elapsedMs(start))
                    .statusCode(status)
                    .body(response.body())
                    .failure(status == 200 ? null : AttemptFailure.NON_SUCCESS_STATUS)
                    .build();

        } catch (HttpTimeoutException e) {
            long latencyMs = elapsedMs(start);
            log.debug("Request to {} via {} timed out after {}ms", url, describe(via), latencyMs);
            return attempt.latencyMs(latencyMs).failure(AttemptFailure.TIMEOUT).cause(e).build();

        } catch (IOException e) {
            long latencyMs = elapsedMs(start);
            log.debug("Request to {} via {} failed: {}", url, describe(via), e.getMessage());
            return attempt.latencyMs(latencyMs).failure(AttemptFailure.CONNECTION_ERROR).cause(e).build();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return attempt.latencyMs(elapsedMs(start)).failure(AttemptFailure.CONNECTION_ERROR).cause(e).build();
        }
    }

    int cachedClientCount() {
        return proxiedClients.size();
    }

    private HttpClient clientFor(ProxyEndpoint via) {
        if (via == null) {
            return directClient;
        }
        return proxiedClients.computeIfAbsent(via, this::newClient);
    }

    private HttpClient newClient(ProxyEndpoint via) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1);
        if (via != null) {
            builder.proxy(ProxySelector.of(new InetSocketAddress(via.host(), via.port())));
        }
        return builder.build();
    }

    private static long elapsedMs(Instant start) {
        return Duration.between(start, Instant.now()).toMillis();
    }

    private static String describe(ProxyEndpoint via) {
        return via == null ? "direct" : via.address();
    }
}
