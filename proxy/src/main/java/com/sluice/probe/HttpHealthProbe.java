package com.sluice.probe;

import com.sluice.config.SluiceProperties;
import com.sluice.http.BrowserHeaders;
import com.sluice.http.OutboundClient;
import com.sluice.model.DispatchAttempt;
import com.sluice.model.ProxyEndpoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;

@Slf4j
@Component
public class HttpHealthProbe implements HealthProbe {

    private final OutboundClient outboundClient;
    private final BrowserHeaders browserHeaders;
    private final String targetUrl;

    public HttpHealthProbe(OutboundClient outboundClient, BrowserHeaders browserHeaders,
                           SluiceProperties properties) {
        this.outboundClient = outboundClient;
        this.browserHeaders = browserHeaders;
        this.targetUrl = properties.getProbe().getTargetUrl();
        if (targetUrl == null || URI.create(targetUrl).getHost() == null) {
            throw new IllegalArgumentException("sluice.probe.targetUrl is not an absolute URL: " + targetUrl);
        }
    }

    @Override
    public boolean probe(ProxyEndpoint endpoint, Duration timeout) {
        DispatchAttempt attempt = outboundClient.get(targetUrl, endpoint, timeout, browserHeaders.next());
        log.debug("Probe {}: {}", endpoint.address(), attempt.describe());
        return attempt.isSuccess();
    }
}
