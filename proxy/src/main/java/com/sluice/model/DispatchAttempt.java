package com.sluice.model;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

@Data
@Builder
public class DispatchAttempt {

    private final String targetUrl;
    private final ProxyEndpoint endpoint;
    private final Duration timeout;
    private final Instant timestamp;
    private final long latencyMs;
    private final int statusCode;
    private final byte[] body;
    private final AttemptFailure failure;
    private final Throwable cause;

    public boolean isDirect() {
        return endpoint == null;
    }

    public boolean isSuccess() {
        return failure == null && statusCode == 200;
    }

    public String describe() {
        String via = isDirect() ? "direct" : endpoint.address();
        if (isSuccess()) {
            return via + " -> " + statusCode;
        }
        if (failure == AttemptFailure.NON_SUCCESS_STATUS) {
            return via + " -> status " + statusCode;
        }
        return via + " -> " + failure + (cause != null ? " (" + cause.getMessage() + ")" : "");
    }
}
