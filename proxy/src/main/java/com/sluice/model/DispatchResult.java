package com.sluice.model;

import com.sluice.dispatch.DispatchFailedException;
import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

@Value
@Builder
public class DispatchResult {

    boolean success;
    int statusCode;
    byte[] body;
    ProxyEndpoint servedBy;
    boolean direct;
    int attempts;
    boolean proxyUnavailable;
    DispatchErrorKind errorKind;
    String errorMessage;
    Throwable lastCause;

    public static DispatchResult success(DispatchAttempt attempt, int attempts, boolean proxyUnavailable) {
        return DispatchResult.builder()
                .success(true)
                .statusCode(attempt.getStatusCode())
                .body(attempt.getBody())
                .servedBy(attempt.getEndpoint())
                .direct(attempt.isDirect())
                .attempts(attempts)
                .proxyUnavailable(proxyUnavailable)
                .build();
    }

    public static DispatchResult failure(DispatchErrorKind kind, DispatchAttempt lastAttempt,
                                         int attempts, boolean proxyUnavailable, String message) {
        return DispatchResult.builder()
                .success(false)
                .statusCode(lastAttempt != null ? lastAttempt.getStatusCode() : 0)
                .direct(lastAttempt != null && lastAttempt.isDirect())
                .attempts(attempts)
                .proxyUnavailable(proxyUnavailable)
                .errorKind(kind)
                .errorMessage(message)
                .lastCause(lastAttempt != null ? lastAttempt.getCause() : null)
                .build();
    }

    public byte[] getBody() {
        return body == null ? null : body.clone();
    }

    public String bodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    public Optional<ProxyEndpoint> getServedByOptional() {
        return Optional.ofNullable(servedBy);
    }

    public DispatchResult orElseThrow() {
        if (!success) {
            throw new DispatchFailedException(this);
        }
        return this;
    }

    public static class DispatchResultBuilder {

        public DispatchResultBuilder body(byte[] body) {
            this.body = body == null ? null : body.clone();
            return this;
        }
    }
}
