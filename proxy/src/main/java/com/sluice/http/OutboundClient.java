package com.sluice.http;

import com.sluice.model.DispatchAttempt;
import com.sluice.model.ProxyEndpoint;

import java.time.Duration;
import java.util.Map;

public interface OutboundClient {

    DispatchAttempt get(String url, ProxyEndpoint via, Duration timeout, Map<String, String> headers);
}
