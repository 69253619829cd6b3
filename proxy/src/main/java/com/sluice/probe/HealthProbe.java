package com.sluice.probe;

import com.sluice.model.ProxyEndpoint;

import java.time.Duration;

public interface HealthProbe {

    boolean probe(ProxyEndpoint endpoint, Duration timeout);
}
