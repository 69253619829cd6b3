package com.sluice.http;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BrowserHeadersTest {

    private final BrowserHeaders headers = new BrowserHeaders();

    @Test
    void producesBrowserLikeHeaders() {
        Map<String, String> next = headers.next();

        assertTrue(BrowserHeaders.USER_AGENTS.contains(next.get("User-Agent")));
        assertTrue(BrowserHeaders.ACCEPTS.contains(next.get("Accept")));
        assertTrue(BrowserHeaders.ACCEPT_LANGUAGES.contains(next.get("Accept-Language")));
        assertEquals("1", next.get("Upgrade-Insecure-Requests"));
    }

    @Test
    void leavesRestrictedAndEncodingHeadersToClient() {
        for (int i = 0; i < 50; i++) {
            Map<String, String> next = headers.next();
            assertFalse(next.containsKey("Connection"));
            assertFalse(next.containsKey("Host"));
            assertFalse(next.containsKey("Accept-Encoding"));
        }
    }

    @Test
    void rotatesUserAgents() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 300; i++) {
            seen.add(headers.next().get("User-Agent"));
        }

        assertTrue(seen.size() > 1);
    }
}
