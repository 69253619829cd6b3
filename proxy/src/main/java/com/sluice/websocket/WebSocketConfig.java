package com.sluice.websocket;

import com.sluice.config.SluiceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.List;

@Slf4j
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String POOL_STATS_PATH = "/websocket/pool";

    private final PoolStatsWebSocketHandler poolStatsHandler;
    private final List<String> allowedOrigins;

    public WebSocketConfig(PoolStatsWebSocketHandler poolStatsHandler, SluiceProperties properties) {
        this.poolStatsHandler = poolStatsHandler;
        this.allowedOrigins = properties.getStats().getAllowedOrigins();
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] origins = allowedOrigins.isEmpty() ? new String[] {"*"} : allowedOrigins.toArray(String[]::new);
        registry.addHandler(poolStatsHandler, POOL_STATS_PATH).setAllowedOrigins(origins);
        log.info("Pool stats feed registered at {} for origins {}", POOL_STATS_PATH, String.join(",", origins));
    }
}
