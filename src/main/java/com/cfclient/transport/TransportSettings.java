package com.cfclient.transport;

import java.time.Duration;

/**
 * Connection pool and HTTP settings for {@link WebClientApiTransport#pooled}.
 *
 * @param connectTimeout  null for no connect timeout
 * @param responseTimeout null for no response timeout
 * @param userAgent       null to keep the reactor-netty default
 */
public record TransportSettings(
        int maxConnections,
        Duration maxIdleTime,
        Duration connectTimeout,
        Duration responseTimeout,
        int maxResponseBytes,
        String userAgent) {

    public static TransportSettings defaults() {
        return new TransportSettings(50, Duration.ofSeconds(30), null, null, 16 * 1024 * 1024, null);
    }
}
