package com.eventdaemon.gateway;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one connection attempt. Immutable; built once from
 * {@link com.eventdaemon.config.GatewayConfig} and reused for every retry.
 */
@Value
@Builder
public class ConnectionConfig {

    @Builder.Default
    String host = "127.0.0.1";

    @Builder.Default
    int port = 7497;

    @Builder.Default
    int clientId = 1;

    @Builder.Default
    Duration timeout = Duration.ofSeconds(4);

    boolean readonly;

    @Builder.Default
    String account = "";
}
