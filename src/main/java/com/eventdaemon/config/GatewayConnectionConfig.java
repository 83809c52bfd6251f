package com.eventdaemon.config;

import com.eventdaemon.core.ConnectionManager;
import com.eventdaemon.core.RetryPolicy;
import com.eventdaemon.gateway.ConnectionConfig;
import com.eventdaemon.gateway.EventDispatcher;
import com.eventdaemon.gateway.GatewayConnection;
import com.eventdaemon.gateway.KiteGatewayConnection;
import com.eventdaemon.gateway.SimulatedGatewayConnection;
import com.eventdaemon.loader.HandlerLoader;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/** Wires the gateway connection, its manager and the handler loader. */
@Configuration
public class GatewayConnectionConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConnectionConfig.class);

    @Bean
    public GatewayConnection gatewayConnection(GatewayConfig gatewayConfig, EventDispatcher eventDispatcher) {
        log.info(
                "Creating {} gateway connection for {}:{}",
                gatewayConfig.getMode(),
                gatewayConfig.getHost(),
                gatewayConfig.getPort());
        return switch (gatewayConfig.getMode()) {
            case LIVE -> new KiteGatewayConnection(
                    eventDispatcher,
                    gatewayConfig.getKite().getApiKey(),
                    gatewayConfig.getKite().getAccessToken());
            case SIMULATED -> new SimulatedGatewayConnection(eventDispatcher);
        };
    }

    @Bean
    public ConnectionConfig connectionConfig(GatewayConfig gatewayConfig) {
        return gatewayConfig.toConnectionConfig();
    }

    @Bean
    public RetryPolicy retryPolicy(DaemonConfig daemonConfig) {
        return daemonConfig.toRetryPolicy();
    }

    /** Schedules the waits between connection attempts. Daemon threads, so a finished loop lets the JVM exit. */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService connectRetryScheduler() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("connect-retry-");
        threadFactory.setDaemon(true);
        return Executors.newSingleThreadScheduledExecutor(threadFactory);
    }

    @Bean
    public ConnectionManager connectionManager(
            GatewayConnection gatewayConnection,
            ConnectionConfig connectionConfig,
            RetryPolicy retryPolicy,
            DaemonConfig daemonConfig,
            ScheduledExecutorService connectRetryScheduler,
            ApplicationEventPublisher applicationEventPublisher) {
        return new ConnectionManager(
                gatewayConnection,
                connectionConfig,
                retryPolicy,
                daemonConfig.getHandler().isAutoReconnect(),
                connectRetryScheduler,
                applicationEventPublisher);
    }

    @Bean
    public HandlerLoader handlerLoader(DaemonConfig daemonConfig) {
        return new HandlerLoader(daemonConfig.getHandlerClasspathEntries());
    }
}
