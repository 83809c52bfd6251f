package com.eventdaemon.config;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Renders the effective configuration as {@code IB_*} environment variables, e.g. for
 * launching a child process with the same settings.
 */
@Component
public class ConfigurationExporter {

    private final GatewayConfig gatewayConfig;
    private final DaemonConfig daemonConfig;
    private final Environment environment;

    public ConfigurationExporter(GatewayConfig gatewayConfig, DaemonConfig daemonConfig, Environment environment) {
        this.gatewayConfig = gatewayConfig;
        this.daemonConfig = daemonConfig;
        this.environment = environment;
    }

    public Map<String, String> exportEnv() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("IB_HOST", gatewayConfig.getHost());
        env.put("IB_PORT", String.valueOf(gatewayConfig.getPort()));
        env.put("IB_CLIENT_ID", String.valueOf(gatewayConfig.getClientId()));
        env.put("IB_TIMEOUT", String.valueOf(gatewayConfig.getTimeout()));
        env.put("IB_READONLY", String.valueOf(gatewayConfig.isReadonly()));
        env.put("IB_ACCOUNT", gatewayConfig.getAccount() != null ? gatewayConfig.getAccount() : "");
        env.put("IB_GATEWAY_MODE", gatewayConfig.getMode().name());

        env.put("IB_LOG_LEVEL", environment.getProperty("logging.level.com.eventdaemon", "INFO").toUpperCase());
        String logFormat = environment.getProperty("logging.pattern.console");
        if (logFormat != null && !logFormat.isBlank()) {
            env.put("IB_LOG_FORMAT", logFormat);
        }
        String logFile = environment.getProperty("logging.file.name");
        if (logFile != null && !logFile.isBlank()) {
            env.put("IB_LOG_FILE", logFile);
        }

        env.put("IB_HANDLER_AUTO_RECONNECT", String.valueOf(daemonConfig.getHandler().isAutoReconnect()));
        env.put("IB_HANDLER_MAX_RETRIES", String.valueOf(daemonConfig.getHandler().getMaxRetries()));
        env.put("IB_HANDLER_RETRY_DELAY", String.valueOf(daemonConfig.getHandler().getRetryDelay()));

        env.put("IB_DAEMON_HANDLERS", daemonConfig.getHandlers() != null ? daemonConfig.getHandlers() : "");
        env.put("IB_DAEMON_BRIDGE", String.valueOf(daemonConfig.isBridgeEnabled()));
        return env;
    }
}
