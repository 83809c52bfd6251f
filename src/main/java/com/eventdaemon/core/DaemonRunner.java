package com.eventdaemon.core;

import com.eventdaemon.bridge.EventBridge;
import com.eventdaemon.config.ConfigurationExporter;
import com.eventdaemon.config.DaemonConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the daemon once the application context is up. The runner holds the main thread for
 * the lifetime of the dispatch loop; shutdown hooks stop it through
 * {@link com.eventdaemon.recovery.GracefulShutdownService}.
 *
 * <p>Disabled with {@code daemon.auto-start=false}.
 */
@Component
@ConditionalOnProperty(prefix = "daemon", name = "auto-start", havingValue = "true", matchIfMissing = true)
public class DaemonRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DaemonRunner.class);

    private final EventDaemon eventDaemon;
    private final EventBridge eventBridge;
    private final DaemonConfig daemonConfig;
    private final ConfigurationExporter configurationExporter;

    public DaemonRunner(
            EventDaemon eventDaemon,
            EventBridge eventBridge,
            DaemonConfig daemonConfig,
            ConfigurationExporter configurationExporter) {
        this.eventDaemon = eventDaemon;
        this.eventBridge = eventBridge;
        this.daemonConfig = daemonConfig;
        this.configurationExporter = configurationExporter;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.debug("Effective configuration: {}", configurationExporter.exportEnv());
        if (daemonConfig.isBridgeEnabled()) {
            eventBridge.patch();
        }
        eventDaemon.run();
    }
}
