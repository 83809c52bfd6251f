package com.eventdaemon.registry;

import com.eventdaemon.config.DaemonConfig;
import com.eventdaemon.event.HandlerBindingEvent;
import com.eventdaemon.event.HandlerDiscoveryEvent;
import com.eventdaemon.exception.HandlerLoadException;
import com.eventdaemon.exception.RegistrySealedException;
import com.eventdaemon.gateway.GatewayConnection;
import com.eventdaemon.gateway.GatewayEvent;
import com.eventdaemon.loader.HandlerLoader;
import com.eventdaemon.loader.LoadResult;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Maps gateway event names to the handlers registered for them.
 *
 * <p>Handlers arrive through {@link #collect(String)}, either from application code or from
 * files loaded by {@link #discoverHandlers()}. {@link #bindTo(GatewayConnection)} subscribes
 * every registration to the matching event of a live connection and then runs each loaded
 * module's {@link HandlerModule#setup} hook.
 *
 * <p>The registry is populated and bound before the dispatch loop starts and then sealed.
 * It takes no locks: mutation while the loop runs is rejected, not synchronized. Calling
 * {@link #bindTo} twice on the same connection subscribes every handler twice.
 */
@Service
public class EventRegistry implements HandlerRegistrar {

    private static final Logger log = LoggerFactory.getLogger(EventRegistry.class);

    private final HandlerLoader handlerLoader;
    private final DaemonConfig daemonConfig;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final Map<String, List<HandlerRegistration>> handlers = new LinkedHashMap<>();
    private final Map<HandlerModule, String> modules = new IdentityHashMap<>();
    private final List<HandlerModule> moduleOrder = new ArrayList<>();
    private volatile boolean sealed;

    public EventRegistry(
            HandlerLoader handlerLoader,
            DaemonConfig daemonConfig,
            ApplicationEventPublisher applicationEventPublisher) {
        this.handlerLoader = handlerLoader;
        this.daemonConfig = daemonConfig;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public HandlerCollector collect(String eventName) {
        return new HandlerCollector(this, eventName, null);
    }

    void record(HandlerRegistration registration) {
        ensureNotSealed("register handler " + registration.getName());
        handlers.computeIfAbsent(registration.getEventName(), k -> new ArrayList<>())
                .add(registration);
        log.debug(
                "Registered {} handler {} for {} from {}",
                registration.getKind(),
                registration.getName(),
                registration.getEventName(),
                registration.getSourcePath());
    }

    /**
     * Clears the registry, loads every file on the configured search paths and registers the
     * handlers each one contributes. A file that fails to load is logged and skipped.
     *
     * @return one result per visited file; registration failures are reported as failed results
     * @throws RegistrySealedException if the dispatch loop owns the registry
     */
    public List<LoadResult> discoverHandlers() {
        ensureNotSealed("discover handlers");
        clear();

        List<String> searchPaths = daemonConfig.getSearchPaths();
        if (searchPaths.isEmpty()) {
            log.warn("No handler paths configured; set IB_DAEMON_HANDLERS to load handlers");
            applicationEventPublisher.publishEvent(new HandlerDiscoveryEvent(this, 0, 0, 0));
            return List.of();
        }

        List<LoadResult> results = new ArrayList<>();
        int loaded = 0;
        int failed = 0;
        for (LoadResult result : handlerLoader.discover(searchPaths)) {
            if (!result.isSuccess()) {
                log.error("Failed to load handlers from {}: {}", result.getPath(), result.getError().getMessage());
                failed++;
                results.add(result);
                continue;
            }
            try {
                int added = register(result);
                log.info("Successfully loaded handlers from {} ({} registrations)", result.getPath(), added);
                loaded++;
                results.add(result);
            } catch (RuntimeException e) {
                log.error("Failed to load handlers from {}: {}", result.getPath(), e.getMessage());
                failed++;
                results.add(LoadResult.failure(result.getPath(), new HandlerLoadException(
                        result.getPath(), "Handler registration failed: " + e.getMessage(), e)));
            }
        }

        log.info(
                "Handler discovery complete: {} file(s) loaded, {} failed, {} registrations for {} event(s)",
                loaded,
                failed,
                getRegistrationCount(),
                handlers.size());
        applicationEventPublisher.publishEvent(
                new HandlerDiscoveryEvent(this, loaded, failed, getRegistrationCount()));
        return results;
    }

    /**
     * Registers the handlers of every module in a successful load result.
     *
     * @return number of registrations added
     */
    public int register(LoadResult result) {
        int added = 0;
        for (Object module : result.getModules()) {
            added += registerModule(module, result.getPath().toString());
        }
        return added;
    }

    /**
     * Registers the handlers one loaded object contributes, through
     * {@link HandlerModule#registerHandlers} and {@link OnEvent} methods.
     *
     * @return number of registrations added
     */
    public int registerModule(Object module, String sourcePath) {
        ensureNotSealed("register module " + module.getClass().getName());
        int before = getRegistrationCount();
        HandlerRegistrar registrar = eventName -> new HandlerCollector(this, eventName, sourcePath);
        if (module instanceof HandlerModule handlerModule) {
            handlerModule.registerHandlers(registrar);
            if (!modules.containsKey(handlerModule)) {
                modules.put(handlerModule, sourcePath);
                moduleOrder.add(handlerModule);
            }
        }
        AnnotatedHandlers.register(module, registrar);
        return getRegistrationCount() - before;
    }

    /**
     * Subscribes every registration to the matching event on {@code connection}, then runs the
     * setup hook of every loaded module. Missing events, subscription failures and setup
     * failures are logged and skipped.
     */
    public void bindTo(GatewayConnection connection) {
        int bound = 0;
        int failed = 0;
        List<String> missingEvents = new ArrayList<>();

        for (Map.Entry<String, List<HandlerRegistration>> entry : handlers.entrySet()) {
            String eventName = entry.getKey();
            Optional<GatewayEvent> event = connection.event(eventName);
            if (event.isEmpty()) {
                log.warn(
                        "Event {} not found on gateway connection; skipping {} handler(s)",
                        eventName,
                        entry.getValue().size());
                missingEvents.add(eventName);
                continue;
            }
            for (HandlerRegistration registration : entry.getValue()) {
                try {
                    event.get().connect(new BoundHandler(registration, connection));
                    bound++;
                    log.info(
                            "Successfully bound handler {} from {} to {}",
                            registration.getName(),
                            registration.getSourcePath(),
                            eventName);
                } catch (RuntimeException e) {
                    failed++;
                    log.error(
                            "Error binding handler {} from {} to {}: {}",
                            registration.getName(),
                            registration.getSourcePath(),
                            eventName,
                            e.getMessage());
                }
            }
        }

        for (HandlerModule module : moduleOrder) {
            String sourcePath = modules.get(module);
            try {
                module.setup(connection, LoggerFactory.getLogger(module.getClass()));
                log.info("Ran setup of {} from {}", module.getClass().getName(), sourcePath);
            } catch (Exception e) {
                failed++;
                log.error("Setup of {} from {} failed: {}", module.getClass().getName(), sourcePath, e.getMessage());
            }
        }

        log.info("Bound {} handler(s) to gateway connection ({} failed)", bound, failed);
        applicationEventPublisher.publishEvent(new HandlerBindingEvent(this, bound, failed, missingEvents));
    }

    /** Rejects mutation until {@link #clear()}; called before the dispatch loop starts. */
    public void seal() {
        sealed = true;
        log.info("Event registry sealed with {} registration(s)", getRegistrationCount());
    }

    public boolean isSealed() {
        return sealed;
    }

    /** Drops every registration and module and unseals the registry. */
    public void clear() {
        handlers.clear();
        modules.clear();
        moduleOrder.clear();
        sealed = false;
    }

    public List<HandlerRegistration> getHandlers(String eventName) {
        return List.copyOf(handlers.getOrDefault(eventName, List.of()));
    }

    public Set<String> getEventNames() {
        return new LinkedHashSet<>(handlers.keySet());
    }

    /** Event names {@code handler} is registered under, by identity. */
    public List<String> getEventNamesFor(EventHandler handler) {
        List<String> names = new ArrayList<>();
        for (List<HandlerRegistration> registrations : handlers.values()) {
            for (HandlerRegistration registration : registrations) {
                if (registration.getHandler() == handler && !names.contains(registration.getEventName())) {
                    names.add(registration.getEventName());
                }
            }
        }
        return names;
    }

    public int getRegistrationCount() {
        return handlers.values().stream().mapToInt(List::size).sum();
    }

    public int getModuleCount() {
        return moduleOrder.size();
    }

    private void ensureNotSealed(String operation) {
        if (sealed) {
            throw new RegistrySealedException(operation);
        }
    }
}
