package com.eventdaemon.core;

import com.eventdaemon.event.ConnectionAttemptEvent;
import com.eventdaemon.event.ConnectionStateEvent;
import com.eventdaemon.exception.ConnectionFailedException;
import com.eventdaemon.exception.GatewayException;
import com.eventdaemon.gateway.ConnectionConfig;
import com.eventdaemon.gateway.EventPayload;
import com.eventdaemon.gateway.GatewayConnection;
import com.eventdaemon.gateway.GatewayEventNames;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Owns the gateway connection and its {@link ConnectionState}.
 *
 * <p>{@link #connect()} makes up to {@code maxRetries + 1} attempts through a Resilience4j
 * {@link Retry}. Waits between attempts are scheduled on {@code retryScheduler}, so no thread
 * sleeps; there is no wait after the last attempt. {@link #start()} then hands the calling
 * thread to the connection's dispatch loop.
 *
 * <p>Every state transition is published as a {@link ConnectionStateEvent}.
 */
public class ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    // Resilience4j only schedules a further attempt for a positive wait
    private static final Duration MIN_WAIT = Duration.ofMillis(1);

    private final GatewayConnection connection;
    private final ConnectionConfig connectionConfig;
    private final RetryPolicy retryPolicy;
    private final boolean autoReconnect;
    private final ScheduledExecutorService retryScheduler;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Retry retry;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicInteger attempts = new AtomicInteger();
    private volatile boolean stopping;

    public ConnectionManager(
            GatewayConnection connection,
            ConnectionConfig connectionConfig,
            RetryPolicy retryPolicy,
            boolean autoReconnect,
            ScheduledExecutorService retryScheduler,
            ApplicationEventPublisher applicationEventPublisher) {
        this.connection = connection;
        this.connectionConfig = connectionConfig;
        this.retryPolicy = retryPolicy;
        this.autoReconnect = autoReconnect;
        this.retryScheduler = retryScheduler;
        this.applicationEventPublisher = applicationEventPublisher;

        Duration wait = retryPolicy.getRetryDelay().compareTo(MIN_WAIT) < 0 ? MIN_WAIT : retryPolicy.getRetryDelay();
        this.retry = Retry.of(
                "gateway-connect",
                RetryConfig.custom()
                        .maxAttempts(retryPolicy.getMaxAttempts())
                        .waitDuration(wait)
                        .retryExceptions(Exception.class)
                        .build());

        connection.event(GatewayEventNames.DISCONNECTED).ifPresent(event -> event.connect(this::onDisconnected));
    }

    /**
     * Connects to the gateway under the retry policy.
     *
     * @return a future that completes when an attempt succeeds, or fails with
     *     {@link ConnectionFailedException} once every attempt has failed
     */
    public CompletableFuture<Void> connect() {
        transition(
                ConnectionState.CONNECTING,
                "Connecting to " + connectionConfig.getHost() + ":" + connectionConfig.getPort());
        attempts.set(0);

        CompletableFuture<Void> promise = new CompletableFuture<>();
        retry.executeCompletionStage(retryScheduler, this::attempt).whenComplete((ignored, error) -> {
            if (error == null) {
                transition(ConnectionState.CONNECTED, "Connected after " + attempts.get() + " attempt(s)");
                promise.complete(null);
                return;
            }
            Throwable cause = unwrap(error);
            ConnectionFailedException failure = new ConnectionFailedException(retryPolicy.getMaxAttempts(), cause);
            log.error("{}: {}", failure.getMessage(), cause.getMessage());
            transition(ConnectionState.DISCONNECTED, failure.getMessage());
            promise.completeExceptionally(failure);
        });
        return promise;
    }

    private CompletionStage<Void> attempt() {
        int attempt = attempts.incrementAndGet();
        int maxAttempts = retryPolicy.getMaxAttempts();
        log.info(
                "Connecting to gateway {}:{} (attempt {}/{})",
                connectionConfig.getHost(),
                connectionConfig.getPort(),
                attempt,
                maxAttempts);

        CompletableFuture<Void> pending;
        try {
            pending = connection.connect(connectionConfig);
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }
        return pending.thenRun(() -> {
                    if (!connection.isConnected()) {
                        throw new GatewayException("Failed to establish connection");
                    }
                })
                .whenComplete((ignored, error) -> {
                    if (error == null) {
                        log.info("Successfully connected to gateway");
                        applicationEventPublisher.publishEvent(
                                new ConnectionAttemptEvent(this, attempt, maxAttempts, true, null));
                    } else {
                        String message = unwrap(error).getMessage();
                        log.error("Failed to connect to gateway (attempt {}/{}): {}", attempt, maxAttempts, message);
                        applicationEventPublisher.publishEvent(
                                new ConnectionAttemptEvent(this, attempt, maxAttempts, false, message));
                    }
                });
    }

    /**
     * Ensures a connection, then runs the dispatch loop on the calling thread until it ends.
     * With auto-reconnect enabled, a loop that ends without {@link #stop()} is restarted after
     * reconnecting.
     *
     * @throws ConnectionFailedException if a connection cannot be established
     */
    public void start() {
        stopping = false;
        while (true) {
            if (!connection.isConnected()) {
                try {
                    connect().join();
                } catch (CompletionException e) {
                    throw rethrow(e);
                }
            }
            log.info("Starting gateway event loop");
            connection.run();

            if (stopping || !autoReconnect || Thread.currentThread().isInterrupted()) {
                break;
            }
            log.warn("Gateway event loop ended unexpectedly; reconnecting");
        }
        log.info("Gateway event loop finished");
    }

    /** Requests the dispatch loop to end and disconnects. */
    public void stop() {
        log.info("Stopping gateway daemon");
        stopping = true;
        disconnect();
    }

    /**
     * Disconnects if connected, waiting at most the connection timeout. Never throws; teardown
     * errors are logged. The state is DISCONNECTED afterwards.
     */
    public void disconnect() {
        try {
            if (connection.isConnected()) {
                log.info("Disconnecting from gateway");
                connection.disconnect()
                        .get(connectionConfig.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted during disconnect");
        } catch (ExecutionException e) {
            log.error("Error during disconnect: {}", unwrap(e).getMessage());
        } catch (TimeoutException e) {
            log.error("Error during disconnect: no confirmation within {}", connectionConfig.getTimeout());
        } catch (RuntimeException e) {
            log.error("Error during disconnect: {}", e.getMessage());
        } finally {
            transition(ConnectionState.DISCONNECTED, "Disconnected");
        }
    }

    private void onDisconnected(EventPayload payload) {
        if (!stopping && state.get() == ConnectionState.CONNECTED) {
            log.warn("Gateway connection lost");
            transition(ConnectionState.DISCONNECTED, "Connection lost");
        }
    }

    private void transition(ConnectionState newState, String message) {
        ConnectionState previous = state.getAndSet(newState);
        if (previous != newState) {
            log.debug("Connection state {} -> {}: {}", previous, newState, message);
            applicationEventPublisher.publishEvent(new ConnectionStateEvent(this, previous, newState, message));
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static RuntimeException rethrow(CompletionException e) {
        Throwable cause = unwrap(e);
        return cause instanceof RuntimeException runtime ? runtime : e;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isConnected() {
        return connection.isConnected();
    }

    public boolean isStopping() {
        return stopping;
    }

    public boolean isAutoReconnect() {
        return autoReconnect;
    }

    /** Attempts made by the most recent {@link #connect()}. */
    public int getAttemptCount() {
        return attempts.get();
    }

    public GatewayConnection getConnection() {
        return connection;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }
}
