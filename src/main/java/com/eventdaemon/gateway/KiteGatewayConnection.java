package com.eventdaemon.gateway;

import com.eventdaemon.exception.GatewayException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.Order;
import com.zerodhatech.models.Tick;
import com.zerodhatech.ticker.KiteTicker;
import com.zerodhatech.ticker.OnConnect;
import com.zerodhatech.ticker.OnDisconnect;
import com.zerodhatech.ticker.OnError;
import com.zerodhatech.ticker.OnOrderUpdate;
import com.zerodhatech.ticker.OnTicks;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live gateway backed by the Kite Connect WebSocket ticker.
 *
 * <p>Ticker callbacks arrive on the SDK's socket thread and are posted to the dispatch loop
 * as named events:
 * <ul>
 *   <li>connect / disconnect -> {@code connectedEvent} / {@code disconnectedEvent}</li>
 *   <li>tick batches -> {@code pendingTickersEvent} with the {@code ArrayList<Tick>}</li>
 *   <li>order updates -> {@code orderStatusEvent} with the SDK {@link Order}</li>
 *   <li>errors -> {@code errorEvent} with the exception or message</li>
 * </ul>
 *
 * <p>The SDK's own reconnection is switched off; reconnecting is the connection manager's
 * job so that every attempt goes through the same retry policy. Host and port are not used:
 * the ticker endpoint is fixed by the SDK.
 *
 * <p>Each attempt creates its own ticker. A ticker whose attempt fails or times out is closed,
 * and callbacks from any ticker other than the current one are ignored.
 */
public class KiteGatewayConnection extends AbstractGatewayConnection {

    private static final Logger log = LoggerFactory.getLogger(KiteGatewayConnection.class);

    static final List<String> EVENT_NAMES = List.of(
            GatewayEventNames.CONNECTED,
            GatewayEventNames.DISCONNECTED,
            GatewayEventNames.PENDING_TICKERS,
            GatewayEventNames.ORDER_STATUS,
            GatewayEventNames.ERROR);

    private final String apiKey;
    private final String accessToken;

    private volatile KiteTicker kiteTicker;
    private volatile CompletableFuture<Void> pendingConnect;

    public KiteGatewayConnection(EventDispatcher dispatcher, String apiKey, String accessToken) {
        super(dispatcher, EVENT_NAMES);
        this.apiKey = apiKey;
        this.accessToken = accessToken;
    }

    @Override
    public CompletableFuture<Void> connect(ConnectionConfig config) {
        if (isConnected()) {
            log.warn("Ticker already connected, ignoring connect request");
            return CompletableFuture.completedFuture(null);
        }
        if (apiKey == null || apiKey.isBlank() || accessToken == null || accessToken.isBlank()) {
            return CompletableFuture.failedFuture(
                    new GatewayException("Kite API key and access token are required for LIVE mode"));
        }

        KiteTicker previous = kiteTicker;
        if (previous != null) {
            kiteTicker = null;
            closeQuietly(previous);
        }

        log.info("Connecting to Kite WebSocket (clientId={}, readonly={})", config.getClientId(), config.isReadonly());
        CompletableFuture<Void> promise = new CompletableFuture<>();
        KiteTicker ticker;
        try {
            ticker = createTicker();
        } catch (Exception e) {
            return CompletableFuture.failedFuture(new GatewayException("Kite ticker creation failed", e));
        }
        pendingConnect = promise;
        kiteTicker = ticker;

        try {
            setupCallbacks(ticker);
            ticker.setTryReconnection(false);
            ticker.connect();
        } catch (Exception e) {
            promise.completeExceptionally(new GatewayException("Kite ticker connection failed", e));
        }

        return promise.orTimeout(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        abandon(ticker);
                    }
                });
    }

    @Override
    public CompletableFuture<Void> disconnect() {
        KiteTicker ticker = kiteTicker;
        // Callbacks from a ticker that is no longer current are ignored, including its own onDisconnected
        kiteTicker = null;
        if (ticker == null) {
            markDisconnected();
            return CompletableFuture.completedFuture(null);
        }
        try {
            ticker.disconnect();
            log.info("Kite ticker disconnected");
            return CompletableFuture.completedFuture(null);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(new GatewayException("Error disconnecting ticker", e));
        } finally {
            markDisconnected();
        }
    }

    /**
     * Subscribes instrument tokens in FULL mode. Intended for handler modules' setup entry
     * point once the session is up.
     */
    public void subscribe(List<Long> instrumentTokens) {
        KiteTicker ticker = kiteTicker;
        if (ticker == null || !isConnected()) {
            throw new GatewayException("Cannot subscribe before the ticker is connected");
        }
        ArrayList<Long> tokens = new ArrayList<>(instrumentTokens);
        ticker.subscribe(tokens);
        ticker.setMode(tokens, KiteTicker.modeFull);
        log.info("Subscribed {} instruments", tokens.size());
    }

    /** Creates a new KiteTicker instance (extracted for testability). */
    protected KiteTicker createTicker() {
        // KiteTicker constructor order: (accessToken, apiKey)
        return new KiteTicker(accessToken, apiKey);
    }

    private void setupCallbacks(KiteTicker ticker) {
        ticker.setOnConnectedListener(new OnConnect() {
            @Override
            public void onConnected() {
                onTickerConnected(ticker);
            }
        });

        ticker.setOnDisconnectedListener(new OnDisconnect() {
            @Override
            public void onDisconnected() {
                onTickerDisconnected(ticker);
            }
        });

        ticker.setOnTickerArrivalListener(new OnTicks() {
            @Override
            public void onTicks(ArrayList<Tick> ticks) {
                if (isCurrent(ticker)) {
                    post(GatewayEventNames.PENDING_TICKERS, EventPayload.of(ticks));
                }
            }
        });

        ticker.setOnOrderUpdateListener(new OnOrderUpdate() {
            @Override
            public void onOrderUpdate(Order order) {
                if (isCurrent(ticker)) {
                    post(GatewayEventNames.ORDER_STATUS, EventPayload.of(order));
                }
            }
        });

        ticker.setOnErrorListener(new OnError() {
            @Override
            public void onError(Exception exception) {
                if (isCurrent(ticker)) {
                    log.error("Kite ticker error: {}", exception.getMessage());
                    failPendingConnect(exception);
                    post(GatewayEventNames.ERROR, EventPayload.of(exception));
                }
            }

            @Override
            public void onError(KiteException kiteException) {
                // KiteException extends Throwable (not Exception)
                if (isCurrent(ticker)) {
                    log.error("Kite ticker KiteException: {}", kiteException.message);
                    failPendingConnect(new GatewayException(kiteException.message));
                    post(GatewayEventNames.ERROR, EventPayload.of(kiteException.message));
                }
            }

            @Override
            public void onError(String error) {
                if (isCurrent(ticker)) {
                    log.error("Kite ticker error: {}", error);
                    post(GatewayEventNames.ERROR, EventPayload.of(error));
                }
            }
        });
    }

    private boolean isCurrent(KiteTicker ticker) {
        if (ticker != kiteTicker) {
            log.debug("Ignoring callback from a replaced Kite ticker");
            return false;
        }
        return true;
    }

    private void onTickerConnected(KiteTicker ticker) {
        if (!isCurrent(ticker)) {
            return;
        }
        CompletableFuture<Void> promise = pendingConnect;
        if (promise != null && promise.isCompletedExceptionally()) {
            log.warn("Kite ticker connected after its attempt was abandoned");
            return;
        }
        log.info("Kite ticker connected");
        markConnected();
        if (promise != null) {
            promise.complete(null);
        }
    }

    private void onTickerDisconnected(KiteTicker ticker) {
        if (!isCurrent(ticker)) {
            return;
        }
        log.warn("Kite ticker disconnected");
        failPendingConnect(new GatewayException("Ticker disconnected before the session was established"));
        markDisconnected();
    }

    private void failPendingConnect(Throwable error) {
        CompletableFuture<Void> promise = pendingConnect;
        if (promise != null && !promise.isDone()) {
            promise.completeExceptionally(error);
        }
    }

    /** Drops a ticker whose attempt failed or timed out so it cannot reach a later session. */
    private void abandon(KiteTicker ticker) {
        if (ticker == kiteTicker) {
            kiteTicker = null;
        }
        closeQuietly(ticker);
    }

    private void closeQuietly(KiteTicker ticker) {
        try {
            ticker.disconnect();
        } catch (Exception e) {
            log.warn("Failed to close abandoned Kite ticker: {}", e.getMessage());
        }
    }
}
