import com.eventdaemon.gateway.EventPayload;
import com.eventdaemon.gateway.GatewayConnection;
import com.eventdaemon.gateway.GatewayEventNames;
import com.eventdaemon.gateway.KiteGatewayConnection;
import com.eventdaemon.registry.HandlerModule;
import com.eventdaemon.registry.HandlerRegistrar;
import com.eventdaemon.registry.OnEvent;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Example handler module. Point {@code IB_DAEMON_HANDLERS} at this directory to load it.
 *
 * <p>Shows the three ways a loaded class contributes behavior: handlers registered through
 * {@link #registerHandlers}, {@link OnEvent} methods, and the {@link #setup} hook that runs
 * once the handlers are bound to the live connection.
 */
public class RealTimeBarHandlers implements HandlerModule {

    private static final Logger log = LoggerFactory.getLogger(RealTimeBarHandlers.class);

    // NIFTY 50 and NIFTY BANK index tokens
    private static final List<Long> INSTRUMENT_TOKENS = List.of(256265L, 260105L);

    @Override
    public void registerHandlers(HandlerRegistrar registrar) {
        registrar.collect(GatewayEventNames.BAR_UPDATE).sync(this::onBarUpdate);
        registrar.collect(GatewayEventNames.PENDING_TICKERS).sync(this::onTicks);
        registrar.collect(GatewayEventNames.ERROR).async(this::onError);
    }

    @Override
    public void setup(GatewayConnection connection, Logger logger) {
        logger.info("Registered setup of {}", getClass().getSimpleName());
        if (connection instanceof KiteGatewayConnection kite) {
            kite.subscribe(INSTRUMENT_TOKENS);
        }
    }

    @OnEvent(GatewayEventNames.CONNECTED)
    public void onConnected(GatewayConnection connection, EventPayload payload) {
        log.info("Gateway session up; listening on {}", connection.getEventNames());
    }

    private void onBarUpdate(GatewayConnection connection, EventPayload payload) {
        log.info("Bar update: {}", payload.getArgs());
    }

    private void onTicks(GatewayConnection connection, EventPayload payload) {
        List<?> ticks = payload.arg(0, List.class);
        log.info("Received {} ticks", ticks.size());
    }

    private CompletionStage<Void> onError(GatewayConnection connection, EventPayload payload) {
        return CompletableFuture.runAsync(() -> log.warn("Gateway reported: {}", payload.getArgs()));
    }
}
