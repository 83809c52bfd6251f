package com.eventdaemon.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.eventdaemon.bridge.EventBridge;
import com.eventdaemon.core.ConnectionManager;
import com.eventdaemon.core.ConnectionState;
import com.eventdaemon.event.ConnectionAttemptEvent;
import com.eventdaemon.event.ConnectionStateEvent;
import com.eventdaemon.event.HandlerBindingEvent;
import com.eventdaemon.event.HandlerDiscoveryEvent;
import com.eventdaemon.observability.DaemonMetrics;
import com.eventdaemon.registry.EventRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link DaemonMetrics}: counters driven by application events, gauges read
 * from the mocked components on scrape.
 */
@ExtendWith(MockitoExtension.class)
class DaemonMetricsTest {

    @Mock
    private EventRegistry eventRegistry;

    @Mock
    private ConnectionManager connectionManager;

    @Mock
    private EventBridge eventBridge;

    private SimpleMeterRegistry meterRegistry;
    private DaemonMetrics daemonMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        daemonMetrics = new DaemonMetrics(meterRegistry, eventRegistry, connectionManager, eventBridge);
    }

    @Test
    @DisplayName("discovery and binding events increment outcome counters")
    void handlerCounters() {
        daemonMetrics.onHandlerDiscovery(new HandlerDiscoveryEvent(this, 3, 1, 7));
        daemonMetrics.onHandlerBinding(new HandlerBindingEvent(this, 6, 1, List.of("noSuchEvent")));

        assertThat(meterRegistry.get("daemon.handlers.loaded").tag("outcome", "success").counter().count())
                .isEqualTo(3.0);
        assertThat(meterRegistry.get("daemon.handlers.loaded").tag("outcome", "failure").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("daemon.handlers.bound").tag("outcome", "success").counter().count())
                .isEqualTo(6.0);
    }

    @Test
    @DisplayName("connection attempts and transitions are counted")
    void connectionCounters() {
        daemonMetrics.onConnectionAttempt(new ConnectionAttemptEvent(this, 1, 3, false, "refused"));
        daemonMetrics.onConnectionAttempt(new ConnectionAttemptEvent(this, 2, 3, true, null));
        daemonMetrics.onConnectionState(
                new ConnectionStateEvent(this, ConnectionState.CONNECTING, ConnectionState.CONNECTED, "up"));

        assertThat(meterRegistry.get("daemon.connection.attempts").tag("outcome", "failure").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("daemon.connection.attempts").tag("outcome", "success").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("daemon.connection.transitions").tag("state", "CONNECTED").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("gauges read registrations, connection state and bridge failures")
    void gauges() {
        when(eventRegistry.getRegistrationCount()).thenReturn(4);
        when(connectionManager.getState()).thenReturn(ConnectionState.CONNECTED);
        when(eventBridge.getFailureCount()).thenReturn(2L);

        assertThat(meterRegistry.get("daemon.registrations").gauge().value()).isEqualTo(4.0);
        assertThat(meterRegistry.get("daemon.connection.state").gauge().value()).isEqualTo(1.0);
        assertThat(meterRegistry.get("daemon.bridge.failures").functionCounter().count()).isEqualTo(2.0);
    }
}
