package com.eventdaemon.unit.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.eventdaemon.config.DaemonConfig;
import com.eventdaemon.event.HandlerBindingEvent;
import com.eventdaemon.event.HandlerDiscoveryEvent;
import com.eventdaemon.exception.RegistrySealedException;
import com.eventdaemon.gateway.EventDispatcher;
import com.eventdaemon.gateway.EventPayload;
import com.eventdaemon.gateway.EventSubscriber;
import com.eventdaemon.gateway.GatewayConnection;
import com.eventdaemon.gateway.GatewayEvent;
import com.eventdaemon.gateway.SimulatedGatewayConnection;
import com.eventdaemon.loader.HandlerLoader;
import com.eventdaemon.loader.LoadResult;
import com.eventdaemon.registry.EventHandler;
import com.eventdaemon.registry.EventRegistry;
import com.eventdaemon.registry.HandlerKind;
import com.eventdaemon.registry.HandlerModule;
import com.eventdaemon.registry.HandlerRegistrar;
import com.eventdaemon.registry.HandlerRegistration;
import com.eventdaemon.registry.OnEvent;
import com.eventdaemon.registry.SyncEventHandler;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for {@link EventRegistry}.
 *
 * <p>Covers handler collection and classification, discovery through a mocked
 * {@link HandlerLoader}, binding to a simulated connection, and sealing.
 */
@ExtendWith(MockitoExtension.class)
class EventRegistryTest {

    private static final String BAR_UPDATE = "barUpdateEvent";

    @Mock
    private HandlerLoader handlerLoader;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private DaemonConfig daemonConfig;
    private EventRegistry eventRegistry;
    private SimulatedGatewayConnection connection;

    @BeforeEach
    void setUp() {
        daemonConfig = new DaemonConfig();
        eventRegistry = new EventRegistry(handlerLoader, daemonConfig, applicationEventPublisher);
        connection = new SimulatedGatewayConnection(new EventDispatcher());
    }

    @Nested
    @DisplayName("Collect")
    class CollectTests {

        @Test
        @DisplayName("collect returns the same handler instance and tags it with the event name")
        void returnsSameInstanceAndTags() {
            SyncEventHandler handler = (ib, payload) -> {};

            SyncEventHandler returned = eventRegistry.collect(BAR_UPDATE).apply(handler);

            assertThat(returned).isSameAs(handler);
            assertThat(eventRegistry.getEventNamesFor(handler)).containsExactly(BAR_UPDATE);
        }

        @Test
        @DisplayName("sync handler is classified SYNC, async handler ASYNC")
        void classifiesByShape() {
            eventRegistry.collect(BAR_UPDATE).sync((ib, payload) -> {});
            eventRegistry.collect(BAR_UPDATE).async((ib, payload) -> CompletableFuture.completedFuture(null));

            List<HandlerRegistration> registrations = eventRegistry.getHandlers(BAR_UPDATE);
            assertThat(registrations)
                    .extracting(HandlerRegistration::getKind)
                    .containsExactly(HandlerKind.SYNC, HandlerKind.ASYNC);
        }

        @Test
        @DisplayName("registrations keep insertion order and duplicates")
        void keepsOrderAndDuplicates() {
            SyncEventHandler first = (ib, payload) -> {};
            SyncEventHandler second = (ib, payload) -> {};

            eventRegistry.collect(BAR_UPDATE).apply("first", first);
            eventRegistry.collect(BAR_UPDATE).apply("second", second);
            eventRegistry.collect(BAR_UPDATE).apply("first-again", first);

            assertThat(eventRegistry.getHandlers(BAR_UPDATE))
                    .extracting(HandlerRegistration::getName)
                    .containsExactly("first", "second", "first-again");
            assertThat(eventRegistry.getRegistrationCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("lambda handlers get a readable display name")
        void lambdaDisplayName() {
            eventRegistry.collect(BAR_UPDATE).sync((ib, payload) -> {});

            assertThat(eventRegistry.getHandlers(BAR_UPDATE).get(0).getName()).endsWith("::lambda");
        }

        @Test
        @DisplayName("handler implementing neither shape is rejected")
        void rejectsShapelessHandler() {
            assertThatThrownBy(() -> eventRegistry.collect(BAR_UPDATE).apply(new NeitherShape()))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(eventRegistry.getRegistrationCount()).isZero();
        }

        @Test
        @DisplayName("getHandlers for an unknown event is empty")
        void unknownEventIsEmpty() {
            assertThat(eventRegistry.getHandlers("nothingEvent")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Discover")
    class DiscoverTests {

        @Test
        @DisplayName("repeated discovery yields the same registration count")
        void discoveryIsIdempotent() {
            daemonConfig.setHandlers("/handlers");
            when(handlerLoader.discover(List.of("/handlers")))
                    .thenAnswer(invocation -> List.of(
                            LoadResult.success(Path.of("/handlers/Bars.java"), List.of(new TwoHandlerModule()))));

            eventRegistry.discoverHandlers();
            int firstCount = eventRegistry.getRegistrationCount();
            eventRegistry.discoverHandlers();

            assertThat(firstCount).isEqualTo(2);
            assertThat(eventRegistry.getRegistrationCount()).isEqualTo(2);
            verify(handlerLoader, times(2)).discover(List.of("/handlers"));
        }

        @Test
        @DisplayName("failed load results are reported and leave other files registered")
        void failedResultIsSkipped() {
            daemonConfig.setHandlers("/handlers");
            LoadResult broken = LoadResult.failure(Path.of("/handlers/Broken.java"), new IllegalStateException("boom"));
            LoadResult good = LoadResult.success(Path.of("/handlers/Bars.java"), List.of(new TwoHandlerModule()));
            when(handlerLoader.discover(List.of("/handlers"))).thenReturn(List.of(broken, good));

            List<LoadResult> results = eventRegistry.discoverHandlers();

            assertThat(results).extracting(LoadResult::isSuccess).containsExactly(false, true);
            assertThat(eventRegistry.getRegistrationCount()).isEqualTo(2);

            ArgumentCaptor<HandlerDiscoveryEvent> captor = ArgumentCaptor.forClass(HandlerDiscoveryEvent.class);
            verify(applicationEventPublisher).publishEvent(captor.capture());
            assertThat(captor.getValue().getLoadedFiles()).isEqualTo(1);
            assertThat(captor.getValue().getFailedFiles()).isEqualTo(1);
        }

        @Test
        @DisplayName("a module whose registration throws becomes a failed result")
        void registrationFailureBecomesFailedResult() {
            daemonConfig.setHandlers("/handlers");
            HandlerModule exploding = new HandlerModule() {
                @Override
                public void registerHandlers(HandlerRegistrar registrar) {
                    throw new IllegalStateException("bad module");
                }
            };
            when(handlerLoader.discover(List.of("/handlers")))
                    .thenReturn(List.of(LoadResult.success(Path.of("/handlers/Bad.java"), List.of(exploding))));

            List<LoadResult> results = eventRegistry.discoverHandlers();

            assertThat(results).hasSize(1);
            assertThat(results.get(0).isSuccess()).isFalse();
            assertThat(results.get(0).getError()).hasMessageContaining("bad module");
        }

        @Test
        @DisplayName("no configured paths: warns and never calls the loader")
        void noPathsConfigured() {
            List<LoadResult> results = eventRegistry.discoverHandlers();

            assertThat(results).isEmpty();
            verifyNoInteractions(handlerLoader);
        }

        @Test
        @DisplayName("@OnEvent methods are registered with their shape")
        void annotatedMethods() {
            int added = eventRegistry.registerModule(new AnnotatedModule(), "/handlers/Annotated.java");

            assertThat(added).isEqualTo(2);
            assertThat(eventRegistry.getHandlers("orderStatusEvent"))
                    .extracting(HandlerRegistration::getKind)
                    .containsExactly(HandlerKind.ASYNC);
            assertThat(eventRegistry.getHandlers(BAR_UPDATE))
                    .singleElement()
                    .satisfies(r -> {
                        assertThat(r.getKind()).isEqualTo(HandlerKind.SYNC);
                        assertThat(r.getSourcePath()).isEqualTo("/handlers/Annotated.java");
                        assertThat(r.getName()).endsWith("#onBar");
                    });
        }

        @Test
        @DisplayName("@OnEvent method with a wrong signature is rejected")
        void annotatedMethodWithWrongSignature() {
            assertThatThrownBy(() -> eventRegistry.registerModule(new WrongSignatureModule(), "/handlers/Wrong.java"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("GatewayConnection, EventPayload");
        }

        @Test
        @DisplayName("an object with no handlers registers nothing")
        void plainObjectRegistersNothing() {
            assertThat(eventRegistry.registerModule(new Object(), "/handlers/Nothing.java")).isZero();
            assertThat(eventRegistry.getModuleCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Bind")
    class BindTests {

        @Test
        @DisplayName("k registrations produce k subscriptions in registration order")
        void bindsInOrder() throws Exception {
            List<String> calls = new ArrayList<>();
            eventRegistry.collect(BAR_UPDATE).sync((ib, payload) -> calls.add("a"));
            eventRegistry.collect(BAR_UPDATE).sync((ib, payload) -> calls.add("b"));
            eventRegistry.collect(BAR_UPDATE).sync((ib, payload) -> calls.add("c"));

            eventRegistry.bindTo(connection);

            GatewayEvent event = connection.event(BAR_UPDATE).orElseThrow();
            assertThat(event.getSubscriberCount()).isEqualTo(3);
            event.emit("bar");
            assertThat(calls).containsExactly("a", "b", "c");
        }

        @Test
        @DisplayName("handlers receive the connection prepended to the payload")
        void prependsConnection() {
            List<Object> seen = new ArrayList<>();
            eventRegistry.collect(BAR_UPDATE).sync((ib, payload) -> {
                seen.add(ib);
                seen.add(payload);
            });
            eventRegistry.bindTo(connection);

            EventPayload payload = EventPayload.of(1, 2);
            connection.event(BAR_UPDATE).orElseThrow().emit(payload);

            assertThat(seen).containsExactly(connection, payload);
        }

        @Test
        @DisplayName("an event missing on the connection is skipped without error")
        void missingEventIsSkipped() {
            eventRegistry.collect("noSuchEvent").sync((ib, payload) -> {});

            assertThatCode(() -> eventRegistry.bindTo(connection)).doesNotThrowAnyException();

            ArgumentCaptor<HandlerBindingEvent> captor = ArgumentCaptor.forClass(HandlerBindingEvent.class);
            verify(applicationEventPublisher).publishEvent(captor.capture());
            assertThat(captor.getValue().getBound()).isZero();
            assertThat(captor.getValue().getMissingEvents()).containsExactly("noSuchEvent");
        }

        @Test
        @DisplayName("a failing subscription does not stop the remaining ones")
        void subscriptionFailureIsIsolated() {
            GatewayConnection mockConnection = mock(GatewayConnection.class);
            GatewayEvent mockEvent = mock(GatewayEvent.class);
            when(mockConnection.event(BAR_UPDATE)).thenReturn(Optional.of(mockEvent));
            doThrow(new IllegalStateException("subscribe refused"))
                    .doNothing()
                    .when(mockEvent)
                    .connect(any(EventSubscriber.class));
            eventRegistry.collect(BAR_UPDATE).sync((ib, payload) -> {});
            eventRegistry.collect(BAR_UPDATE).sync((ib, payload) -> {});

            eventRegistry.bindTo(mockConnection);

            verify(mockEvent, times(2)).connect(any(EventSubscriber.class));
            ArgumentCaptor<HandlerBindingEvent> captor = ArgumentCaptor.forClass(HandlerBindingEvent.class);
            verify(applicationEventPublisher).publishEvent(captor.capture());
            assertThat(captor.getValue().getBound()).isEqualTo(1);
            assertThat(captor.getValue().getFailed()).isEqualTo(1);
        }

        @Test
        @DisplayName("module setup runs after binding, and a failing setup does not stop the next")
        void setupIsIsolated() {
            RecordingModule failing = new RecordingModule(true);
            RecordingModule healthy = new RecordingModule(false);
            eventRegistry.registerModule(failing, "/handlers/Failing.java");
            eventRegistry.registerModule(healthy, "/handlers/Healthy.java");

            eventRegistry.bindTo(connection);

            assertThat(failing.setupConnection).isSameAs(connection);
            assertThat(healthy.setupConnection).isSameAs(connection);
            assertThat(healthy.subscribersAtSetup).isEqualTo(2);
        }

        @Test
        @DisplayName("a failed async handler is logged and later subscribers still run")
        void asyncFailureDoesNotStall() {
            List<String> calls = new ArrayList<>();
            eventRegistry.collect(BAR_UPDATE).async((ib, payload) ->
                    CompletableFuture.failedFuture(new IllegalStateException("async boom")));
            eventRegistry.collect(BAR_UPDATE).sync((ib, payload) -> calls.add("after"));
            eventRegistry.bindTo(connection);

            assertThatCode(() -> connection.event(BAR_UPDATE).orElseThrow().emit("bar"))
                    .doesNotThrowAnyException();
            assertThat(calls).containsExactly("after");
        }

        @Test
        @DisplayName("binding twice subscribes every handler twice")
        void bindingTwiceDuplicates() {
            eventRegistry.collect(BAR_UPDATE).sync((ib, payload) -> {});

            eventRegistry.bindTo(connection);
            eventRegistry.bindTo(connection);

            assertThat(connection.event(BAR_UPDATE).orElseThrow().getSubscriberCount()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Seal")
    class SealTests {

        @Test
        @DisplayName("sealed registry rejects new registrations")
        void sealedRejectsCollect() {
            eventRegistry.seal();

            assertThatThrownBy(() -> eventRegistry.collect(BAR_UPDATE).sync((ib, payload) -> {}))
                    .isInstanceOf(RegistrySealedException.class);
        }

        @Test
        @DisplayName("sealed registry rejects discovery")
        void sealedRejectsDiscovery() {
            eventRegistry.seal();

            assertThatThrownBy(() -> eventRegistry.discoverHandlers()).isInstanceOf(RegistrySealedException.class);
            verifyNoInteractions(handlerLoader);
        }

        @Test
        @DisplayName("clear drops registrations and unseals")
        void clearUnseals() {
            eventRegistry.collect(BAR_UPDATE).sync((ib, payload) -> {});
            eventRegistry.seal();

            eventRegistry.clear();

            assertThat(eventRegistry.isSealed()).isFalse();
            assertThat(eventRegistry.getRegistrationCount()).isZero();
            assertThat(eventRegistry.getEventNames()).isEmpty();
        }
    }

    static class TwoHandlerModule implements HandlerModule {

        @Override
        public void registerHandlers(HandlerRegistrar registrar) {
            registrar.collect(BAR_UPDATE).sync((ib, payload) -> {});
            registrar.collect("errorEvent").sync((ib, payload) -> {});
        }
    }

    static class NeitherShape implements EventHandler {}

    public static class AnnotatedModule {

        @OnEvent(BAR_UPDATE)
        public void onBar(GatewayConnection ib, EventPayload payload) {}

        @OnEvent("orderStatusEvent")
        public CompletionStage<Void> onOrderStatus(GatewayConnection ib, EventPayload payload) {
            return CompletableFuture.completedFuture(null);
        }
    }

    public static class WrongSignatureModule {

        @OnEvent(BAR_UPDATE)
        public void onBar(EventPayload payload) {}
    }

    static class RecordingModule implements HandlerModule {

        private final boolean failSetup;
        private GatewayConnection setupConnection;
        private int subscribersAtSetup;

        RecordingModule(boolean failSetup) {
            this.failSetup = failSetup;
        }

        @Override
        public void registerHandlers(HandlerRegistrar registrar) {
            registrar.collect(BAR_UPDATE).sync((ib, payload) -> {});
        }

        @Override
        public void setup(GatewayConnection connection, Logger logger) {
            setupConnection = connection;
            subscribersAtSetup = connection.event(BAR_UPDATE).orElseThrow().getSubscriberCount();
            if (failSetup) {
                throw new IllegalStateException("setup failed");
            }
        }
    }
}
