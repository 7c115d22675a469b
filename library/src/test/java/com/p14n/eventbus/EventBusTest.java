package com.p14n.eventbus;

import com.p14n.eventbus.broker.BrokerException;
import com.p14n.eventbus.broker.DefaultMessageBroker;
import com.p14n.eventbus.broker.MessageBroker;
import com.p14n.eventbus.broker.MessageSubscriber;
import com.p14n.eventbus.broker.PublishResult;
import com.p14n.eventbus.broker.Subscription;
import com.p14n.eventbus.data.ConfigData;
import com.p14n.eventbus.data.Event;
import com.p14n.eventbus.data.EventScope;
import com.p14n.eventbus.data.EventType;
import com.p14n.eventbus.data.ScopedEvent;

import io.opentelemetry.api.OpenTelemetry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class EventBusTest {

    @EventType("order.created")
    public record OrderCreated(String type, String source, EventScope scope, String orderId)
            implements ScopedEvent {
        OrderCreated(String orderId, EventScope scope) {
            this("order.created", "shop", scope, orderId);
        }
    }

    private DefaultMessageBroker local;
    private DefaultMessageBroker distributed;
    private EventBus bus;

    @BeforeEach
    void setUp() {
        ConfigData config = new ConfigData(100, Duration.ofMillis(50), Duration.ofMillis(500), Duration.ofMillis(500));
        local = new DefaultMessageBroker(config, OpenTelemetry.noop(), "local");
        distributed = new DefaultMessageBroker(config, OpenTelemetry.noop(), "distributed");
        bus = new EventBus(local, distributed);
    }

    @AfterEach
    void tearDown() {
        bus.close();
        local.close();
        distributed.close();
    }

    @Test
    void shouldRouteProcessEventsToLocalBroker() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<Map<String, Object>> received = new AtomicReference<>();
        bus.subscribe("order.created", message -> {
            received.set(message);
            latch.countDown();
            return null;
        });
        bus.start();

        bus.publish(Event.create("shop", "order.created", Map.of("order_id", "ORD-001"), EventScope.PROCESS));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals(1, local.getStats().published());
        assertEquals(0, distributed.getStats().published());
        assertEquals("process", received.get().get("scope"));
        assertEquals(Map.of("order_id", "ORD-001"), received.get().get("data"));
    }

    @Test
    void shouldRouteAppEventsToDistributedBroker() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        bus.subscribe("order.created", message -> {
            latch.countDown();
            return null;
        });
        bus.start();

        bus.publish(Event.create("shop", "order.created", Map.of("order_id", "ORD-001")));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals(0, local.getStats().published());
        assertEquals(1, distributed.getStats().published());
    }

    @Test
    void shouldRegisterHandlerOnBothBrokers() {
        EventSubscription subscription = bus.subscribe("order.created",
                MessageSubscriber.listening("audit", message -> {
                }));

        assertEquals("events.order.created", subscription.local().channel());
        assertEquals(1, local.getSubscribers().get("events.order.created").size());
        assertEquals(1, distributed.getSubscribers().get("events.order.created").size());
        assertEquals("audit", local.getSubscribers().get("events.order.created").get(0).name());
    }

    @Test
    void shouldDecodeEventsForTypedHandlers() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(2);
        AtomicReference<OrderCreated> typed = new AtomicReference<>();
        AtomicReference<Event> generic = new AtomicReference<>();
        bus.subscribe(OrderCreated.class, event -> {
            typed.set(event);
            latch.countDown();
        });
        bus.subscribe("order.created", Event.class, event -> {
            generic.set(event);
            latch.countDown();
        });
        bus.start();

        bus.publish(new OrderCreated("ORD-001", EventScope.PROCESS));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals(new OrderCreated("ORD-001", EventScope.PROCESS), typed.get());
        assertEquals("ORD-001", generic.get().extensions().get("orderId"));
    }

    @Test
    void shouldListRegisteredHandlers() {
        bus.subscribe("order.created", MessageSubscriber.listening("audit", message -> {
        }));
        bus.subscribe(OrderCreated.class, EventHandler.named("mailer", event -> {
        }));
        bus.subscribe("order.shipped", Event.class, EventHandler.named("tracker", event -> {
        }));

        Map<String, List<HandlerInfo>> handlers = bus.getHandlers();

        assertEquals(List.of("order.created", "order.shipped"), List.copyOf(handlers.keySet()));
        assertEquals("audit", handlers.get("order.created").get(0).name());
        assertEquals("mailer", handlers.get("order.created").get(1).name());
        assertEquals("tracker", handlers.get("order.shipped").get(0).name());
        assertNotNull(handlers.get("order.shipped").get(0).className());
    }

    @Test
    void shouldRejectMissingBrokers() {
        assertThrows(IllegalArgumentException.class, () -> new EventBus(null, distributed));
        assertThrows(IllegalArgumentException.class, () -> new EventBus(local, null));
    }

    @Test
    void shouldRejectClassesWithoutEventType() {
        assertThrows(IllegalArgumentException.class, () -> bus.subscribe(Event.class, event -> {
        }));
    }

    @Test
    void shouldStopLocalBrokerWhenDistributedFailsToStart() {
        MessageBroker localMock = mock(MessageBroker.class);
        MessageBroker distributedMock = mock(MessageBroker.class);
        doThrow(new BrokerException("unreachable")).when(distributedMock).start();

        EventBus failing = new EventBus(localMock, distributedMock);

        BrokerException thrown = assertThrows(BrokerException.class, failing::start);
        assertEquals("unreachable", thrown.getMessage());
        verify(localMock).start();
        verify(localMock).stop();
    }

    @Test
    void shouldAttemptBothStopsAndAggregateFailures() {
        MessageBroker localMock = mock(MessageBroker.class);
        MessageBroker distributedMock = mock(MessageBroker.class);
        doThrow(new BrokerException("local")).when(localMock).stop();
        doThrow(new BrokerException("distributed")).when(distributedMock).stop();

        EventBus failing = new EventBus(localMock, distributedMock);

        EventBusException thrown = assertThrows(EventBusException.class, failing::stop);
        assertEquals(2, thrown.failures().size());
        verify(localMock).stop();
        verify(distributedMock).stop();
    }

    @Test
    void shouldSwallowPublishFailures() {
        MessageBroker localMock = mock(MessageBroker.class);
        MessageBroker distributedMock = mock(MessageBroker.class);
        when(localMock.publish(anyString(), anyMap())).thenReturn(PublishResult.accepted(1));
        when(distributedMock.publish(anyString(), anyMap())).thenThrow(new IllegalStateException("down"));

        EventBus router = new EventBus(localMock, distributedMock);

        assertDoesNotThrow(() -> router.publish(Event.create("shop", "order.created", null)));
        assertDoesNotThrow(() -> router.publish(Event.create("shop", "order.created", null, EventScope.PROCESS)));
        verify(distributedMock).publish(eq("events.order.created"), anyMap());
        verify(localMock).publish(eq("events.order.created"), anyMap());
        assertThrows(IllegalArgumentException.class, () -> router.publish(null));
    }

    @Test
    void shouldUndoLocalRegistrationWhenDistributedSubscribeFails() {
        MessageBroker localMock = mock(MessageBroker.class);
        MessageBroker distributedMock = mock(MessageBroker.class);
        Subscription localSubscription = local.subscribe("events.order.created", message -> null);
        when(localMock.subscribe(anyString(), any(MessageSubscriber.class))).thenReturn(localSubscription);
        when(distributedMock.subscribe(anyString(), any(MessageSubscriber.class)))
                .thenThrow(new BrokerException("unreachable"));

        EventBus failing = new EventBus(localMock, distributedMock);

        assertThrows(BrokerException.class, () -> failing.subscribe("order.created", message -> null));
        verify(localMock).unsubscribe(localSubscription);
        assertTrue(failing.getHandlers().isEmpty());
    }
}
