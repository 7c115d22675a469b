package com.p14n.eventbus.broker;

import com.p14n.eventbus.data.ConfigData;

import io.opentelemetry.api.OpenTelemetry;

import net.jqwik.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryPropertiesTest {

    @Property(tries = 10)
    void messagesArriveInPublishOrder(@ForAll("randomSeeds") long seed) throws Exception {
        Random random = new Random(seed);
        int count = 1 + random.nextInt(50);
        List<Integer> sent = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            sent.add(random.nextInt());
        }

        List<Integer> received = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch latch = new CountDownLatch(count);

        try (DefaultMessageBroker broker = new DefaultMessageBroker(
                new ConfigData(count, Duration.ofMillis(20), Duration.ofMillis(500), Duration.ofMillis(500)),
                OpenTelemetry.noop(), "props")) {
            broker.subscribe("events.ordered", message -> {
                if (random.nextInt(4) == 0) {
                    Thread.sleep(1);
                }
                received.add((Integer) message.get("n"));
                latch.countDown();
                return null;
            });
            broker.start();

            for (Integer n : sent) {
                assertTrue(broker.publish("events.ordered", Map.of("n", n)).isAccepted());
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            assertEquals(sent, received);
        }
    }

    @Property(tries = 10)
    void eachCorrelationIdIsFulfilledAtMostOnce(@ForAll("randomSeeds") long seed) throws Exception {
        Random random = new Random(seed);
        PendingRequests pending = new PendingRequests();
        int replies = 1 + random.nextInt(20);
        AtomicInteger fulfilled = new AtomicInteger();

        CompletableFuture<Map<String, Object>> future = pending.register("req");
        List<Thread> repliers = new ArrayList<>();
        for (int i = 0; i < replies; i++) {
            int reply = i;
            repliers.add(new Thread(() -> {
                if (pending.complete("req", Map.of("reply", reply))) {
                    fulfilled.incrementAndGet();
                }
            }));
        }
        repliers.forEach(Thread::start);
        for (Thread replier : repliers) {
            replier.join();
        }

        assertEquals(1, fulfilled.get());
        assertTrue(future.isDone());
        assertEquals(0, pending.size());
    }

    @Provide
    Arbitrary<Long> randomSeeds() {
        return Arbitraries.longs().between(0, Long.MAX_VALUE);
    }
}
