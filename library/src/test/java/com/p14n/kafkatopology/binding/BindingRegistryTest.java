package com.p14n.kafkatopology.binding;

import com.p14n.kafkatopology.client.DeliveryReport;
import com.p14n.kafkatopology.client.RecordingBrokerClient;
import com.p14n.kafkatopology.connection.ClusterConnection;
import com.p14n.kafkatopology.connection.ClusterConnectionFactory;
import com.p14n.kafkatopology.connection.ConnectionConfigBuilder;
import com.p14n.kafkatopology.data.Cluster;
import com.p14n.kafkatopology.data.Topic;
import com.p14n.kafkatopology.telemetry.ResolutionMetrics;

import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class BindingRegistryTest {

    private RecordingBrokerClient client;
    private BindingRegistry registry;
    private TopicBinder binder;
    private ClusterConnection connection;

    @BeforeEach
    void setUp() throws Exception {
        client = new RecordingBrokerClient().deliverOnSend(false);
        registry = new BindingRegistry();
        ResolutionMetrics metrics = new ResolutionMetrics(OpenTelemetry.noop().getMeter("test"));
        binder = new TopicBinder(registry, metrics);
        connection = new ClusterConnectionFactory(client, new ConnectionConfigBuilder(client), registry, metrics)
                .open(Cluster.withBrokers("main", "b1:9092"), "events");
    }

    @AfterEach
    void tearDown() {
        connection.close();
    }

    @Test
    void deliveryReachesLiveBinding() throws Exception {
        TopicBinding binding = binder.bind(connection, Topic.forProducer("orders", "orders", "events"));
        long opaque = client.opaques.get(0);

        registry.onDelivery(opaque, DeliveryReport.delivered("orders", 0, 42L));
        registry.onDelivery(opaque, DeliveryReport.failed("orders", "Message timed out"));

        assertEquals(1, binding.deliveredCount());
        assertEquals(1, binding.failedDeliveryCount());
        assertEquals(2, binding.referenceCount());
        binding.release();
    }

    @Test
    void deliveryAfterReleaseIsDropped() throws Exception {
        TopicBinding binding = binder.bind(connection, Topic.forProducer("orders", "orders", "events"));
        long opaque = client.opaques.get(0);
        binding.release();

        assertDoesNotThrow(() -> registry.onDelivery(opaque, DeliveryReport.delivered("orders", 0, 1L)));
        assertEquals(0, binding.deliveredCount());
        assertEquals(0, binding.referenceCount());
    }

    @Test
    void unknownIdIsDropped() {
        assertTrue(registry.acquire(12345L).isEmpty());
        assertDoesNotThrow(() -> registry.onDelivery(12345L, DeliveryReport.delivered("orders", 0, 1L)));
    }

    @Test
    void eachBindingGetsItsOwnId() throws Exception {
        TopicBinding a = binder.bind(connection, Topic.forProducer("a", "a", "events"));
        TopicBinding b = binder.bind(connection, Topic.forProducer("b", "b", "events"));

        assertEquals(2, registry.size());
        assertNotEquals(client.opaques.get(0), client.opaques.get(1));
        a.release();
        b.release();
        assertEquals(0, registry.size());
    }

    @Test
    void callbacksRacingWithReleaseNeverResurrectBinding() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int round = 0; round < 50; round++) {
                TopicBinding binding = binder.bind(connection, Topic.forProducer("t" + round, "t" + round, "events"));
                long opaque = client.opaques.get(round);
                CountDownLatch start = new CountDownLatch(1);
                List<Future<?>> deliveries = new ArrayList<>();
                for (int i = 0; i < 4; i++) {
                    deliveries.add(pool.submit(() -> {
                        start.await();
                        for (int n = 0; n < 100; n++) {
                            registry.onDelivery(opaque, DeliveryReport.delivered("t", 0, n));
                        }
                        return null;
                    }));
                }
                start.countDown();
                binding.release();
                for (Future<?> f : deliveries) {
                    f.get();
                }
                assertEquals(0, binding.referenceCount());
                assertTrue(registry.acquire(opaque).isEmpty());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
