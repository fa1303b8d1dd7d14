package com.p14n.kafkatopology.lifecycle;

import com.p14n.kafkatopology.data.EntityType;
import com.p14n.kafkatopology.data.Producer;
import com.p14n.kafkatopology.executor.DefaultExecutor;
import com.p14n.kafkatopology.executor.TestAsyncExecutor;
import com.p14n.kafkatopology.store.InMemoryEntityStore;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 2, unit = TimeUnit.SECONDS)
class LifecycleObserverBusTest {

    private TestAsyncExecutor executor;
    private LifecycleObserverBus bus;
    private final List<ProducerLifecycleNotification> received = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        executor = new TestAsyncExecutor();
        bus = new LifecycleObserverBus(executor);
        bus.subscribe(received::add);
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void mapsStoreCallbacksToEvents() {
        Producer events = new Producer("events", "main");

        bus.created(events);
        bus.updated(events);
        bus.deleted(events);
        bus.loaded(EntityType.PRODUCER);
        executor.runPending();

        assertEquals(List.of(ProducerLifecycleEvent.CREATED,
                ProducerLifecycleEvent.UPDATED,
                ProducerLifecycleEvent.DELETED,
                ProducerLifecycleEvent.LOADED_BATCH),
                received.stream().map(ProducerLifecycleNotification::event).toList());
        assertSame(events, received.get(0).producer());
        assertTrue(received.get(3).optionalProducer().isEmpty());
    }

    @Test
    void listenersDoNotRunOnTheStoreThread() {
        bus.created(new Producer("events", "main"));

        assertTrue(received.isEmpty());
        assertEquals(1, executor.pending());
        executor.runPending();
        assertEquals(1, received.size());
    }

    @Test
    void failingListenerIsReportedAndOthersStillRun() {
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        bus.subscribe(new ProducerLifecycleListener() {
            @Override
            public void onLifecycleEvent(ProducerLifecycleNotification notification) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void onError(ProducerLifecycleNotification notification, Throwable error) {
                errors.add(error);
            }
        });

        bus.created(new Producer("events", "main"));
        executor.runPending();

        assertEquals(1, received.size());
        assertEquals(1, errors.size());
        assertEquals("boom", errors.get(0).getMessage());
    }

    @Test
    void saturatedExecutorDropsNotificationWithoutBlocking() {
        TestAsyncExecutor full = new TestAsyncExecutor(1);
        LifecycleObserverBus bounded = new LifecycleObserverBus(full);
        List<ProducerLifecycleNotification> seen = new CopyOnWriteArrayList<>();
        bounded.subscribe(seen::add);

        bounded.created(new Producer("a", "main"));
        assertDoesNotThrow(() -> bounded.created(new Producer("b", "main")));
        full.runPending();

        assertEquals(1, seen.size());
        assertEquals("a", seen.get(0).producer().id());
        bounded.close();
    }

    @Test
    void closeShutsDownExecutorAndIgnoresLaterEvents() {
        bus.close();

        bus.created(new Producer("events", "main"));

        assertTrue(executor.isShutdown());
        assertEquals(0, executor.pending());
        assertThrows(IllegalStateException.class, () -> bus.subscribe(n -> {
        }));
    }

    @Test
    void receivesProducerChangesFromStore() throws Exception {
        LifecycleObserverBus live = new LifecycleObserverBus(new DefaultExecutor(1));
        CountDownLatch created = new CountDownLatch(1);
        live.subscribe(n -> {
            if (n.event() == ProducerLifecycleEvent.CREATED) {
                created.countDown();
            }
        });
        try (InMemoryEntityStore store = InMemoryEntityStore.empty()) {
            store.addObserver(Producer.class, live);
            store.put(new Producer("events", "main"));

            assertTrue(created.await(1, TimeUnit.SECONDS));
        } finally {
            live.close();
        }
    }
}
