package com.p14n.kafkatopology.lifecycle;

import com.p14n.kafkatopology.data.EntityType;
import com.p14n.kafkatopology.data.Producer;
import com.p14n.kafkatopology.executor.AsyncExecutor;
import com.p14n.kafkatopology.executor.DefaultExecutor;
import com.p14n.kafkatopology.store.EntityObserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Observes producers in the entity store and fans each change out to
 * {@link ProducerLifecycleListener}s.
 *
 * <p>
 * The {@link LoggingLifecycleListener} runs inline. Every other listener runs
 * on the bus's {@link AsyncExecutor}; a listener that fails or cannot be
 * scheduled is logged and never retried, and the thread that changed the
 * store is never held up by a listener.
 * </p>
 */
public class LifecycleObserverBus implements EntityObserver<Producer>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LifecycleObserverBus.class);

    private final AsyncExecutor asyncExecutor;
    private final ProducerLifecycleListener inlineListener = new LoggingLifecycleListener();
    private final Set<ProducerLifecycleListener> listeners = new CopyOnWriteArraySet<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public LifecycleObserverBus() {
        this(new DefaultExecutor(1));
    }

    public LifecycleObserverBus(AsyncExecutor asyncExecutor) {
        this.asyncExecutor = asyncExecutor;
    }

    public boolean subscribe(ProducerLifecycleListener listener) {
        if (closed.get()) {
            throw new IllegalStateException("Bus is closed");
        }
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        return listeners.add(listener);
    }

    public boolean unsubscribe(ProducerLifecycleListener listener) {
        return listeners.remove(listener);
    }

    @Override
    public void created(Producer producer) {
        publish(new ProducerLifecycleNotification(ProducerLifecycleEvent.CREATED, producer));
    }

    @Override
    public void updated(Producer producer) {
        publish(new ProducerLifecycleNotification(ProducerLifecycleEvent.UPDATED, producer));
    }

    @Override
    public void deleted(Producer producer) {
        publish(new ProducerLifecycleNotification(ProducerLifecycleEvent.DELETED, producer));
    }

    @Override
    public void loaded(EntityType type) {
        publish(ProducerLifecycleNotification.loadedBatch());
    }

    void publish(ProducerLifecycleNotification notification) {
        if (closed.get()) {
            return;
        }
        inlineListener.onLifecycleEvent(notification);

        for (ProducerLifecycleListener listener : listeners) {
            try {
                asyncExecutor.submit(() -> {
                    try {
                        listener.onLifecycleEvent(notification);
                    } catch (Exception e) {
                        logger.atWarn()
                                .setCause(e)
                                .addArgument(listener.getClass().getSimpleName())
                                .addArgument(notification.event())
                                .log("Listener {} failed handling {}");
                        listener.onError(notification, e);
                    }
                    return null;
                });
            } catch (RejectedExecutionException e) {
                logger.atWarn()
                        .addArgument(notification.event())
                        .addArgument(listener.getClass().getSimpleName())
                        .log("Dropped {} notification for listener {}, executor is saturated or closed");
            }
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            listeners.clear();
            asyncExecutor.close();
        }
    }
}
