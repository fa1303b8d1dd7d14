package com.p14n.kafkatopology.lifecycle;

/**
 * Receives producer lifecycle notifications from a
 * {@link LifecycleObserverBus}.
 */
public interface ProducerLifecycleListener {

    void onLifecycleEvent(ProducerLifecycleNotification notification);

    /**
     * Called when {@link #onLifecycleEvent} throws.
     *
     * @param notification the notification being handled
     * @param error        the error thrown
     */
    default void onError(ProducerLifecycleNotification notification, Throwable error) {
    }
}
