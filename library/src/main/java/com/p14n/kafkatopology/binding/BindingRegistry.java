package com.p14n.kafkatopology.binding;

import com.p14n.kafkatopology.client.DeliveryCallback;
import com.p14n.kafkatopology.client.DeliveryReport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps the opaque ids handed to the client library back to live
 * {@link TopicBinding}s.
 *
 * <p>
 * Each registered binding holds one counted reference for its slot, taken
 * at registration and dropped when the slot is removed. A delivery report
 * only reaches a binding the registry can atomically retain, so a callback
 * racing with {@link TopicBinding#release()} sees either a live binding or
 * nothing.
 * </p>
 */
public class BindingRegistry implements DeliveryCallback {

    private static final Logger logger = LoggerFactory.getLogger(BindingRegistry.class);

    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<Long, TopicBinding> slots = new ConcurrentHashMap<>();

    /**
     * Registers a binding, retaining it for the registry slot.
     *
     * @param binding the binding
     * @return the opaque id for the client library
     */
    long register(TopicBinding binding) {
        long id = nextId.getAndIncrement();
        binding.retain();
        slots.put(id, binding);
        return id;
    }

    /**
     * Removes the slot and drops its reference, if the slot still belongs to
     * the given binding.
     *
     * @return true if the slot was removed
     */
    boolean unregister(long id, TopicBinding binding) {
        if (slots.remove(id, binding)) {
            binding.releaseReference();
            return true;
        }
        return false;
    }

    /**
     * Resolves an opaque id to a live binding and retains it. The caller must
     * call {@link TopicBinding#releaseReference()} when done.
     *
     * @param id the opaque id
     * @return the retained binding, or empty if the id is stale
     */
    public Optional<TopicBinding> acquire(long id) {
        TopicBinding binding = slots.get(id);
        if (binding == null || !binding.tryRetain()) {
            return Optional.empty();
        }
        return Optional.of(binding);
    }

    public int size() {
        return slots.size();
    }

    @Override
    public void onDelivery(long opaque, DeliveryReport report) {
        Optional<TopicBinding> acquired = acquire(opaque);
        if (acquired.isEmpty()) {
            logger.atDebug()
                    .addArgument(report.topic())
                    .addArgument(opaque)
                    .log("Dropping delivery report for topic {}, binding {} already released");
            return;
        }
        TopicBinding binding = acquired.get();
        try {
            binding.recordDelivery(report);
        } finally {
            binding.releaseReference();
        }
    }
}
