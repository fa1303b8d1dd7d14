package com.p14n.kafkatopology;

import com.p14n.kafkatopology.binding.ProbeFlushPolicy;
import com.p14n.kafkatopology.binding.TopicBinder;
import com.p14n.kafkatopology.client.BrokerClient;
import com.p14n.kafkatopology.data.Producer;
import com.p14n.kafkatopology.lifecycle.LifecycleObserverBus;
import com.p14n.kafkatopology.resolver.ResolutionReport;
import com.p14n.kafkatopology.resolver.TopologyResolver;
import com.p14n.kafkatopology.store.EntityStore;
import com.p14n.kafkatopology.store.InMemoryEntityStore;
import com.p14n.kafkatopology.store.KafkaConfFile;

import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads a Kafka topology, resolves it into connections and keeps it in step
 * with reloads.
 *
 * <pre>{@code
 * KafkaResourceModule module = KafkaResourceModule.forConfigFile(Path.of("kafka.conf"),
 *         new KafkaBrokerClient(), openTelemetry);
 * ResolutionReport report = module.load();
 * ...
 * module.unload();
 * }</pre>
 */
public class KafkaResourceModule {

    private static final Logger logger = LoggerFactory.getLogger(KafkaResourceModule.class);

    /**
     * Opens the entity store backing the module.
     */
    @FunctionalInterface
    public interface StoreOpener {
        EntityStore open() throws IOException;
    }

    private final StoreOpener storeOpener;
    private final BrokerClient client;
    private final OpenTelemetry ot;
    private final ProbeFlushPolicy flushPolicy;
    private final LifecycleObserverBus bus;

    private EntityStore store;
    private TopologyResolver resolver;
    private boolean loaded;
    private boolean unloaded;

    public KafkaResourceModule(StoreOpener storeOpener, BrokerClient client, OpenTelemetry ot) {
        this(storeOpener, client, ot, TopicBinder.DEFAULT_FLUSH_POLICY, new LifecycleObserverBus());
    }

    public KafkaResourceModule(StoreOpener storeOpener, BrokerClient client, OpenTelemetry ot,
            ProbeFlushPolicy flushPolicy, LifecycleObserverBus bus) {
        this.storeOpener = storeOpener;
        this.client = client;
        this.ot = ot;
        this.flushPolicy = flushPolicy;
        this.bus = bus;
    }

    public static KafkaResourceModule forConfigFile(Path path, BrokerClient client, OpenTelemetry ot) {
        return new KafkaResourceModule(() -> new InMemoryEntityStore(new KafkaConfFile(path)), client, ot);
    }

    public LifecycleObserverBus lifecycleBus() {
        return bus;
    }

    /**
     * Opens and loads the store, then resolves the topology. A configuration
     * that cannot be read is logged and leaves the topology empty until the
     * next {@link #reload()}.
     *
     * @return the resolution report
     * @throws ModuleLoadException   if the store cannot be opened
     * @throws IllegalStateException if the module was already loaded
     */
    public synchronized ResolutionReport load() {
        if (loaded) {
            throw new IllegalStateException("Module is already loaded");
        }
        if (unloaded) {
            throw new IllegalStateException("Module has been unloaded");
        }
        try {
            store = storeOpener.open();
        } catch (IOException e) {
            throw new ModuleLoadException("Unable to open the Kafka entity store", e);
        }
        store.addObserver(Producer.class, bus);
        try {
            store.load();
        } catch (IOException e) {
            logger.atError()
                    .setCause(e)
                    .log("Unable to read the Kafka topology, starting with an empty one");
        }
        loaded = true;

        logger.atInfo()
                .addArgument(client.version())
                .log("Kafka module loaded, client version {}");
        resolver = TopologyResolver.create(store, client, ot, flushPolicy);
        return resolver.resolveAll();
    }

    /**
     * Reloads the store and resolves the whole topology again. Entities from
     * earlier passes are not torn down first.
     *
     * @return the new resolution report
     * @throws IOException if the store cannot be re-read; the previous
     *                     topology stays in place
     */
    public synchronized ResolutionReport reload() throws IOException {
        if (!loaded) {
            throw new IllegalStateException("Module is not loaded");
        }
        store.reload();
        return resolver.resolveAll();
    }

    public synchronized boolean isLoaded() {
        return loaded;
    }

    /**
     * Removes the lifecycle observer and closes the bus and the store. Safe
     * to call more than once.
     */
    public synchronized void unload() {
        if (unloaded) {
            return;
        }
        unloaded = true;
        loaded = false;
        closeStore();
        bus.close();
        logger.atInfo().log("Kafka module unloaded");
    }

    private void closeStore() {
        if (store != null) {
            store.removeObserver(Producer.class, bus);
            try {
                store.close();
            } catch (RuntimeException e) {
                logger.atWarn().setCause(e).log("Error closing the Kafka entity store");
            }
            store = null;
        }
    }
}
