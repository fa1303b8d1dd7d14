package com.p14n.kafkatopology.store;

import com.p14n.kafkatopology.data.Consumer;
import com.p14n.kafkatopology.data.EntityType;
import com.p14n.kafkatopology.data.KafkaEntity;
import com.p14n.kafkatopology.data.Producer;
import com.p14n.kafkatopology.data.Topic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Thread-safe {@link EntityStore} holding the topology in memory, populated
 * from an {@link EntitySource}.
 *
 * <p>
 * Observers are called synchronously on the thread that changes the store.
 * An observer that throws is logged and skipped; it never prevents the
 * change or the notification of other observers.
 * </p>
 *
 * <pre>{@code
 * EntityStore store = new InMemoryEntityStore(new KafkaConfFile(Path.of("kafka.conf")));
 * store.addObserver(Producer.class, new LifecycleObserverBus(executor));
 * store.load();
 * List<Producer> producers = store.retrieveByField(Producer.class, EntityStore.FIELD_CLUSTER, "main");
 * }</pre>
 */
public class InMemoryEntityStore implements EntityStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryEntityStore.class);

    private final EntitySource source;
    private final Map<EntityType, Map<String, KafkaEntity>> entities = new EnumMap<>(EntityType.class);
    private final Map<EntityType, List<EntityObserver<KafkaEntity>>> observers = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object writeLock = new Object();

    public InMemoryEntityStore(EntitySource source) {
        this.source = Objects.requireNonNull(source, "source");
        for (EntityType type : EntityType.values()) {
            entities.put(type, new ConcurrentHashMap<>());
        }
    }

    /**
     * Creates an empty store whose source yields nothing; entities are added
     * with {@link #put(KafkaEntity)}.
     *
     * @return the store
     */
    public static InMemoryEntityStore empty() {
        return new InMemoryEntityStore(List::of);
    }

    @Override
    public void load() throws IOException {
        checkOpen();
        Collection<KafkaEntity> loaded = source.read();
        synchronized (writeLock) {
            for (KafkaEntity entity : loaded) {
                KafkaEntity previous = entities.get(entity.type()).put(entity.id(), entity);
                if (previous == null) {
                    notifyCreated(entity);
                } else if (!previous.equals(entity)) {
                    notifyUpdated(entity);
                }
            }
        }
        logger.atDebug().addArgument(loaded.size()).log("Loaded {} topology entities");
        notifyLoadedAll();
    }

    @Override
    public void reload() throws IOException {
        checkOpen();
        Collection<KafkaEntity> fresh = source.read();

        Map<EntityType, Map<String, KafkaEntity>> incoming = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            incoming.put(type, new HashMap<>());
        }
        for (KafkaEntity entity : fresh) {
            incoming.get(entity.type()).put(entity.id(), entity);
        }

        int created = 0;
        int updated = 0;
        int deleted = 0;
        synchronized (writeLock) {
            for (EntityType type : EntityType.values()) {
                Map<String, KafkaEntity> current = entities.get(type);
                Map<String, KafkaEntity> next = incoming.get(type);

                for (KafkaEntity existing : new ArrayList<>(current.values())) {
                    if (!next.containsKey(existing.id())) {
                        current.remove(existing.id());
                        notifyDeleted(existing);
                        deleted++;
                    }
                }
                for (KafkaEntity entity : next.values()) {
                    KafkaEntity previous = current.put(entity.id(), entity);
                    if (previous == null) {
                        notifyCreated(entity);
                        created++;
                    } else if (!previous.equals(entity)) {
                        notifyUpdated(entity);
                        updated++;
                    }
                }
            }
        }
        logger.atInfo()
                .addArgument(created)
                .addArgument(updated)
                .addArgument(deleted)
                .log("Reloaded topology: {} created, {} updated, {} deleted");
        notifyLoadedAll();
    }

    /**
     * Adds or replaces a single entity, notifying observers.
     *
     * @param entity the entity
     */
    public void put(KafkaEntity entity) {
        checkOpen();
        Objects.requireNonNull(entity, "entity");
        synchronized (writeLock) {
            KafkaEntity previous = entities.get(entity.type()).put(entity.id(), entity);
            if (previous == null) {
                notifyCreated(entity);
            } else if (!previous.equals(entity)) {
                notifyUpdated(entity);
            }
        }
    }

    /**
     * Removes a single entity, notifying observers.
     *
     * @param type the entity type
     * @param id   the entity id
     * @return true if the entity was present
     */
    public boolean remove(EntityType type, String id) {
        checkOpen();
        synchronized (writeLock) {
            KafkaEntity removed = entities.get(type).remove(id);
            if (removed != null) {
                notifyDeleted(removed);
                return true;
            }
            return false;
        }
    }

    @Override
    public <T extends KafkaEntity> List<T> retrieveAll(Class<T> type) {
        checkOpen();
        return entities.get(EntityType.of(type)).values().stream()
                .map(type::cast)
                .toList();
    }

    @Override
    public <T extends KafkaEntity> List<T> retrieveByField(Class<T> type, String field, String value) {
        checkOpen();
        if (field == null) {
            throw new IllegalArgumentException("Field cannot be null");
        }
        return entities.get(EntityType.of(type)).values().stream()
                .filter(e -> Objects.equals(fieldValue(e, field), value))
                .map(type::cast)
                .toList();
    }

    @Override
    public <T extends KafkaEntity> Optional<T> retrieve(Class<T> type, String id) {
        checkOpen();
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entities.get(EntityType.of(type)).get(id)).map(type::cast);
    }

    @Override
    public <T extends KafkaEntity> void addObserver(Class<T> type, EntityObserver<? super T> observer) {
        if (observer == null) {
            throw new IllegalArgumentException("Observer cannot be null");
        }
        // only entities of the registered type are ever dispatched to it
        @SuppressWarnings("unchecked")
        EntityObserver<KafkaEntity> typed = (EntityObserver<KafkaEntity>) observer;
        observers.computeIfAbsent(EntityType.of(type), k -> new CopyOnWriteArrayList<>()).add(typed);
    }

    @Override
    public <T extends KafkaEntity> boolean removeObserver(Class<T> type, EntityObserver<? super T> observer) {
        List<EntityObserver<KafkaEntity>> registered = observers.get(EntityType.of(type));
        return registered != null && registered.remove(observer);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            observers.clear();
            entities.values().forEach(Map::clear);
            logger.atDebug().log("Entity store closed");
        }
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Entity store is closed");
        }
    }

    private static String fieldValue(KafkaEntity entity, String field) {
        if (FIELD_ID.equals(field)) {
            return entity.id();
        }
        if (entity instanceof Producer p && FIELD_CLUSTER.equals(field)) {
            return p.clusterId();
        }
        if (entity instanceof Consumer c && FIELD_CLUSTER.equals(field)) {
            return c.clusterId();
        }
        if (entity instanceof Topic t) {
            switch (field) {
                case FIELD_PRODUCER:
                    return t.producerId();
                case FIELD_CONSUMER:
                    return t.consumerId();
                case FIELD_TOPIC:
                    return t.topic();
                default:
                    break;
            }
        }
        throw new EntityStoreException("Unknown field '" + field + "' for " + entity.type().configName());
    }

    private void notifyCreated(KafkaEntity entity) {
        dispatch(entity.type(), o -> o.created(entity));
    }

    private void notifyUpdated(KafkaEntity entity) {
        dispatch(entity.type(), o -> o.updated(entity));
    }

    private void notifyDeleted(KafkaEntity entity) {
        dispatch(entity.type(), o -> o.deleted(entity));
    }

    private void notifyLoadedAll() {
        for (EntityType type : EntityType.values()) {
            dispatch(type, o -> o.loaded(type));
        }
    }

    private void dispatch(EntityType type, java.util.function.Consumer<EntityObserver<KafkaEntity>> call) {
        List<EntityObserver<KafkaEntity>> registered = observers.get(type);
        if (registered == null) {
            return;
        }
        for (EntityObserver<KafkaEntity> observer : registered) {
            try {
                call.accept(observer);
            } catch (Exception e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(observer.getClass().getSimpleName())
                        .addArgument(type.configName())
                        .log("Observer {} failed handling {} change");
            }
        }
    }
}
