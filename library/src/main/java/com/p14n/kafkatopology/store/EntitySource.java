package com.p14n.kafkatopology.store;

import com.p14n.kafkatopology.data.KafkaEntity;

import java.io.IOException;
import java.util.Collection;

/**
 * Supplies the complete set of declared entities, read afresh on every call.
 */
@FunctionalInterface
public interface EntitySource {

    Collection<KafkaEntity> read() throws IOException;
}
