package com.p14n.kafkatopology.store;

import com.p14n.kafkatopology.data.Cluster;
import com.p14n.kafkatopology.data.KafkaEntity;
import com.p14n.kafkatopology.data.Topic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KafkaConfFileTest {

    @TempDir
    Path dir;

    @Test
    void readsFileAgainOnEveryCall() throws Exception {
        Path conf = dir.resolve(KafkaConfFile.DEFAULT_FILENAME);
        Files.write(conf, List.of("[main]", "type = cluster"), StandardCharsets.UTF_8);
        KafkaConfFile file = new KafkaConfFile(conf);

        assertEquals(1, file.read().size());

        Files.write(conf, List.of("[main]", "type = cluster", "[t]", "type = topic", "topic = orders"),
                StandardCharsets.UTF_8);
        Collection<KafkaEntity> second = file.read();
        assertEquals(2, second.size());
        assertTrue(second.contains(new Topic("t", "orders", "", "")));
    }

    @Test
    void loadsClasspathFixture() throws Exception {
        Path conf = dir.resolve("fixture.conf");
        try (var in = getClass().getResourceAsStream("/kafka-test.conf")) {
            assertNotNull(in);
            Files.copy(in, conf);
        }

        Collection<KafkaEntity> entities = new KafkaConfFile(conf).read();

        assertTrue(entities.contains(Cluster.withBrokers("main", "b1:9092")));
        assertEquals(4, entities.size());
    }

    @Test
    void missingFileIsAnIOException() {
        KafkaConfFile file = new KafkaConfFile(dir.resolve("absent.conf"));

        IOException e = assertThrows(IOException.class, file::read);
        assertInstanceOf(NoSuchFileException.class, e);
    }
}
