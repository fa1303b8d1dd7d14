package com.p14n.kafkatopology.store;

import com.p14n.kafkatopology.data.KafkaEntity;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;

/**
 * {@link EntitySource} reading a {@code kafka.conf} file from disk on every
 * call, so a reload picks up edits.
 */
public class KafkaConfFile implements EntitySource {

    public static final String DEFAULT_FILENAME = "kafka.conf";

    private final Path path;
    private final KafkaConfParser parser;

    public KafkaConfFile(Path path) {
        this(path, new KafkaConfParser());
    }

    public KafkaConfFile(Path path, KafkaConfParser parser) {
        this.path = path;
        this.parser = parser;
    }

    public Path path() {
        return path;
    }

    @Override
    public Collection<KafkaEntity> read() throws IOException {
        return parser.parse(Files.readAllLines(path, StandardCharsets.UTF_8), path.toString());
    }
}
