package com.p14n.kafkatopology.store;

import com.p14n.kafkatopology.data.Cluster;
import com.p14n.kafkatopology.data.Consumer;
import com.p14n.kafkatopology.data.EntityType;
import com.p14n.kafkatopology.data.KafkaEntity;
import com.p14n.kafkatopology.data.Producer;
import com.p14n.kafkatopology.data.Topic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parses the {@code kafka.conf} topology file.
 *
 * <p>
 * The file is a sequence of sections, one per entity. The section name is
 * the entity id and the {@code type} key selects the entity kind:
 * </p>
 *
 * <pre>
 * ; bootstrap cluster
 * [main]
 * type = cluster
 * brokers = b1:9092,b2:9092
 *
 * [events]
 * type = producer
 * cluster = main
 *
 * [orders]
 * type = topic
 * topic = orders
 * producer = events
 * </pre>
 *
 * <p>
 * Lines starting with {@code ;} or {@code #} are comments, {@code =>} is
 * accepted in place of {@code =}. A section whose values break a field
 * constraint is logged and skipped; a line that is neither a section, a
 * comment nor a key/value pair fails the whole parse.
 * </p>
 */
public class KafkaConfParser {

    private static final Logger logger = LoggerFactory.getLogger(KafkaConfParser.class);

    private static final String TYPE = "type";

    private static final Set<String> CLUSTER_FIELDS = Set.of(TYPE, "brokers", "security_protocol",
            "sasl_mechanism", "sasl_username", "sasl_password", "client_id", "port", "ssl");
    private static final Set<String> ROLE_FIELDS = Set.of(TYPE, "cluster");
    private static final Set<String> TOPIC_FIELDS = Set.of(TYPE, "topic", "producer", "consumer");

    private static final Set<String> TRUE_VALUES = Set.of("yes", "true", "y", "t", "1", "on");
    private static final Set<String> FALSE_VALUES = Set.of("no", "false", "n", "f", "0", "off");

    /**
     * Parses the given lines into entities.
     *
     * @param lines      the file content, one element per line
     * @param sourceName name of the source used in error messages
     * @return the valid entities, in file order
     * @throws ConfigParseException if a line cannot be parsed
     */
    public List<KafkaEntity> parse(List<String> lines, String sourceName) throws ConfigParseException {
        List<Section> sections = new ArrayList<>();
        Section current = null;

        for (int i = 0; i < lines.size(); i++) {
            int lineNo = i + 1;
            String line = stripComment(lines.get(i)).trim();
            if (line.isEmpty()) {
                continue;
            }

            if (line.startsWith("[")) {
                int close = line.indexOf(']');
                if (close < 0) {
                    throw new ConfigParseException(sourceName, lineNo, "Unterminated section header");
                }
                String name = line.substring(1, close).trim();
                if (name.isEmpty()) {
                    throw new ConfigParseException(sourceName, lineNo, "Empty section name");
                }
                current = new Section(name, lineNo);
                sections.add(current);
                continue;
            }

            int arrow = line.indexOf("=>");
            int eq = arrow >= 0 ? arrow : line.indexOf('=');
            if (eq <= 0) {
                throw new ConfigParseException(sourceName, lineNo, "Expected 'key = value' but found '" + line + "'");
            }
            if (current == null) {
                throw new ConfigParseException(sourceName, lineNo, "Key/value pair outside of any section");
            }
            String key = line.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(eq + (arrow >= 0 ? 2 : 1)).trim();
            current.values.put(key, value);
        }

        List<KafkaEntity> result = new ArrayList<>();
        for (Section section : dedupe(sections, sourceName)) {
            toEntity(section, sourceName).ifPresent(result::add);
        }
        return result;
    }

    // Each type is its own namespace; a later section only replaces an earlier one of the same type.
    private Collection<Section> dedupe(List<Section> sections, String sourceName) {
        Map<String, Section> byTypeAndName = new LinkedHashMap<>();
        for (Section section : sections) {
            String type = section.get(TYPE, "").trim().toLowerCase(Locale.ROOT);
            Section previous = byTypeAndName.put(type + "/" + section.name, section);
            if (previous != null) {
                logger.atWarn()
                        .addArgument(section.name)
                        .addArgument(sourceName)
                        .addArgument(previous.line)
                        .addArgument(section.line)
                        .log("Section [{}] in {} declared at line {} is replaced by line {}");
            }
        }
        return byTypeAndName.values();
    }

    private Optional<KafkaEntity> toEntity(Section section, String sourceName) {
        String typeName = section.values.get(TYPE);
        if (typeName == null) {
            logger.atWarn()
                    .addArgument(section.name)
                    .addArgument(sourceName)
                    .log("Section [{}] in {} has no type, ignoring it");
            return Optional.empty();
        }
        Optional<EntityType> type = EntityType.fromConfigName(typeName);
        if (type.isEmpty()) {
            logger.atError()
                    .addArgument(section.name)
                    .addArgument(sourceName)
                    .addArgument(typeName)
                    .log("Section [{}] in {} has unknown type '{}', ignoring it");
            return Optional.empty();
        }

        try {
            switch (type.get()) {
                case CLUSTER:
                    warnUnknownKeys(section, CLUSTER_FIELDS, sourceName);
                    return Optional.of(cluster(section));
                case PRODUCER:
                    warnUnknownKeys(section, ROLE_FIELDS, sourceName);
                    return Optional.of(new Producer(section.name, section.get("cluster", "")));
                case CONSUMER:
                    warnUnknownKeys(section, ROLE_FIELDS, sourceName);
                    return Optional.of(new Consumer(section.name, section.get("cluster", "")));
                case TOPIC:
                    warnUnknownKeys(section, TOPIC_FIELDS, sourceName);
                    return Optional.of(new Topic(section.name,
                            section.get("topic", ""),
                            section.get("producer", ""),
                            section.get("consumer", "")));
                default:
                    return Optional.empty();
            }
        } catch (IllegalArgumentException e) {
            logger.atError()
                    .addArgument(typeName)
                    .addArgument(section.name)
                    .addArgument(sourceName)
                    .addArgument(section.line)
                    .addArgument(e.getMessage())
                    .log("Failed to apply {} [{}] from {} line {}: {}");
            return Optional.empty();
        }
    }

    private Cluster cluster(Section section) {
        String brokers = section.get("brokers", Cluster.DEFAULT_BROKERS);
        if (brokers.isBlank()) {
            throw new IllegalArgumentException("brokers cannot be empty");
        }
        return new Cluster(section.name,
                brokers,
                section.get("security_protocol", Cluster.DEFAULT_SECURITY_PROTOCOL),
                section.get("sasl_mechanism", Cluster.DEFAULT_SASL_MECHANISM),
                section.get("sasl_username", ""),
                section.get("sasl_password", ""),
                section.get("client_id", Cluster.DEFAULT_CLIENT_ID),
                parseUnsigned("port", section.get("port", String.valueOf(Cluster.DEFAULT_PORT))),
                parseBoolean("ssl", section.get("ssl", "no")));
    }

    private void warnUnknownKeys(Section section, Set<String> known, String sourceName) {
        for (String key : section.values.keySet()) {
            if (!known.contains(key)) {
                logger.atWarn()
                        .addArgument(key)
                        .addArgument(section.name)
                        .addArgument(sourceName)
                        .log("Unknown key '{}' in [{}] of {} ignored");
            }
        }
    }

    static int parseUnsigned(String field, String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new IllegalArgumentException(field + " must not be negative: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " is not an unsigned integer: " + value);
        }
    }

    static boolean parseBoolean(String field, String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(v)) {
            return true;
        }
        if (FALSE_VALUES.contains(v)) {
            return false;
        }
        throw new IllegalArgumentException(field + " is not a boolean: " + value);
    }

    private static String stripComment(String line) {
        String trimmed = line.stripLeading();
        if (trimmed.startsWith(";") || trimmed.startsWith("#")) {
            return "";
        }
        // "\;" is a literal semicolon
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == ';' && (i == 0 || line.charAt(i - 1) != '\\')) {
                return line.substring(0, i).replace("\\;", ";");
            }
        }
        return line.replace("\\;", ";");
    }

    private static final class Section {
        final String name;
        final int line;
        final Map<String, String> values = new LinkedHashMap<>();

        Section(String name, int line) {
            this.name = name;
            this.line = line;
        }

        String get(String key, String defaultValue) {
            String value = values.get(key);
            return value == null ? defaultValue : value;
        }
    }
}
