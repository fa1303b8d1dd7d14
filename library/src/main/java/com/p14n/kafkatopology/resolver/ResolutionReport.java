package com.p14n.kafkatopology.resolver;

import com.p14n.kafkatopology.FailureKind;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The outcome of one resolution pass, keyed by stage and entity id.
 * Structurally comparable: two passes over the same topology that met the
 * same failures are equal.
 */
public final class ResolutionReport {

    public enum Outcome {
        SUCCESS,
        FAILURE
    }

    public record Key(Stage stage, String id) implements Comparable<Key> {
        @Override
        public int compareTo(Key o) {
            int c = stage.compareTo(o.stage);
            return c != 0 ? c : id.compareTo(o.id);
        }
    }

    /**
     * @param kind  null for a success
     * @param cause null for a success
     */
    public record Entry(Key key, Outcome outcome, FailureKind kind, String cause) {
        public boolean isFailure() {
            return outcome == Outcome.FAILURE;
        }
    }

    private final Map<Key, Entry> entries;

    private ResolutionReport(Map<Key, Entry> entries) {
        this.entries = Collections.unmodifiableMap(new TreeMap<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Entry> entries() {
        return List.copyOf(entries.values());
    }

    public List<Entry> successes() {
        return entries.values().stream().filter(e -> !e.isFailure()).toList();
    }

    public List<Entry> failures() {
        return entries.values().stream().filter(Entry::isFailure).toList();
    }

    public List<Entry> failuresOf(FailureKind kind) {
        return entries.values().stream().filter(e -> e.kind() == kind).toList();
    }

    public Optional<Entry> outcome(Stage stage, String id) {
        return Optional.ofNullable(entries.get(new Key(stage, id)));
    }

    public boolean isClean() {
        return failures().isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ResolutionReport r && entries.equals(r.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "ResolutionReport{successes=" + successes().size() + ", failures=" + failures() + "}";
    }

    /**
     * Collects outcomes. A failure recorded for a key replaces an earlier
     * success; a success never replaces a failure.
     */
    public static final class Builder {

        private final Map<Key, Entry> entries = new TreeMap<>();

        private Builder() {
        }

        public Builder success(Stage stage, String id) {
            Key key = new Key(stage, id);
            entries.putIfAbsent(key, new Entry(key, Outcome.SUCCESS, null, null));
            return this;
        }

        public Builder failure(Stage stage, String id, FailureKind kind, String cause) {
            Key key = new Key(stage, id);
            Entry existing = entries.get(key);
            if (existing == null || !existing.isFailure()) {
                entries.put(key, new Entry(key, Outcome.FAILURE, kind, cause));
            }
            return this;
        }

        public ResolutionReport build() {
            return new ResolutionReport(entries);
        }
    }
}
