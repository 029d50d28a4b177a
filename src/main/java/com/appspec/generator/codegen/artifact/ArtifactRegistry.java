package com.appspec.generator.codegen.artifact;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.appspec.generator.codegen.exception.ConfigurationException;

/**
 * Per-run key/value store shared by the generators and hooks of one build.
 *
 * Keys are single-writer: a second write fails unless the writer declared an override for
 * that key. Reads of a missing key fail instead of returning null, so a unit can only rely
 * on artifacts whose producers it declared as requirements. Thread-safe; the scheduler
 * guarantees a reader only starts once every writer of its required keys has completed.
 */
public class ArtifactRegistry {

    private static final Logger log = LoggerFactory.getLogger(ArtifactRegistry.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public <T> void put(ArtifactKey<T> key, T value, String writerId) {
        put(key, value, writerId, false);
    }

    public <T> void put(ArtifactKey<T> key, T value, String writerId, boolean override) {
        key.cast(value);
        Entry entry = new Entry(key, value, writerId);
        if (override) {
            Entry previous = entries.put(key.getName(), entry);
            if (previous != null) {
                log.debug("Artifact '{}' overridden by '{}' (was '{}')", key, writerId, previous.writerId());
            }
            return;
        }
        Entry existing = entries.putIfAbsent(key.getName(), entry);
        if (existing != null) {
            throw new ConfigurationException(writerId, "Artifact '" + key + "' was already written by '"
                    + existing.writerId() + "'; '" + writerId + "' does not declare an override");
        }
    }

    public <T> T get(ArtifactKey<T> key) {
        Entry entry = entries.get(key.getName());
        if (entry == null) {
            throw new ConfigurationException(key.getName(), "Artifact '" + key + "' has not been produced");
        }
        try {
            return key.cast(entry.value());
        } catch (ClassCastException e) {
            throw new ConfigurationException(key.getName(), e.getMessage());
        }
    }

    public boolean contains(ArtifactKey<?> key) {
        return entries.containsKey(key.getName());
    }

    public Optional<String> writerOf(ArtifactKey<?> key) {
        return Optional.ofNullable(entries.get(key.getName())).map(Entry::writerId);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(new TreeSet<>(entries.keySet()));
    }

    /**
     * Sorted copy of every artifact, for diagnostics and the build result.
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> copy = new TreeMap<>();
        entries.forEach((name, entry) -> copy.put(name, entry.value()));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Sorted copy of the artifacts whose key is flagged for display to the caller.
     */
    public Map<String, Object> displayed() {
        Map<String, Object> copy = new TreeMap<>();
        entries.forEach((name, entry) -> {
            if (entry.key().isDisplayed()) {
                copy.put(name, entry.value());
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    private record Entry(ArtifactKey<?> key, Object value, String writerId) {
    }
}
