package com.appspec.generator.codegen.artifact;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed name of an artifact exchanged between pipeline units of one build run.
 *
 * Identity is the name alone; the payload type closes the contract between the producer and
 * its consumers. Keys flagged as {@linkplain #isDisplayed() displayed} are surfaced to the
 * caller in the build result (e.g. generated credentials).
 *
 * @param <T> payload type
 */
public final class ArtifactKey<T> implements Comparable<ArtifactKey<?>> {

    private final String name;
    private final Class<?> type;
    /** Element type of a list key; key and value types of a map key; empty otherwise. */
    private final List<Class<?>> elementTypes;
    private final boolean displayed;

    private ArtifactKey(String name, Class<?> type, List<Class<?>> elementTypes, boolean displayed) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Artifact key name must not be blank");
        }
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
        this.elementTypes = List.copyOf(elementTypes);
        this.displayed = displayed;
    }

    public static <T> ArtifactKey<T> of(String name, Class<T> type) {
        return new ArtifactKey<>(name, type, List.of(), false);
    }

    @SuppressWarnings("unchecked")
    public static <E> ArtifactKey<List<E>> listOf(String name, Class<E> elementType) {
        return (ArtifactKey<List<E>>) (ArtifactKey<?>) new ArtifactKey<>(name, List.class, List.of(elementType), false);
    }

    @SuppressWarnings("unchecked")
    public static <K, V> ArtifactKey<Map<K, V>> mapOf(String name, Class<K> keyType, Class<V> valueType) {
        return (ArtifactKey<Map<K, V>>) (ArtifactKey<?>) new ArtifactKey<>(name, Map.class,
                List.of(keyType, valueType), false);
    }

    /**
     * Untyped key for data shared across unrelated backends.
     */
    public static ArtifactKey<Object> generic(String name) {
        return new ArtifactKey<>(name, Object.class, List.of(), false);
    }

    /**
     * Same key, flagged for display to the caller.
     */
    public ArtifactKey<T> displayed() {
        return new ArtifactKey<>(name, type, elementTypes, true);
    }

    public String getName() {
        return name;
    }

    public Class<?> getType() {
        return type;
    }

    public boolean isDisplayed() {
        return displayed;
    }

    @SuppressWarnings("unchecked")
    T cast(Object value) {
        if (value == null) {
            return null;
        }
        check(value, type, "");
        if (value instanceof List<?> list && elementTypes.size() == 1) {
            list.forEach(element -> check(element, elementTypes.get(0), " element"));
        } else if (value instanceof Map<?, ?> map && elementTypes.size() == 2) {
            map.forEach((k, v) -> {
                check(k, elementTypes.get(0), " key");
                check(v, elementTypes.get(1), " value");
            });
        }
        return (T) value;
    }

    private void check(Object value, Class<?> expected, String part) {
        if (value != null && !expected.isInstance(value)) {
            throw new ClassCastException("Artifact '" + name + "'" + part + " is " + value.getClass().getName()
                    + ", expected " + expected.getName());
        }
    }

    @Override
    public int compareTo(ArtifactKey<?> other) {
        return name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArtifactKey<?> other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
